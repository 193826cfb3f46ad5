package io.chatflow.core.http;

/// Response returned by an {@link HttpTransport}.
///
/// @param status HTTP status code
/// @param body response body as text, never null
public record OutboundResponse(int status, String body) {

    public OutboundResponse {
        body = body != null ? body : "";
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
