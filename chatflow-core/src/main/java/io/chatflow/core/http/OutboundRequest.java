package io.chatflow.core.http;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Fully rendered request handed to an {@link HttpTransport}.
///
/// @param method HTTP method, not null
/// @param url absolute URL, not null
/// @param headers request headers, never null
/// @param body request body, null for methods without a body
/// @param timeout per-call timeout, not null
public record OutboundRequest(
        HttpMethod method, String url, Map<String, String> headers, String body, Duration timeout) {

    public OutboundRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(url, "url must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        headers =
                headers != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(headers))
                        : Map.of();
    }
}
