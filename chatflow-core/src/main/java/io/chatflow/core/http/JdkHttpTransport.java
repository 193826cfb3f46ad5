package io.chatflow.core.http;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

/// {@link HttpTransport} on top of `java.net.http.HttpClient`.
///
/// Adds `Content-Type: application/json` when a body is present and no content
/// type was given. The request timeout comes from {@link OutboundRequest#timeout()}.
///
/// @implNote Thread-safe; one client is shared by all calls.
public class JdkHttpTransport implements HttpTransport {

    private static final Logger logger = Logger.getLogger(JdkHttpTransport.class.getName());

    private final HttpClient httpClient;

    public JdkHttpTransport() {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    public JdkHttpTransport(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public OutboundResponse send(OutboundRequest request) throws HttpTransportException {
        HttpRequest httpRequest;
        try {
            httpRequest = toHttpRequest(request);
        } catch (IllegalArgumentException e) {
            throw new HttpTransportException("Invalid request to " + request.url() + ": " + e.getMessage(), e, false);
        }

        try {
            HttpResponse<String> response =
                    httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            logger.fine("HTTP " + request.method() + " " + request.url() + " -> " + response.statusCode());
            return new OutboundResponse(response.statusCode(), response.body());
        } catch (HttpTimeoutException e) {
            throw new HttpTransportException(
                    "Request timed out after " + request.timeout().toSeconds() + "s", e, true);
        } catch (IOException e) {
            throw new HttpTransportException("HTTP call failed: " + e.getMessage(), e, false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpTransportException("HTTP call interrupted", e, false);
        }
    }

    private static HttpRequest toHttpRequest(OutboundRequest request) {
        HttpRequest.Builder builder =
                HttpRequest.newBuilder().uri(URI.create(request.url())).timeout(request.timeout());

        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }

        if (request.body() == null) {
            return builder.method(request.method().name(), HttpRequest.BodyPublishers.noBody())
                    .build();
        }

        boolean hasContentType =
                request.headers().keySet().stream().anyMatch("Content-Type"::equalsIgnoreCase);
        if (!hasContentType) {
            builder.header("Content-Type", "application/json");
        }
        return builder.method(
                        request.method().name(), HttpRequest.BodyPublishers.ofString(request.body()))
                .build();
    }
}
