package io.chatflow.core.http;

/// Outbound HTTP capability used by HTTP request nodes.
///
/// A non-2xx status is a normal response here; the node decides whether it is a failure.
///
/// @implNote Implementations must be thread-safe.
/// @see JdkHttpTransport
@FunctionalInterface
public interface HttpTransport {

    /// Sends a request and waits for the response.
    ///
    /// @param request the rendered request, not null
    /// @return the response, never null
    /// @throws HttpTransportException if no response was received, including timeouts
    OutboundResponse send(OutboundRequest request) throws HttpTransportException;
}
