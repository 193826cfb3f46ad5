package io.chatflow.core.http;

import java.util.Locale;
import java.util.Optional;

/// HTTP methods accepted by the HTTP request node.
public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE;

    /// Parses a method name, ignoring case.
    ///
    /// @param name the method name, may be null
    /// @return the method, or empty for null or unsupported names
    public static Optional<HttpMethod> parse(String name) {
        if (name == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /// Returns true when requests with this method carry a JSON body.
    public boolean carriesBody() {
        return this == POST || this == PUT || this == PATCH;
    }
}
