package io.chatflow.core.http;

import java.io.Serial;

/// Network-level failure of an outbound call: no HTTP response was received.
public class HttpTransportException extends Exception {
    @Serial private static final long serialVersionUID = -1882466103542707318L;

    private final boolean timedOut;

    public HttpTransportException(String message, Throwable cause, boolean timedOut) {
        super(message, cause);
        this.timedOut = timedOut;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
