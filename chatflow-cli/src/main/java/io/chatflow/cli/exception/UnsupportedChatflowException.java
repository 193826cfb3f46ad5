package io.chatflow.cli.exception;

import java.io.Serial;

/// Raised when a command cannot locate or read the chatflow file it was given.
public class UnsupportedChatflowException extends Exception {
    @Serial private static final long serialVersionUID = 4113652180955372861L;

    public UnsupportedChatflowException(String message) {
        super(message);
    }

    public UnsupportedChatflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
