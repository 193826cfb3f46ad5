package io.chatflow.core.inference;

import java.io.Serial;

/// Failure of an inference call, classified so node results can report it precisely.
public class InferenceException extends Exception {
    @Serial private static final long serialVersionUID = -3304127734571092271L;

    /// Classification of an inference failure.
    public enum ErrorType {
        TIMEOUT,
        AUTHENTICATION,
        RATE_LIMITED,
        INVALID_REQUEST,
        UNKNOWN
    }

    private final ErrorType errorType;

    public InferenceException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType != null ? errorType : ErrorType.UNKNOWN;
    }

    public InferenceException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType != null ? errorType : ErrorType.UNKNOWN;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
