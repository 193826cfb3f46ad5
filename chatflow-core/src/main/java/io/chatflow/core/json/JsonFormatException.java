package io.chatflow.core.json;

import java.io.Serial;

public class JsonFormatException extends Exception {
    @Serial private static final long serialVersionUID = -7708213530874466049L;

    public JsonFormatException(String message) {
        super(message);
    }

    public JsonFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
