package io.chatflow.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown when a chatflow graph with structural errors is activated or executed.
///
/// Carries the ordered validation errors so callers can report all of them at once.
public class ChatflowValidationException extends RuntimeException {
    @Serial private static final long serialVersionUID = 2871537706413985210L;

    private final String chatflowId;
    private final List<String> errors;

    public ChatflowValidationException(String chatflowId, List<String> errors) {
        super("Chatflow '" + chatflowId + "' is invalid: " + String.join("; ", errors));
        this.chatflowId = chatflowId;
        this.errors = List.copyOf(errors);
    }

    public String getChatflowId() {
        return chatflowId;
    }

    public List<String> getErrors() {
        return errors;
    }
}
