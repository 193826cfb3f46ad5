package io.chatflow.core.condition;

import java.io.Serial;

public class ConditionEvaluationException extends Exception {
    @Serial private static final long serialVersionUID = 3092758317260472290L;

    public ConditionEvaluationException(String message) {
        super(message);
    }

    public ConditionEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
