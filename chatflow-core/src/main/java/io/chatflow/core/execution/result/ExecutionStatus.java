package io.chatflow.core.execution.result;

/// States of a turn. `RUNNING` is transient; results always carry a terminal state.
public enum ExecutionStatus {
    RUNNING,
    SUCCEEDED,
    FAILED,
    ABORTED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
