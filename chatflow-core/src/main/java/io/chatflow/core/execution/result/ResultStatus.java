package io.chatflow.core.execution.result;

/// Outcome of a single node execution.
public enum ResultStatus {
    SUCCESS,
    FAILURE
}
