package io.chatflow.core.execution.result;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Outcome of one turn.
///
/// ### Contracts
/// - **Invariant**: `success()` iff status is `SUCCEEDED` iff `error()` is empty
/// - **Invariant**: `nodesExecuted` ends with the failing node on failure and
///   never contains a node after it
///
/// @param status terminal state, never `RUNNING`
/// @param outputText the response node's rendered output, empty unless succeeded
/// @param nodesExecuted executed node ids in order, never null
/// @param timings per-execution latencies in order, never null
/// @param error failure detail, null when succeeded
/// @param responseNodeId the response node that ended the turn, null unless succeeded
/// @param totalDuration wall-clock duration of the turn, not null
public record ExecutionResult(
        ExecutionStatus status,
        String outputText,
        List<String> nodesExecuted,
        List<NodeTiming> timings,
        ExecutionError error,
        String responseNodeId,
        Duration totalDuration) {

    public ExecutionResult {
        Objects.requireNonNull(status, "status must not be null");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Result status must be terminal: " + status);
        }
        if ((status == ExecutionStatus.SUCCEEDED) != (error == null)) {
            throw new IllegalArgumentException("error must be present iff the turn did not succeed");
        }
        outputText = outputText != null ? outputText : "";
        nodesExecuted = List.copyOf(nodesExecuted);
        timings = List.copyOf(timings);
        totalDuration = totalDuration != null ? totalDuration : Duration.ZERO;
    }

    public boolean success() {
        return status == ExecutionStatus.SUCCEEDED;
    }

    public Optional<ExecutionError> getError() {
        return Optional.ofNullable(error);
    }
}
