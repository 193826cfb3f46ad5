package io.chatflow.core.execution.result;

import io.chatflow.core.graph.NodeKind;
import java.util.Map;
import java.util.Objects;

/// Structured reason a turn did not succeed.
///
/// ### Hierarchy
/// - {@link NodeError}: a specific node failed
///   - {@link NodeExecutionFailed}: its executor reported failure
///   - {@link UnknownNodeKind}: no executor is registered for its kind
/// - {@link BudgetExceeded}: the iteration cap stopped the turn
/// - {@link DeadEnd}: the walk stopped on a node with no edge to follow
///
/// Structural errors never appear here: invalid graphs are rejected before execution.
///
/// {@snippet :
/// String message = switch (error.kind()) {
///     case NODE_EXECUTION, UNKNOWN_NODE_KIND -> "Step failed: " + error.detail();
///     case EXECUTION_BUDGET_EXCEEDED -> "Conversation loop stopped";
///     case DEAD_END -> "No reply configured";
/// };
/// }
public sealed interface ExecutionError
        permits ExecutionError.NodeError, ExecutionError.BudgetExceeded, ExecutionError.DeadEnd {

    /// Error classification.
    enum Kind {
        NODE_EXECUTION,
        UNKNOWN_NODE_KIND,
        EXECUTION_BUDGET_EXCEEDED,
        DEAD_END
    }

    Kind kind();

    /// Human-readable detail, never null.
    String detail();

    /// Failure attributed to a specific node.
    sealed interface NodeError extends ExecutionError
            permits NodeExecutionFailed, UnknownNodeKind {

        String nodeId();

        NodeKind nodeKind();
    }

    /// A node's executor reported failure.
    ///
    /// @param nodeId the failing node, not null
    /// @param nodeKind its kind, not null
    /// @param detail the executor's error message, not null
    /// @param cause the underlying exception, may be null
    /// @param metadata executor diagnostics such as `error_type` or `status_code`, never null
    record NodeExecutionFailed(
            String nodeId,
            NodeKind nodeKind,
            String detail,
            Throwable cause,
            Map<String, Object> metadata)
            implements NodeError {

        public NodeExecutionFailed {
            Objects.requireNonNull(nodeId, "nodeId must not be null");
            Objects.requireNonNull(detail, "detail must not be null");
            metadata = metadata != null ? metadata : Map.of();
        }

        @Override
        public Kind kind() {
            return Kind.NODE_EXECUTION;
        }
    }

    /// The registry has no executor for a node's kind.
    ///
    /// @param nodeId the node that could not be dispatched, not null
    /// @param nodeKind the unregistered kind, not null
    record UnknownNodeKind(String nodeId, NodeKind nodeKind) implements NodeError {

        @Override
        public Kind kind() {
            return Kind.UNKNOWN_NODE_KIND;
        }

        @Override
        public String detail() {
            return "No executor registered for node kind '" + nodeKind + "' (node '" + nodeId + "')";
        }
    }

    /// The turn hit its iteration cap before reaching a response node.
    ///
    /// @param maxIterations the cap that was reached
    /// @param lastNodeId the last node executed, not null
    record BudgetExceeded(int maxIterations, String lastNodeId) implements ExecutionError {

        @Override
        public Kind kind() {
            return Kind.EXECUTION_BUDGET_EXCEEDED;
        }

        @Override
        public String detail() {
            return "Execution budget exceeded: "
                    + maxIterations
                    + " iterations without reaching a response node (last node '"
                    + lastNodeId
                    + "')";
        }
    }

    /// The walk reached a node with no edge to follow before any response node.
    ///
    /// @param nodeId the node where the walk stopped, not null
    /// @param reason why no edge applied, not null
    record DeadEnd(String nodeId, String reason) implements ExecutionError {

        @Override
        public Kind kind() {
            return Kind.DEAD_END;
        }

        @Override
        public String detail() {
            return "Execution stopped at node '" + nodeId + "': " + reason;
        }
    }
}
