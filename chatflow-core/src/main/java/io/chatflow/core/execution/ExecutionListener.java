package io.chatflow.core.execution;

import io.chatflow.core.execution.executor.NodeResult;
import io.chatflow.core.execution.result.ExecutionResult;
import io.chatflow.core.graph.Graph;
import io.chatflow.core.graph.Node;

/// Listener for turn execution lifecycle events.
///
/// All methods have default no-op implementations, so listeners override
/// only the events they care about.
///
/// ### Callback Lifecycle
/// ```
/// onTurnStart(graph, input)
/// onNodeStart(node)              repeated per executed node
/// onNodeComplete(node, result)
/// onTurnComplete(result)
/// ```
///
/// @implNote A listener may be shared by concurrent turns and must then be
/// thread-safe. Exceptions thrown by a listener are logged and ignored.
/// @see ChatflowEngine#execute(Graph, TurnInput, ExecutionListener)
public interface ExecutionListener {

    default void onTurnStart(Graph graph, TurnInput input) {}

    default void onNodeStart(Node node) {}

    /// Called after a node's executor returned, before the engine routes on the result.
    ///
    /// @param node the executed node, not null
    /// @param result the node result, not null
    default void onNodeComplete(Node node, NodeResult result) {}

    default void onTurnComplete(ExecutionResult result) {}

    /// No-op listener instance that ignores all events.
    ExecutionListener NOOP = new ExecutionListener() {};
}
