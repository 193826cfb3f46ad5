package io.chatflow.core.execution.executor;

import io.chatflow.core.graph.Node;
import io.chatflow.core.graph.NodeKind;
import java.util.List;
import java.util.Map;

/// Strategy interface for executing one kind of chatflow node.
///
/// Each {@link NodeKind} has one executor, registered in a
/// {@link NodeExecutorRegistry}. Adding a kind means implementing this
/// interface and registering the implementation; the engine does not change.
///
/// ### Contracts
/// - **Postcondition**: `execute` never throws; timeouts, bad configuration and
///   downstream failures are returned as {@link NodeResult#failure(String, Throwable)}
/// - **Invariant**: implementations are stateless and thread-safe; all turn state
///   arrives through the {@link ExecutionContext}
///
/// ### Example implementation
/// {@snippet :
/// public class EchoNodeExecutor implements NodeExecutor {
///     public NodeKind getNodeKind() {
///         return NodeKind.of("echo");
///     }
///
///     public NodeResult execute(Node node, ExecutionContext context) {
///         return NodeResult.success(context.getUserMessage(), Map.of());
///     }
/// }
/// }
public interface NodeExecutor {

    /// Returns the node kind this executor handles. Used as the registry key.
    ///
    /// @return the handled kind, never null
    NodeKind getNodeKind();

    /// Executes the given node within the current turn.
    ///
    /// Only the node's `config` is interpreted; its id is used for reporting.
    ///
    /// @param node the node to execute, not null
    /// @param context the turn's context, not null
    /// @return the execution result, never null
    NodeResult execute(Node node, ExecutionContext context);

    /// Checks a node configuration before activation.
    ///
    /// @param config the node's configuration, not null
    /// @return human-readable problems, empty when the configuration is usable
    default List<String> validateConfig(Map<String, Object> config) {
        return List.of();
    }
}
