package io.chatflow.core.execution.executor;

import io.chatflow.core.graph.NodeKind;
import java.util.Optional;
import java.util.Set;

/// Read-only lookup from node kind to executor.
///
/// @implNote Implementations must be safe for concurrent lookups; registration
/// happens once, before the registry is shared.
/// @see DefaultNodeExecutorRegistry
public interface NodeExecutorRegistry {

    /// Returns the executor for a kind, if one is registered.
    Optional<NodeExecutor> getExecutor(NodeKind kind);

    /// Returns the executor for a kind.
    ///
    /// @param kind the node kind, not null
    /// @return the registered executor, never null
    /// @throws NodeExecutorNotFound if no executor handles the kind
    NodeExecutor getExecutorOrThrow(NodeKind kind) throws NodeExecutorNotFound;

    boolean hasExecutor(NodeKind kind);

    /// Returns every registered kind.
    Set<NodeKind> registeredKinds();
}
