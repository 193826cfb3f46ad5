package io.chatflow.core.execution.executor;

import io.chatflow.core.graph.NodeKind;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Immutable {@link NodeExecutorRegistry} assembled once at startup.
///
/// {@snippet :
/// NodeExecutorRegistry registry = DefaultNodeExecutorRegistry.builder()
///     .register(new TriggerNodeExecutor())
///     .register(new ResponseNodeExecutor(templateResolver, jsonCodec))
///     .build();
/// }
///
/// Registering a second executor for the same kind replaces the first, which
/// lets callers override a built-in executor before the registry is built.
///
/// @implNote Immutable and thread-safe after {@link Builder#build()}.
public final class DefaultNodeExecutorRegistry implements NodeExecutorRegistry {

    private final Map<NodeKind, NodeExecutor> executors;

    private DefaultNodeExecutorRegistry(Map<NodeKind, NodeExecutor> executors) {
        this.executors = Map.copyOf(executors);
    }

    @Override
    public Optional<NodeExecutor> getExecutor(NodeKind kind) {
        return Optional.ofNullable(executors.get(kind));
    }

    @Override
    public NodeExecutor getExecutorOrThrow(NodeKind kind) throws NodeExecutorNotFound {
        return getExecutor(kind).orElseThrow(() -> new NodeExecutorNotFound(kind));
    }

    @Override
    public boolean hasExecutor(NodeKind kind) {
        return executors.containsKey(kind);
    }

    @Override
    public Set<NodeKind> registeredKinds() {
        return executors.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Collects executors before the registry is frozen.
    ///
    /// @implNote **Not thread-safe**.
    public static final class Builder {
        private final Map<NodeKind, NodeExecutor> executors = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(NodeExecutor executor) {
            Objects.requireNonNull(executor, "executor must not be null");
            executors.put(executor.getNodeKind(), executor);
            return this;
        }

        public DefaultNodeExecutorRegistry build() {
            return new DefaultNodeExecutorRegistry(executors);
        }
    }
}
