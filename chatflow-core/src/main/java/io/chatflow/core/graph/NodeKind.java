package io.chatflow.core.graph;

import java.util.Locale;
import java.util.Objects;

/// Kind of a chatflow node, used as the dispatch key into the executor registry.
///
/// The five built-in kinds are exposed as constants. The set is open: any other
/// name is a valid kind and only needs an executor registered under it.
///
/// Names are normalized to lower case, so `"LLM"` and `"llm"` denote the same kind.
///
/// @param name the wire name of the kind, never blank
/// @see io.chatflow.core.execution.executor.NodeExecutorRegistry
public record NodeKind(String name) {

    public static final NodeKind TRIGGER = new NodeKind("trigger");
    public static final NodeKind LLM = new NodeKind("llm");
    public static final NodeKind HTTP_REQUEST = new NodeKind("http_request");
    public static final NodeKind CONDITION = new NodeKind("condition");
    public static final NodeKind RESPONSE = new NodeKind("response");

    public NodeKind {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Node kind name must not be blank");
        }
        name = name.trim().toLowerCase(Locale.ROOT);
    }

    /// Returns the kind for the given wire name.
    ///
    /// @param name the wire name, not null or blank
    /// @return the kind, never null
    public static NodeKind of(String name) {
        return new NodeKind(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
