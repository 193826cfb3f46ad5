package io.chatflow.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A typed unit of work in a chatflow graph.
///
/// The `config` map is opaque to the graph and the engine. Only the executor
/// registered for {@link #kind()} interprets it.
///
/// @param id unique identifier within a graph, not blank
/// @param kind dispatch key for the executor registry, not null
/// @param config executor-specific configuration, deep-copied and unmodifiable, never null
///     (empty when absent)
public record Node(String id, NodeKind kind, Map<String, Object> config) {

    public Node {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank");
        }
        config = config == null ? Map.of() : copyMap(config);
    }

    /// Creates a node with an empty configuration.
    public static Node of(String id, NodeKind kind) {
        return new Node(id, kind, Map.of());
    }

    /// Creates a node with the given configuration.
    public static Node of(String id, NodeKind kind, Map<String, Object> config) {
        return new Node(id, kind, config);
    }

    /// Returns true when this node has the given kind.
    public boolean is(NodeKind other) {
        return kind.equals(other);
    }

    private static <K> Map<K, Object> copyMap(Map<K, ?> source) {
        Map<K, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, copyValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    // Nested maps and lists are copied too; a built graph must not see caller edits.
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(copyValue(item)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
