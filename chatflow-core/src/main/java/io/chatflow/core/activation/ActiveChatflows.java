package io.chatflow.core.activation;

import io.chatflow.core.graph.Graph;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/// Current graph snapshot per chatflow id.
///
/// Publishing a new version replaces the reference atomically. Turns that
/// already fetched the previous graph keep running against it; only turns
/// that start afterwards see the new version.
///
/// @implNote Thread-safe. Graphs are immutable, so handing out the shared
/// instance is safe.
/// @see ChatflowActivator
public final class ActiveChatflows {

    private final Map<String, Graph> graphs = new ConcurrentHashMap<>();

    /// Publishes a valid graph as the current snapshot of its chatflow.
    ///
    /// @param graph the graph to publish, not null
    /// @return the previously active graph, if any
    /// @throws io.chatflow.core.exception.ChatflowValidationException if the graph is invalid
    public Optional<Graph> publish(Graph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        graph.requireValid();
        return Optional.ofNullable(graphs.put(graph.getChatflowId(), graph));
    }

    /// Returns the snapshot a new turn should run against.
    public Optional<Graph> current(String chatflowId) {
        Objects.requireNonNull(chatflowId, "chatflowId must not be null");
        return Optional.ofNullable(graphs.get(chatflowId));
    }

    /// Removes a chatflow; in-flight turns are unaffected.
    ///
    /// @return true if the chatflow was active
    public boolean deactivate(String chatflowId) {
        return graphs.remove(chatflowId) != null;
    }

    public Set<String> activeIds() {
        return Set.copyOf(graphs.keySet());
    }
}
