package io.chatflow.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Raw, user-authored chatflow definition before graph construction.
///
/// A definition is plain data: ordered nodes, ordered edges, workflow-level
/// variables that seed every turn, and execution settings. It performs no
/// structural validation; that is the job of {@link GraphBuilder}.
///
/// Declaration order of nodes and edges is preserved because cycle reporting,
/// topological ordering and first-edge selection depend on it.
///
/// @implNote Immutable and thread-safe after construction.
/// @see GraphBuilder#build(ChatflowDefinition)
public final class ChatflowDefinition {

    private final String id;
    private final String name;
    private final int version;
    private final List<Node> nodes;
    private final List<Edge> edges;
    private final Map<String, Object> variables;
    private final ChatflowSettings settings;

    private ChatflowDefinition(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Chatflow ID required");
        this.name = builder.name != null ? builder.name : builder.id;
        this.version = builder.version;
        this.nodes = List.copyOf(builder.nodes);
        this.edges = List.copyOf(builder.edges);
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
        this.settings = builder.settings != null ? builder.settings : ChatflowSettings.DEFAULTS;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getVersion() {
        return version;
    }

    public List<Node> getNodes() {
        return nodes;
    }

    public List<Edge> getEdges() {
        return edges;
    }

    /// Returns the workflow-level variables copied into every turn's context.
    ///
    /// @return unmodifiable variables map, never null
    public Map<String, Object> getVariables() {
        return variables;
    }

    public ChatflowSettings getSettings() {
        return settings;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link ChatflowDefinition}.
    public static final class Builder {
        private String id;
        private String name;
        private int version = 1;
        private final List<Node> nodes = new ArrayList<>();
        private final List<Edge> edges = new ArrayList<>();
        private final Map<String, Object> variables = new LinkedHashMap<>();
        private ChatflowSettings settings;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder node(Node node) {
            this.nodes.add(Objects.requireNonNull(node, "node must not be null"));
            return this;
        }

        public Builder nodes(List<Node> nodes) {
            nodes.forEach(this::node);
            return this;
        }

        public Builder edge(Edge edge) {
            this.edges.add(Objects.requireNonNull(edge, "edge must not be null"));
            return this;
        }

        public Builder edges(List<Edge> edges) {
            edges.forEach(this::edge);
            return this;
        }

        public Builder variable(String name, Object value) {
            this.variables.put(name, value);
            return this;
        }

        public Builder variables(Map<String, Object> variables) {
            if (variables != null) {
                this.variables.putAll(variables);
            }
            return this;
        }

        public Builder settings(ChatflowSettings settings) {
            this.settings = settings;
            return this;
        }

        public ChatflowDefinition build() {
            return new ChatflowDefinition(this);
        }
    }
}
