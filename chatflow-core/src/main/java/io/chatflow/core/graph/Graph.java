package io.chatflow.core.graph;

import io.chatflow.core.exception.ChatflowValidationException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Immutable, validated execution graph of one chatflow version.
///
/// Produced by {@link GraphBuilder}. A graph carries its derived adjacency
/// structures together with the validation outcome, so callers never have to
/// re-run validation. Editing a definition produces a new graph; an existing
/// instance is never mutated.
///
/// ### Structure
/// - `nodes`: id to node, in declaration order
/// - `adjacency`: id to ordered target ids
/// - `reverseAdjacency`: id to ordered source ids
/// - `start`: the single node without incoming edges
/// - `endNodes`: nodes without outgoing edges
///
/// ### Contracts
/// - **Invariant**: every id in the adjacency maps is a key of `nodes`
/// - **Invariant**: `isValid()` is true iff `getErrors()` is empty
///
/// @implNote Immutable and thread-safe. Concurrent turns share one instance.
/// @see GraphBuilder
/// @see GraphValidator
public final class Graph {

    private final String chatflowId;
    private final int version;
    private final Map<String, Node> nodes;
    private final Map<String, List<String>> adjacency;
    private final Map<String, List<String>> reverseAdjacency;
    private final Map<String, List<Edge>> outgoingEdges;
    private final List<String> startCandidates;
    private final List<String> endNodes;
    private final Map<String, Object> variables;
    private final ChatflowSettings settings;
    private final List<String> errors;

    Graph(
            String chatflowId,
            int version,
            Map<String, Node> nodes,
            Map<String, List<String>> adjacency,
            Map<String, List<String>> reverseAdjacency,
            Map<String, List<Edge>> outgoingEdges,
            List<String> startCandidates,
            List<String> endNodes,
            Map<String, Object> variables,
            ChatflowSettings settings,
            List<String> errors) {
        this.chatflowId = chatflowId;
        this.version = version;
        this.nodes = nodes;
        this.adjacency = adjacency;
        this.reverseAdjacency = reverseAdjacency;
        this.outgoingEdges = outgoingEdges;
        this.startCandidates = startCandidates;
        this.endNodes = endNodes;
        this.variables = variables;
        this.settings = settings;
        this.errors = List.copyOf(errors);
    }

    Graph withErrors(List<String> validationErrors) {
        return new Graph(
                chatflowId,
                version,
                nodes,
                adjacency,
                reverseAdjacency,
                outgoingEdges,
                startCandidates,
                endNodes,
                variables,
                settings,
                validationErrors);
    }

    public String getChatflowId() {
        return chatflowId;
    }

    public int getVersion() {
        return version;
    }

    /// Returns all nodes keyed by id, in declaration order.
    public Map<String, Node> getNodes() {
        return nodes;
    }

    public Optional<Node> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public int size() {
        return nodes.size();
    }

    public Map<String, List<String>> getAdjacency() {
        return adjacency;
    }

    public Map<String, List<String>> getReverseAdjacency() {
        return reverseAdjacency;
    }

    /// Returns the ordered target ids of the given node.
    ///
    /// @param nodeId the source node id, not null
    /// @return target ids in edge declaration order, empty for unknown ids
    public List<String> successors(String nodeId) {
        return adjacency.getOrDefault(nodeId, List.of());
    }

    /// Returns the ordered outgoing edges of the given node, labels included.
    ///
    /// @param nodeId the source node id, not null
    /// @return outgoing edges in declaration order, empty for unknown ids
    public List<Edge> outgoingEdges(String nodeId) {
        return outgoingEdges.getOrDefault(nodeId, List.of());
    }

    /// Returns the start node id when exactly one start candidate exists.
    public Optional<String> getStart() {
        return startCandidates.size() == 1 ? Optional.of(startCandidates.get(0)) : Optional.empty();
    }

    /// Returns every node without incoming edges, in declaration order.
    public List<String> getStartCandidates() {
        return startCandidates;
    }

    public List<String> getEndNodes() {
        return endNodes;
    }

    /// Returns the definition-level variables seeded into every turn.
    public Map<String, Object> getVariables() {
        return variables;
    }

    public ChatflowSettings getSettings() {
        return settings;
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /// Returns the ordered, human-readable validation errors.
    ///
    /// @return unmodifiable error list, empty when the graph is valid
    public List<String> getErrors() {
        return errors;
    }

    /// Throws when the graph failed validation.
    ///
    /// @return this graph, for chaining
    /// @throws ChatflowValidationException if the graph has validation errors
    public Graph requireValid() {
        if (!isValid()) {
            throw new ChatflowValidationException(chatflowId, errors);
        }
        return this;
    }
}
