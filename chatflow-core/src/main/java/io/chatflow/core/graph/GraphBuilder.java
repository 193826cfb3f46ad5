package io.chatflow.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Builds an immutable {@link Graph} from ordered node and edge lists and validates it.
///
/// Adjacency and reverse adjacency are derived in O(N+E). Start candidates are
/// nodes with no incoming edges; end nodes are nodes with no outgoing edges.
///
/// Reference problems are reported before the structural checks: a duplicate
/// node id keeps its first declaration, and an edge naming an unknown node is
/// left out of the adjacency.
///
/// {@snippet :
/// Graph graph = new GraphBuilder().build(List.of(
///         Node.of("t1", NodeKind.TRIGGER),
///         Node.of("r1", NodeKind.RESPONSE, Map.of("message", "{{input}}"))),
///     List.of(Edge.of("t1", "r1")));
/// }
///
/// ### Contracts
/// - **Postcondition**: identical input yields a structurally identical graph
/// - **Postcondition**: never throws for malformed structure; problems land in `getErrors()`
///
/// @implNote Pure and stateless; safe to share across threads.
/// @see GraphValidator
public final class GraphBuilder {

    private static final Logger logger = Logger.getLogger(GraphBuilder.class.getName());
    private static final String INLINE_ID = "inline";

    private final GraphValidator validator;

    public GraphBuilder() {
        this(new GraphValidator());
    }

    public GraphBuilder(GraphValidator validator) {
        this.validator = validator;
    }

    /// Builds a graph from raw node and edge lists.
    ///
    /// @param nodes nodes in declaration order, not null
    /// @param edges edges in declaration order, not null
    /// @return validated graph, never null
    public Graph build(List<Node> nodes, List<Edge> edges) {
        return build(ChatflowDefinition.builder().id(INLINE_ID).nodes(nodes).edges(edges).build());
    }

    /// Builds a graph from a chatflow definition.
    ///
    /// @param definition the definition to build, not null
    /// @return validated graph, never null
    public Graph build(ChatflowDefinition definition) {
        List<String> referenceErrors = new ArrayList<>();

        Map<String, Node> nodes = new LinkedHashMap<>();
        for (Node node : definition.getNodes()) {
            if (nodes.putIfAbsent(node.id(), node) != null) {
                referenceErrors.add("Duplicate node id: '" + node.id() + "'");
            }
        }

        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        Map<String, List<String>> reverse = new LinkedHashMap<>();
        Map<String, List<Edge>> outgoing = new LinkedHashMap<>();
        for (String id : nodes.keySet()) {
            adjacency.put(id, new ArrayList<>());
            reverse.put(id, new ArrayList<>());
            outgoing.put(id, new ArrayList<>());
        }

        for (Edge edge : definition.getEdges()) {
            boolean knownSource = nodes.containsKey(edge.source());
            boolean knownTarget = nodes.containsKey(edge.target());
            if (!knownSource || !knownTarget) {
                referenceErrors.add(
                        "Edge "
                                + edge
                                + " references unknown node '"
                                + (knownSource ? edge.target() : edge.source())
                                + "'");
                continue;
            }
            adjacency.get(edge.source()).add(edge.target());
            reverse.get(edge.target()).add(edge.source());
            outgoing.get(edge.source()).add(edge);
        }

        List<String> starts = new ArrayList<>();
        List<String> ends = new ArrayList<>();
        for (String id : nodes.keySet()) {
            if (reverse.get(id).isEmpty()) {
                starts.add(id);
            }
            if (adjacency.get(id).isEmpty()) {
                ends.add(id);
            }
        }

        Graph unvalidated =
                new Graph(
                        definition.getId(),
                        definition.getVersion(),
                        Collections.unmodifiableMap(nodes),
                        freeze(adjacency),
                        freeze(reverse),
                        freeze(outgoing),
                        List.copyOf(starts),
                        List.copyOf(ends),
                        definition.getVariables(),
                        definition.getSettings(),
                        List.of());

        ValidationReport report =
                ValidationReport.of(referenceErrors).and(validator.validate(unvalidated));

        if (!report.valid()) {
            logger.fine(
                    "Chatflow '"
                            + definition.getId()
                            + "' failed validation with "
                            + report.errors().size()
                            + " error(s)");
        }
        return unvalidated.withErrors(report.errors());
    }

    private static <T> Map<String, List<T>> freeze(Map<String, List<T>> source) {
        Map<String, List<T>> frozen = new LinkedHashMap<>();
        source.forEach((key, value) -> frozen.put(key, List.copyOf(value)));
        return Collections.unmodifiableMap(frozen);
    }
}
