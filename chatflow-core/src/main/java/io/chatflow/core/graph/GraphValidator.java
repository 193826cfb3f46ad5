package io.chatflow.core.graph;

import java.util.ArrayList;
import java.util.List;

/// Structural validation of a chatflow graph.
///
/// Errors are collected in a fixed order so reports are stable and testable:
///
/// 1. missing start node
/// 2. multiple start nodes
/// 3. missing end node
/// 4. cycle, with its path
/// 5. nodes disconnected from the start
/// 6. missing trigger node, missing response node
///
/// With strict branching enabled, two more checks follow: a non-condition
/// node may have at most one outgoing edge, and every edge leaving a
/// condition node must be labeled `true` or `false`.
///
/// ### Contracts
/// - **Precondition**: the graph's adjacency only references known node ids
/// - **Postcondition**: the report is valid iff no check produced an error
///
/// @implNote Stateless and thread-safe.
/// @see CycleDetector
/// @see ReachabilityAnalyzer
public final class GraphValidator {

    private final CycleDetector cycleDetector = new CycleDetector();
    private final ReachabilityAnalyzer reachabilityAnalyzer = new ReachabilityAnalyzer();
    private final boolean strictBranching;

    /// Creates a validator running only the structural checks.
    public GraphValidator() {
        this(false);
    }

    /// Creates a validator.
    ///
    /// @param strictBranching whether to reject ambiguous multi-edge nodes and unlabeled
    ///     condition edges
    public GraphValidator(boolean strictBranching) {
        this.strictBranching = strictBranching;
    }

    /// Validates the structure of a graph.
    ///
    /// @param graph the graph to validate, not null
    /// @return ordered validation report, never null
    public ValidationReport validate(Graph graph) {
        List<String> errors = new ArrayList<>();
        List<String> starts = graph.getStartCandidates();

        if (starts.isEmpty()) {
            errors.add("No start node found (node with no incoming edges)");
        } else if (starts.size() > 1) {
            errors.add("Multiple start nodes found: " + starts);
        }

        if (graph.getEndNodes().isEmpty()) {
            errors.add("No end node found (node with no outgoing edges)");
        }

        cycleDetector
                .detect(graph)
                .cyclePath()
                .ifPresent(path -> errors.add("Cycle detected in graph: " + path));

        if (!starts.isEmpty()) {
            List<String> disconnected =
                    reachabilityAnalyzer.disconnectedFrom(graph, starts.get(0));
            if (!disconnected.isEmpty()) {
                errors.add("Disconnected nodes found: " + disconnected);
            }
        }

        if (noneOfKind(graph, NodeKind.TRIGGER)) {
            errors.add("No trigger node found");
        }
        if (noneOfKind(graph, NodeKind.RESPONSE)) {
            errors.add("No response node found");
        }

        if (strictBranching) {
            errors.addAll(branchingErrors(graph));
        }

        return ValidationReport.of(errors);
    }

    private static boolean noneOfKind(Graph graph, NodeKind kind) {
        return graph.getNodes().values().stream().noneMatch(node -> node.is(kind));
    }

    private static List<String> branchingErrors(Graph graph) {
        List<String> errors = new ArrayList<>();
        for (Node node : graph.getNodes().values()) {
            List<Edge> outgoing = graph.outgoingEdges(node.id());
            if (node.is(NodeKind.CONDITION)) {
                for (Edge edge : outgoing) {
                    if (!edge.matches(true) && !edge.matches(false)) {
                        errors.add(
                                "Condition node '"
                                        + node.id()
                                        + "' has an edge to '"
                                        + edge.target()
                                        + "' without a true/false branch label");
                    }
                }
            } else if (outgoing.size() > 1) {
                errors.add(
                        "Node '"
                                + node.id()
                                + "' ("
                                + node.kind()
                                + ") has "
                                + outgoing.size()
                                + " outgoing edges; only condition nodes may branch");
            }
        }
        return errors;
    }
}
