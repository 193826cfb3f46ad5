package io.chatflow.cli.visualizer;

import io.chatflow.cli.ui.AnsiStyles;
import io.chatflow.core.graph.Edge;
import io.chatflow.core.graph.Graph;
import io.chatflow.core.graph.Node;
import io.chatflow.core.graph.NodeKind;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/// Box-drawing outline of a chatflow with ANSI colors.
///
/// Nodes are listed breadth-first from the start node, indented by depth. Nodes the
/// walk never reaches (disconnected islands, or every node when there is no unique
/// start) follow at depth zero in declaration order.
///
/// ### Node Colors
/// - **Green**: trigger, response
/// - **Yellow**: condition
/// - **Blue**: llm, http_request
/// - **Gray**: custom kinds
///
/// @implNote Thread-safe. Stateless rendering.
@ApplicationScoped
public class TextVisualizationFormat implements VisualizationFormat {

    @Override
    public String getName() {
        return "text";
    }

    @Override
    public String render(Graph graph) {
        return render(graph, true);
    }

    public String render(Graph graph, boolean useColor) {
        AnsiStyles styles = AnsiStyles.of(useColor);
        StringBuilder sb = new StringBuilder();
        sb.append(
                String.format(
                        "%s %s %s%n",
                        styles.bold("Chatflow:"),
                        styles.accent(graph.getChatflowId()),
                        styles.gray("v" + graph.getVersion())));
        sb.append(styles.rule(50)).append(System.lineSeparator());
        sb.append(System.lineSeparator());

        Set<String> visited = new HashSet<>();
        Deque<NodeLevel> queue = new ArrayDeque<>();
        graph.getStart().ifPresent(start -> queue.add(new NodeLevel(start, 0)));
        walk(graph, queue, visited, styles, sb);

        for (String nodeId : graph.getNodes().keySet()) {
            if (!visited.contains(nodeId)) {
                queue.add(new NodeLevel(nodeId, 0));
                walk(graph, queue, visited, styles, sb);
            }
        }
        return sb.toString();
    }

    private void walk(
            Graph graph,
            Deque<NodeLevel> queue,
            Set<String> visited,
            AnsiStyles styles,
            StringBuilder sb) {
        while (!queue.isEmpty()) {
            NodeLevel current = queue.removeFirst();
            if (!visited.add(current.nodeId())) continue;

            Node node = graph.getNode(current.nodeId()).orElse(null);
            if (node == null) continue;

            sb.append(renderNode(graph, node, "  ".repeat(current.level()), styles));
            sb.append(System.lineSeparator());

            for (String next : graph.successors(node.id())) {
                queue.add(new NodeLevel(next, current.level() + 1));
            }
        }
    }

    /// Renders a single node box with its outgoing edges.
    ///
    /// @param graph the graph the node belongs to, not null
    /// @param node the node to render, not null
    /// @param useColor whether to apply ANSI color codes
    /// @return the node box, never null
    public String renderNode(Graph graph, Node node, boolean useColor) {
        return renderNode(graph, node, "", AnsiStyles.of(useColor));
    }

    private String renderNode(Graph graph, Node node, String indent, AnsiStyles styles) {
        StringBuilder sb = new StringBuilder();
        sb.append(
                String.format(
                        "%s%s %s %s%n",
                        indent,
                        styles.boxTop(),
                        colorByKind(node.id(), node.kind(), styles),
                        styles.gray("(" + node.kind() + ")")));

        String summary = NodeSummary.of(node);
        if (!summary.isEmpty()) {
            sb.append(String.format("%s%s  %s%n", indent, styles.boxMid(), summary));
        }

        var edges = graph.outgoingEdges(node.id());
        if (edges.isEmpty()) {
            String end =
                    node.is(NodeKind.RESPONSE) ? styles.success("(end)") : styles.warn("(dead end)");
            sb.append(String.format("%s%s %s%n", indent, styles.boxBottom(), end));
        }
        for (Edge edge : edges) {
            String label = edge.label().map(l -> styles.gray("[" + l + "] ")).orElse("");
            sb.append(
                    String.format(
                            "%s%s %s%s %s%n",
                            indent, styles.boxBottom(), label, styles.arrow(), edge.target()));
        }
        return sb.toString();
    }

    private String colorByKind(String text, NodeKind kind, AnsiStyles styles) {
        if (kind.equals(NodeKind.TRIGGER) || kind.equals(NodeKind.RESPONSE)) {
            return styles.success(text);
        }
        if (kind.equals(NodeKind.CONDITION)) {
            return styles.warn(text);
        }
        if (kind.equals(NodeKind.LLM) || kind.equals(NodeKind.HTTP_REQUEST)) {
            return styles.accent(text);
        }
        return styles.gray(text);
    }

    private record NodeLevel(String nodeId, int level) {}
}
