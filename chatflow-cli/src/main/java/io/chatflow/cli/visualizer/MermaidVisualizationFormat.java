package io.chatflow.cli.visualizer;

import io.chatflow.core.graph.Edge;
import io.chatflow.core.graph.Graph;
import io.chatflow.core.graph.Node;
import io.chatflow.core.graph.NodeKind;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Locale;

/// Mermaid flowchart for a chatflow, wrapped in a Markdown code block.
///
/// ### Node Shape Mapping
/// - **trigger**: circle
/// - **llm**: rectangle with the model name
/// - **http_request**: parallelogram with method and URL
/// - **condition**: rhombus with the operator or predicate
/// - **response**: stadium
/// - **custom kinds**: hexagon
///
/// ### Edge Styles
/// - Solid arrow (`-->`) for unlabeled and `true` edges
/// - Dashed arrow (`-.->`) for `false` edges
///
/// @implNote Thread-safe. Stateless rendering.
@ApplicationScoped
public class MermaidVisualizationFormat implements VisualizationFormat {

    @Override
    public String getName() {
        return "mermaid";
    }

    @Override
    public String render(Graph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("```mermaid\n");
        sb.append("flowchart TD\n");
        sb.append("  subgraph ")
                .append(sanitizeId(graph.getChatflowId()))
                .append("[\"")
                .append(escape(graph.getChatflowId()))
                .append(" v")
                .append(graph.getVersion())
                .append("\"]\n");

        for (Node node : graph.getNodes().values()) {
            sb.append("    ").append(renderNode(node)).append("\n");
        }
        sb.append("  end\n\n");

        for (String nodeId : graph.getNodes().keySet()) {
            for (Edge edge : graph.outgoingEdges(nodeId)) {
                renderEdge(sb, edge);
            }
        }

        sb.append("```\n");
        return sb.toString();
    }

    private String renderNode(Node node) {
        String id = sanitizeId(node.id());
        String summary = NodeSummary.of(node);
        String label = escape(summary.isEmpty() ? node.id() : node.id() + "\\n" + summary);
        NodeKind kind = node.kind();

        if (kind.equals(NodeKind.TRIGGER)) {
            return id + "((\"" + label + "\"))";
        } else if (kind.equals(NodeKind.LLM)) {
            return id + "[\"" + label + "\"]";
        } else if (kind.equals(NodeKind.HTTP_REQUEST)) {
            return id + "[/\"" + label + "\"/]";
        } else if (kind.equals(NodeKind.CONDITION)) {
            return id + "{\"" + label + "\"}";
        } else if (kind.equals(NodeKind.RESPONSE)) {
            return id + "([\"" + label + "\"])";
        }
        return id + "{{\"" + escape(node.id() + "\\n[" + kind + "]") + "\"}}";
    }

    private void renderEdge(StringBuilder sb, Edge edge) {
        String fromId = sanitizeId(edge.source());
        String toId = sanitizeId(edge.target());
        sb.append("  ").append(fromId);
        if (edge.label().isEmpty()) {
            sb.append(" --> ");
        } else if (edge.matches(false)) {
            sb.append(" -.->|").append(escape(edge.branchLabel())).append("| ");
        } else {
            sb.append(" -->|").append(escape(edge.branchLabel())).append("| ");
        }
        sb.append(toId).append("\n");
    }

    private String escape(String text) {
        return text.replace("\"", "#quot;");
    }

    private String sanitizeId(String id) {
        String sanitized = id.replaceAll("[^a-zA-Z0-9_]", "_");
        if (isReservedKeyword(sanitized)) {
            return "node_" + sanitized;
        }
        return sanitized;
    }

    private boolean isReservedKeyword(String id) {
        return switch (id.toLowerCase(Locale.ROOT)) {
            case "end", "subgraph", "graph", "flowchart", "style", "classdef", "class", "click" -> true;
            default -> false;
        };
    }
}
