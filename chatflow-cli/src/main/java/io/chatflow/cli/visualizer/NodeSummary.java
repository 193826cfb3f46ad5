package io.chatflow.cli.visualizer;

import io.chatflow.core.graph.Node;
import io.chatflow.core.graph.NodeKind;

/// One-line description of a node's configuration, shared by the formats.
final class NodeSummary {

    private static final int MAX_LENGTH = 40;

    private NodeSummary() {}

    /// @return the summary, or an empty string when the kind has nothing worth showing
    static String of(Node node) {
        NodeKind kind = node.kind();
        String summary;
        if (kind.equals(NodeKind.LLM)) {
            summary = "model: " + node.config().getOrDefault("model", "secret-ai-v1");
        } else if (kind.equals(NodeKind.HTTP_REQUEST)) {
            summary = node.config().getOrDefault("method", "GET") + " " + node.config().getOrDefault("url", "?");
        } else if (kind.equals(NodeKind.CONDITION)) {
            Object predicate = node.config().get("predicate");
            summary =
                    predicate != null
                            ? "predicate: " + predicate
                            : node.config().getOrDefault("operator", "?")
                                    + valueSuffix(node.config().get("value"));
        } else if (kind.equals(NodeKind.RESPONSE)) {
            summary = "format: " + node.config().getOrDefault("format", "text");
        } else {
            summary = "";
        }
        return truncate(summary);
    }

    private static String valueSuffix(Object value) {
        return value != null ? " \"" + value + "\"" : "";
    }

    private static String truncate(String text) {
        return text.length() > MAX_LENGTH ? text.substring(0, MAX_LENGTH - 3) + "..." : text;
    }
}
