package io.chatflow.core.graph;

import java.util.Objects;
import java.util.Optional;

/// Directed connection between two nodes.
///
/// The optional branch label is only meaningful on edges leaving a condition
/// node, where `"true"` and `"false"` select the branch taken at run time.
///
/// @param source id of the source node, not null
/// @param target id of the target node, not null
/// @param branchLabel branch outcome label, may be null
public record Edge(String source, String target, String branchLabel) {

    public static final String TRUE_BRANCH = "true";
    public static final String FALSE_BRANCH = "false";

    public Edge {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        if (branchLabel != null && branchLabel.isBlank()) {
            branchLabel = null;
        }
    }

    /// Creates an unlabeled edge.
    public static Edge of(String source, String target) {
        return new Edge(source, target, null);
    }

    /// Creates an edge carrying a branch label.
    public static Edge labeled(String source, String target, String branchLabel) {
        return new Edge(source, target, branchLabel);
    }

    public Optional<String> label() {
        return Optional.ofNullable(branchLabel);
    }

    /// Returns true when this edge's label matches the given boolean outcome.
    ///
    /// Matching is case-insensitive on the label text.
    ///
    /// @param outcome the condition result
    /// @return true if the label names the outcome
    public boolean matches(boolean outcome) {
        return branchLabel != null && branchLabel.equalsIgnoreCase(String.valueOf(outcome));
    }

    @Override
    public String toString() {
        return branchLabel == null
                ? source + " -> " + target
                : source + " -[" + branchLabel + "]-> " + target;
    }
}
