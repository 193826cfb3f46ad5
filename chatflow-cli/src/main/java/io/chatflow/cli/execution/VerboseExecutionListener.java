package io.chatflow.cli.execution;

import io.chatflow.cli.ui.AnsiStyles;
import io.chatflow.core.execution.ExecutionListener;
import io.chatflow.core.execution.executor.NodeResult;
import io.chatflow.core.graph.Node;
import java.io.PrintStream;

/// Prints each node's dispatch and outcome while a turn runs.
///
/// ### Output Format
/// ```
///   * c1 (condition)
///     OK  true
///   * l1 (llm)
///     FAILED  Inference failed (TIMEOUT): read timed out
/// ```
///
/// Node output is cut to one line of at most 120 characters.
///
/// @implNote **Not thread-safe**. Intended for a single interactive turn at a time.
public class VerboseExecutionListener implements ExecutionListener {

    private static final int PREVIEW_LENGTH = 120;

    private final PrintStream out;
    private final AnsiStyles styles;

    /// @param out output stream, typically `System.out`, not null
    /// @param useColor whether to apply ANSI color codes
    public VerboseExecutionListener(PrintStream out, boolean useColor) {
        this.out = out;
        this.styles = AnsiStyles.of(useColor);
    }

    @Override
    public void onNodeStart(Node node) {
        out.printf(
                "  %s %s %s%n",
                styles.accent("*"), styles.bold(node.id()), styles.gray("(" + node.kind() + ")"));
    }

    @Override
    public void onNodeComplete(Node node, NodeResult result) {
        String status = styles.successOrError(result.isSuccess() ? "OK" : "FAILED", result.isSuccess());
        String detail =
                result.isSuccess()
                        ? preview(result.getOutputText())
                        : result.getErrorMessage().orElse("");
        out.printf("    %s  %s%n", status, styles.gray(detail));
    }

    private static String preview(String text) {
        if (text == null || text.isEmpty()) {
            return "(empty)";
        }
        String firstLine = text.strip().lines().findFirst().orElse("");
        return firstLine.length() > PREVIEW_LENGTH
                ? firstLine.substring(0, PREVIEW_LENGTH) + "..."
                : firstLine;
    }
}
