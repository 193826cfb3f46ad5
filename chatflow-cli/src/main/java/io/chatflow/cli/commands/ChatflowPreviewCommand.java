package io.chatflow.cli.commands;

import io.chatflow.cli.ui.AnsiStyles;
import io.chatflow.core.ChatflowEnvironment;
import io.chatflow.core.graph.CycleDetector;
import io.chatflow.core.graph.Graph;
import io.chatflow.core.graph.ReachabilityAnalyzer;
import io.chatflow.core.graph.TopologicalSorter;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Optional;
import picocli.CommandLine;

/// Static preview of how turns can travel through a chatflow.
///
/// Prints the topological order of the nodes (or the cycle that prevents one), then
/// the shortest path from the start node to every response node. Nothing is executed.
///
/// ### Usage
/// ```bash
/// chatflow preview [-d <working-dir>] [--no-color] <file>
/// ```
@CommandLine.Command(name = "preview", description = "Preview execution paths of a chatflow")
class ChatflowPreviewCommand extends ChatflowCommand {

    @CommandLine.Parameters(index = "0", description = "Chatflow JSON file", arity = "0..1")
    String chatflowFile;

    @CommandLine.Option(
            names = {"--no-color"},
            description = "Disable colored output",
            negatable = true)
    boolean color = true;

    @Inject ChatflowEnvironment environment;

    private final TopologicalSorter sorter = new TopologicalSorter();
    private final CycleDetector cycleDetector = new CycleDetector();
    private final ReachabilityAnalyzer reachability = new ReachabilityAnalyzer();

    @Override
    protected int execute() {
        AnsiStyles styles = AnsiStyles.of(color);
        try {
            Graph graph = environment.getGraphBuilder().build(loadDefinition(chatflowFile));
            String arrow = " " + styles.arrow() + " ";

            System.out.printf(
                    "%s %s%n%n",
                    styles.bold("Preview:"),
                    styles.accent(graph.getChatflowId() + " v" + graph.getVersion()));

            Optional<List<String>> order = sorter.sort(graph);
            if (order.isPresent()) {
                System.out.println(styles.bold("Order: ") + String.join(arrow, order.get()));
            } else {
                List<String> cycle = cycleDetector.detect(graph).path();
                System.out.println(
                        styles.warn("Cycle detected: ") + String.join(arrow, cycle)
                                + " (no topological order)");
            }
            System.out.println();

            Optional<String> start = graph.getStart();
            if (start.isEmpty()) {
                System.out.println(
                        styles.warn("No unique start node")
                                + styles.gray(" (candidates: " + graph.getStartCandidates() + ")"));
            } else {
                System.out.println(styles.bold("Paths from " + start.get() + ":"));
                for (String end : graph.getEndNodes()) {
                    String path =
                            reachability
                                    .shortestPath(graph, start.get(), end)
                                    .map(p -> String.join(arrow, p))
                                    .orElse(styles.gray("unreachable"));
                    System.out.printf("  %s %s: %s%n", styles.bullet(), end, path);
                }
            }

            if (!graph.isValid()) {
                System.out.println();
                System.out.println(
                        styles.warn(" [WARN] ")
                                + graph.getErrors().size()
                                + " structural error(s); run 'chatflow validate' for details");
            }
            return 0;
        } catch (Exception e) {
            System.err.println(" [FAIL] Preview failed: " + e.getMessage());
            return 1;
        }
    }
}
