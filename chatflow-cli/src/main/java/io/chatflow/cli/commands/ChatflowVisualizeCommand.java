package io.chatflow.cli.commands;

import io.chatflow.cli.visualizer.ChatflowVisualizer;
import io.chatflow.core.ChatflowEnvironment;
import io.chatflow.core.graph.Graph;
import jakarta.inject.Inject;
import picocli.CommandLine;

@CommandLine.Command(name = "visualize", description = "Visualize a chatflow graph")
class ChatflowVisualizeCommand extends ChatflowCommand {

    @CommandLine.Parameters(index = "0", description = "Chatflow JSON file", arity = "0..1")
    String chatflowFile;

    @CommandLine.Option(
            names = "--format",
            defaultValue = "text",
            description = "Output format: text, mermaid")
    String format;

    @Inject ChatflowVisualizer visualizer;

    @Inject ChatflowEnvironment environment;

    @Override
    protected boolean showBanner() {
        return !"mermaid".equals(format);
    }

    @Override
    protected int execute() {
        try {
            Graph graph = environment.getGraphBuilder().build(loadDefinition(chatflowFile));
            System.out.println(visualizer.visualize(graph, format));
            return 0;
        } catch (Exception e) {
            System.err.println(" [FAIL] Visualization failed: " + e.getMessage());
            return 1;
        }
    }
}
