package io.chatflow.core.activation;

import io.chatflow.core.exception.ChatflowValidationException;
import io.chatflow.core.execution.executor.NodeExecutor;
import io.chatflow.core.execution.executor.NodeExecutorRegistry;
import io.chatflow.core.graph.ChatflowDefinition;
import io.chatflow.core.graph.Graph;
import io.chatflow.core.graph.GraphBuilder;
import io.chatflow.core.graph.Node;
import io.chatflow.core.graph.ValidationReport;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/// Turns definitions into active graph snapshots.
///
/// Activation is all-or-nothing: the definition is built, structurally
/// validated, and every node configuration is checked against its executor.
/// Any error blocks activation and the previous snapshot stays in place.
///
/// ### Check order
/// 1. reference and structural errors from {@link GraphBuilder}
/// 2. nodes whose kind has no registered executor
/// 3. per-node configuration problems from {@link NodeExecutor#validateConfig}
///
/// @implNote Thread-safe.
public final class ChatflowActivator {

    private static final Logger logger = Logger.getLogger(ChatflowActivator.class.getName());

    private final GraphBuilder graphBuilder;
    private final NodeExecutorRegistry registry;
    private final ActiveChatflows activeChatflows;

    public ChatflowActivator(
            GraphBuilder graphBuilder, NodeExecutorRegistry registry, ActiveChatflows activeChatflows) {
        this.graphBuilder = graphBuilder;
        this.registry = registry;
        this.activeChatflows = activeChatflows;
    }

    /// Runs every activation check without publishing anything.
    ///
    /// @param definition the definition to check, not null
    /// @return the full ordered report, never null
    public ValidationReport check(ChatflowDefinition definition) {
        Graph graph = graphBuilder.build(definition);
        return ValidationReport.of(graph.getErrors()).and(checkNodes(graph));
    }

    /// Builds, validates and publishes a definition.
    ///
    /// @param definition the definition to activate, not null
    /// @return the published graph, never null
    /// @throws ChatflowValidationException if any check fails
    public Graph activate(ChatflowDefinition definition) {
        Graph graph = graphBuilder.build(definition);
        ValidationReport report = ValidationReport.of(graph.getErrors()).and(checkNodes(graph));
        if (!report.valid()) {
            logger.warning(
                    "Rejected activation of chatflow '"
                            + definition.getId()
                            + "' v"
                            + definition.getVersion()
                            + ": "
                            + report.errors().size()
                            + " error(s)");
            throw new ChatflowValidationException(definition.getId(), report.errors());
        }

        Optional<Graph> previous = activeChatflows.publish(graph);
        logger.info(
                "Activated chatflow '"
                        + graph.getChatflowId()
                        + "' v"
                        + graph.getVersion()
                        + previous.map(p -> " (replacing v" + p.getVersion() + ")").orElse(""));
        return graph;
    }

    private ValidationReport checkNodes(Graph graph) {
        List<String> errors = new ArrayList<>();
        for (Node node : graph.getNodes().values()) {
            Optional<NodeExecutor> executor = registry.getExecutor(node.kind());
            if (executor.isEmpty()) {
                errors.add("Node '" + node.id() + "' has unknown kind '" + node.kind() + "'");
                continue;
            }
            for (String problem : executor.get().validateConfig(node.config())) {
                errors.add("Node '" + node.id() + "' (" + node.kind() + "): " + problem);
            }
        }
        return ValidationReport.of(errors);
    }
}
