package io.chatflow.core;

import io.chatflow.core.activation.ActiveChatflows;
import io.chatflow.core.activation.ChatflowActivator;
import io.chatflow.core.execution.ChatflowEngine;
import io.chatflow.core.execution.executor.NodeExecutorRegistry;
import io.chatflow.core.graph.GraphBuilder;
import io.chatflow.core.session.ChatflowSession;
import java.util.concurrent.ExecutorService;

/// Container holding all core chatflow components.
///
/// Implements {@link AutoCloseable} to release the inference thread pool.
///
/// ### Contracts
/// - **Postcondition**: All getters return the instances passed to the constructor
/// - **Invariant**: Component references are immutable after construction
///
/// @apiNote Create instances via {@link ChatflowFactory#createEnvironment()} or
/// {@link ChatflowFactory.Builder} rather than direct construction.
public final class ChatflowEnvironment implements AutoCloseable {

    private final ChatflowEngine engine;
    private final NodeExecutorRegistry nodeExecutorRegistry;
    private final GraphBuilder graphBuilder;
    private final ChatflowActivator activator;
    private final ActiveChatflows activeChatflows;
    private final ChatflowSession session;
    private final ExecutorService inferenceExecutor;

    public ChatflowEnvironment(
            ChatflowEngine engine,
            NodeExecutorRegistry nodeExecutorRegistry,
            GraphBuilder graphBuilder,
            ChatflowActivator activator,
            ActiveChatflows activeChatflows,
            ChatflowSession session,
            ExecutorService inferenceExecutor) {
        this.engine = engine;
        this.nodeExecutorRegistry = nodeExecutorRegistry;
        this.graphBuilder = graphBuilder;
        this.activator = activator;
        this.activeChatflows = activeChatflows;
        this.session = session;
        this.inferenceExecutor = inferenceExecutor;
    }

    /// Returns the engine that runs turns over validated graphs.
    public ChatflowEngine getEngine() {
        return engine;
    }

    public NodeExecutorRegistry getNodeExecutorRegistry() {
        return nodeExecutorRegistry;
    }

    /// Returns the builder configured with this environment's validation rules.
    public GraphBuilder getGraphBuilder() {
        return graphBuilder;
    }

    public ChatflowActivator getActivator() {
        return activator;
    }

    public ActiveChatflows getActiveChatflows() {
        return activeChatflows;
    }

    public ChatflowSession getSession() {
        return session;
    }

    /// Shuts down the inference thread pool.
    ///
    /// @implNote Calls `ExecutorService.shutdownNow()`, interrupting in-flight
    /// inference calls; their turns fail with a node error.
    @Override
    public void close() {
        inferenceExecutor.shutdownNow();
    }
}
