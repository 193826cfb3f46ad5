package io.chatflow.core.execution;

import io.chatflow.core.ChatflowConfig;
import io.chatflow.core.execution.executor.ExecutionContext;
import io.chatflow.core.execution.executor.NodeExecutor;
import io.chatflow.core.execution.executor.NodeExecutorNotFound;
import io.chatflow.core.execution.executor.NodeExecutorRegistry;
import io.chatflow.core.execution.executor.NodeResult;
import io.chatflow.core.execution.result.ExecutionError;
import io.chatflow.core.execution.result.ExecutionResult;
import io.chatflow.core.execution.result.ExecutionStatus;
import io.chatflow.core.execution.result.NodeTiming;
import io.chatflow.core.graph.Edge;
import io.chatflow.core.graph.Graph;
import io.chatflow.core.graph.Node;
import io.chatflow.core.graph.NodeKind;
import io.chatflow.core.session.ConversationTurn;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Logger;

/// Runs one conversational turn over a validated chatflow graph.
///
/// ### Algorithm
/// 1. Build a fresh {@link ExecutionContext} from the turn input
/// 2. Start at the graph's start node
/// 3. Until a response node, a failure, a dead end or the iteration cap:
///    dispatch the node through the registry, record its latency, then either
///    stop (failure or response) or store its output under its id and follow
///    the next edge
///
/// ### Edge selection
/// - condition nodes follow the edge whose label matches the boolean output
/// - other nodes follow their single edge; with several edges the first
///   declared one is taken and a warning is logged
///
/// ### Contracts
/// - **Precondition**: the graph is valid; invalid graphs are rejected with
///   {@link io.chatflow.core.exception.ChatflowValidationException}
/// - **Postcondition**: returns a result in a terminal state, never null, never
///   throws because of an executor
/// - **Invariant**: each node execution is attempted once; there are no retries
///
/// @implNote Thread-safe. The engine holds no per-turn state, so one instance
/// serves any number of concurrent turns over shared graphs.
/// @see NodeExecutorRegistry for node kind dispatch
public class ChatflowEngine {

    private static final Logger logger = Logger.getLogger(ChatflowEngine.class.getName());

    private final NodeExecutorRegistry registry;
    private final int maxIterations;
    private final int historyLimit;
    private final Duration defaultTimeout;

    public ChatflowEngine(NodeExecutorRegistry registry, ChatflowConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.maxIterations = config.getMaxIterations();
        this.historyLimit = config.getHistoryLimit();
        this.defaultTimeout = config.getDefaultNodeTimeout();
    }

    /// Executes one turn without a listener.
    ///
    /// @see #execute(Graph, TurnInput, ExecutionListener)
    public ExecutionResult execute(Graph graph, TurnInput input) {
        return execute(graph, input, ExecutionListener.NOOP);
    }

    /// Executes one turn.
    ///
    /// @param graph the validated graph snapshot, not null
    /// @param input the turn input, not null
    /// @param listener lifecycle callbacks, not null
    /// @return the turn result in a terminal state, never null
    /// @throws io.chatflow.core.exception.ChatflowValidationException if the graph is invalid
    public ExecutionResult execute(Graph graph, TurnInput input, ExecutionListener listener) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        graph.requireValid();

        int cap = graph.getSettings().maxIterationsOverride().orElse(maxIterations);
        ExecutionContext context =
                ExecutionContext.builder()
                        .userMessage(input.userMessage())
                        .sessionId(input.sessionId())
                        .workspaceId(input.workspaceId())
                        .history(boundHistory(input.history()))
                        .defaultTimeout(graph.getSettings().timeoutOverride().orElse(defaultTimeout))
                        .variables(graph.getVariables())
                        .build();

        logger.info(
                "Starting turn on chatflow '"
                        + graph.getChatflowId()
                        + "' v"
                        + graph.getVersion()
                        + (input.sessionId() != null ? " (session " + input.sessionId() + ")" : ""));
        notify(listener, l -> l.onTurnStart(graph, input));

        Turn turn = new Turn(System.nanoTime());
        String currentId = graph.getStart().orElseThrow();
        String lastId = currentId;
        int iterations = 0;

        while (currentId != null && iterations < cap) {
            iterations++;
            Node node = graph.getNodes().get(currentId);
            lastId = currentId;

            notify(listener, l -> l.onNodeStart(node));
            long started = System.nanoTime();
            Dispatch dispatch = dispatch(node, context);
            turn.record(node.id(), started);

            if (dispatch.unknownKind) {
                logger.warning("No executor for node '" + node.id() + "' of kind " + node.kind());
                return finish(
                        listener,
                        turn.failed(
                                ExecutionStatus.FAILED,
                                new ExecutionError.UnknownNodeKind(node.id(), node.kind())));
            }

            NodeResult result = dispatch.result;
            notify(listener, l -> l.onNodeComplete(node, result));

            if (!result.isSuccess()) {
                String detail = result.getErrorMessage().orElse("Node execution failed");
                logger.warning("Node '" + node.id() + "' (" + node.kind() + ") failed: " + detail);
                return finish(
                        listener,
                        turn.failed(
                                ExecutionStatus.FAILED,
                                new ExecutionError.NodeExecutionFailed(
                                        node.id(),
                                        node.kind(),
                                        detail,
                                        result.getError(),
                                        result.getMetadata())));
            }

            if (node.is(NodeKind.RESPONSE)) {
                return finish(listener, turn.succeeded(result.getOutputText(), node.id()));
            }

            context.recordOutput(node.id(), result.getOutput());

            Next next = nextNode(graph, node, result);
            if (next.deadEnd != null) {
                return finish(
                        listener,
                        turn.failed(
                                ExecutionStatus.FAILED, new ExecutionError.DeadEnd(node.id(), next.deadEnd)));
            }
            currentId = next.nodeId;
        }

        logger.warning(
                "Chatflow '" + graph.getChatflowId() + "' exceeded " + cap + " iterations; aborting turn");
        return finish(
                listener, turn.failed(ExecutionStatus.ABORTED, new ExecutionError.BudgetExceeded(cap, lastId)));
    }

    private Dispatch dispatch(Node node, ExecutionContext context) {
        NodeExecutor executor;
        try {
            executor = registry.getExecutorOrThrow(node.kind());
        } catch (NodeExecutorNotFound e) {
            return new Dispatch(null, true);
        }

        logger.fine("Dispatching node '" + node.id() + "' (" + node.kind() + ")");
        try {
            NodeResult result = executor.execute(node, context);
            if (result == null) {
                return new Dispatch(NodeResult.failure("Executor returned no result"), false);
            }
            return new Dispatch(result, false);
        } catch (RuntimeException e) {
            return new Dispatch(NodeResult.failure("Executor threw " + e, e), false);
        }
    }

    private static Next nextNode(Graph graph, Node node, NodeResult result) {
        List<Edge> outgoing = graph.outgoingEdges(node.id());

        if (node.is(NodeKind.CONDITION)) {
            boolean outcome = Boolean.TRUE.equals(result.getOutput())
                    || "true".equalsIgnoreCase(result.getOutputText());
            for (Edge edge : outgoing) {
                if (edge.matches(outcome)) {
                    return Next.to(edge.target());
                }
            }
            return Next.deadEnd("no outgoing edge labeled '" + outcome + "'");
        }

        if (outgoing.isEmpty()) {
            return Next.deadEnd("no outgoing edge and not a response node");
        }
        if (outgoing.size() > 1) {
            logger.warning(
                    "Node '"
                            + node.id()
                            + "' has "
                            + outgoing.size()
                            + " outgoing edges; following the first to '"
                            + outgoing.get(0).target()
                            + "'");
        }
        return Next.to(outgoing.get(0).target());
    }

    private List<ConversationTurn> boundHistory(List<ConversationTurn> history) {
        if (history.size() <= historyLimit) {
            return history;
        }
        return history.subList(history.size() - historyLimit, history.size());
    }

    private static ExecutionResult finish(ExecutionListener listener, ExecutionResult result) {
        logger.info(
                "Turn finished "
                        + result.status()
                        + " after "
                        + result.nodesExecuted().size()
                        + " node(s) in "
                        + result.totalDuration().toMillis()
                        + "ms");
        notify(listener, l -> l.onTurnComplete(result));
        return result;
    }

    private static void notify(ExecutionListener listener, Consumer<ExecutionListener> event) {
        try {
            event.accept(listener);
        } catch (RuntimeException e) {
            logger.warning("Execution listener failed: " + e);
        }
    }

    private record Dispatch(NodeResult result, boolean unknownKind) {}

    private record Next(String nodeId, String deadEnd) {

        static Next to(String nodeId) {
            return new Next(nodeId, null);
        }

        static Next deadEnd(String reason) {
            return new Next(null, reason);
        }
    }

    /// Accumulates the executed path and timings of one turn.
    private static final class Turn {
        private final long startedNanos;
        private final List<String> nodesExecuted = new ArrayList<>();
        private final List<NodeTiming> timings = new ArrayList<>();

        private Turn(long startedNanos) {
            this.startedNanos = startedNanos;
        }

        void record(String nodeId, long nodeStartedNanos) {
            nodesExecuted.add(nodeId);
            timings.add(new NodeTiming(nodeId, elapsed(nodeStartedNanos).toMillis()));
        }

        ExecutionResult succeeded(String output, String responseNodeId) {
            return new ExecutionResult(
                    ExecutionStatus.SUCCEEDED,
                    output,
                    nodesExecuted,
                    timings,
                    null,
                    responseNodeId,
                    elapsed(startedNanos));
        }

        ExecutionResult failed(ExecutionStatus status, ExecutionError error) {
            return new ExecutionResult(
                    status, "", nodesExecuted, timings, error, null, elapsed(startedNanos));
        }

        private static Duration elapsed(long fromNanos) {
            return Duration.ofNanos(System.nanoTime() - fromNanos);
        }
    }
}
