package io.chatflow.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.chatflow.core.ChatflowConfig;
import io.chatflow.core.condition.DefaultConditionEvaluator;
import io.chatflow.core.exception.ChatflowValidationException;
import io.chatflow.core.execution.executor.ConditionNodeExecutor;
import io.chatflow.core.execution.executor.DefaultNodeExecutorRegistry;
import io.chatflow.core.execution.executor.LlmNodeExecutor;
import io.chatflow.core.execution.executor.NodeExecutor;
import io.chatflow.core.execution.executor.NodeResult;
import io.chatflow.core.execution.executor.ResponseNodeExecutor;
import io.chatflow.core.execution.executor.TriggerNodeExecutor;
import io.chatflow.core.execution.result.ExecutionError;
import io.chatflow.core.execution.result.ExecutionResult;
import io.chatflow.core.execution.result.ExecutionStatus;
import io.chatflow.core.execution.result.NodeTiming;
import io.chatflow.core.graph.ChatflowDefinition;
import io.chatflow.core.graph.ChatflowSettings;
import io.chatflow.core.graph.Edge;
import io.chatflow.core.graph.Graph;
import io.chatflow.core.graph.GraphBuilder;
import io.chatflow.core.graph.Node;
import io.chatflow.core.graph.NodeKind;
import io.chatflow.core.inference.InferenceClient;
import io.chatflow.core.inference.InferenceException;
import io.chatflow.core.inference.InferenceRequest;
import io.chatflow.core.inference.InferenceResponse;
import io.chatflow.core.inference.TokenUsage;
import io.chatflow.core.json.BasicJsonCodec;
import io.chatflow.core.session.ConversationTurn;
import io.chatflow.core.template.SimpleTemplateResolver;
import io.chatflow.core.template.TemplateResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("ChatflowEngine")
@ExtendWith(MockitoExtension.class)
class ChatflowEngineTest {

    private static final NodeKind WEBHOOK = NodeKind.of("webhook");

    @Mock private InferenceClient inferenceClient;

    private final GraphBuilder graphBuilder = new GraphBuilder();
    private ExecutorService pool;
    private DefaultNodeExecutorRegistry.Builder registry;

    @BeforeEach
    void setUp() {
        pool = Executors.newSingleThreadExecutor();
        TemplateResolver templates = new SimpleTemplateResolver();
        registry =
                DefaultNodeExecutorRegistry.builder()
                        .register(new TriggerNodeExecutor())
                        .register(new LlmNodeExecutor(inferenceClient, templates, pool))
                        .register(
                                new ConditionNodeExecutor(
                                        new DefaultConditionEvaluator(
                                                templates,
                                                Map.of(
                                                        "needs_help",
                                                        (value, context) ->
                                                                value.toLowerCase().contains("help")))))
                        .register(new ResponseNodeExecutor(templates, new BasicJsonCodec()));
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private ChatflowEngine engine() {
        return new ChatflowEngine(registry.build(), new ChatflowConfig());
    }

    private Graph branching() {
        return graphBuilder.build(
                List.of(
                        Node.of("t1", NodeKind.TRIGGER),
                        Node.of("c1", NodeKind.CONDITION, Map.of("predicate", "needs_help")),
                        Node.of("r_true", NodeKind.RESPONSE, Map.of("message", "Routing you to support")),
                        Node.of("r_false", NodeKind.RESPONSE, Map.of("message", "Goodbye"))),
                List.of(
                        Edge.of("t1", "c1"),
                        Edge.labeled("c1", "r_true", "true"),
                        Edge.labeled("c1", "r_false", "false")));
    }

    @Nested
    @DisplayName("Successful turns")
    class Success {

        @Test
        void shouldEchoInputThroughMinimalGraph() {
            // Given
            Graph graph =
                    graphBuilder.build(
                            List.of(
                                    Node.of("t1", NodeKind.TRIGGER),
                                    Node.of("r1", NodeKind.RESPONSE, Map.of("message", "{{input}}"))),
                            List.of(Edge.of("t1", "r1")));

            // When
            ExecutionResult result = engine().execute(graph, TurnInput.of("hi"));

            // Then
            assertThat(result.status()).isEqualTo(ExecutionStatus.SUCCEEDED);
            assertThat(result.success()).isTrue();
            assertThat(result.outputText()).isEqualTo("hi");
            assertThat(result.nodesExecuted()).containsExactly("t1", "r1");
            assertThat(result.responseNodeId()).isEqualTo("r1");
            assertThat(result.timings()).extracting(NodeTiming::nodeId).containsExactly("t1", "r1");
            assertThat(result.getError()).isEmpty();
        }

        @Test
        void shouldFollowTrueBranch() {
            // When
            ExecutionResult result = engine().execute(branching(), TurnInput.of("I need help"));

            // Then
            assertThat(result.outputText()).isEqualTo("Routing you to support");
            assertThat(result.nodesExecuted()).containsExactly("t1", "c1", "r_true");
        }

        @Test
        void shouldFollowFalseBranch() {
            // When
            ExecutionResult result = engine().execute(branching(), TurnInput.of("bye"));

            // Then
            assertThat(result.outputText()).isEqualTo("Goodbye");
            assertThat(result.responseNodeId()).isEqualTo("r_false");
        }

        @Test
        void shouldExposeEarlierOutputsAndDefinitionVariables() throws Exception {
            // Given
            ChatflowDefinition definition =
                    ChatflowDefinition.builder()
                            .id("faq")
                            .node(Node.of("t1", NodeKind.TRIGGER))
                            .node(Node.of("l1", NodeKind.LLM, Map.of("prompt", "{{tone}}: {{input}}")))
                            .node(Node.of("r1", NodeKind.RESPONSE, Map.of("message", "{{l1}} [{{t1}}]")))
                            .edge(Edge.of("t1", "l1"))
                            .edge(Edge.of("l1", "r1"))
                            .variable("tone", "Friendly")
                            .build();
            when(inferenceClient.generate(any())).thenReturn(InferenceResponse.of("Sure!", TokenUsage.NONE));

            // When
            ExecutionResult result = engine().execute(graphBuilder.build(definition), TurnInput.of("help?"));

            // Then
            assertThat(result.outputText()).isEqualTo("Sure! [help?]");
            ArgumentCaptor<InferenceRequest> captor = ArgumentCaptor.forClass(InferenceRequest.class);
            verify(inferenceClient).generate(captor.capture());
            assertThat(captor.getValue().prompt()).isEqualTo("Friendly: help?");
        }

        @Test
        void shouldBoundHistoryToConfiguredLimit() throws Exception {
            // Given
            Graph graph =
                    graphBuilder.build(
                            List.of(
                                    Node.of("t1", NodeKind.TRIGGER),
                                    Node.of("l1", NodeKind.LLM, Map.of("prompt", "{{input}}")),
                                    Node.of("r1", NodeKind.RESPONSE, Map.of("message", "{{l1}}"))),
                            List.of(Edge.of("t1", "l1"), Edge.of("l1", "r1")));
            List<ConversationTurn> history = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                history.add(ConversationTurn.user("message " + i));
            }
            when(inferenceClient.generate(any())).thenReturn(InferenceResponse.of("ok", TokenUsage.NONE));
            ChatflowEngine engine =
                    new ChatflowEngine(registry.build(), ChatflowConfig.builder().historyLimit(2).build());

            // When
            engine.execute(graph, TurnInput.of("now").withHistory(history));

            // Then
            ArgumentCaptor<InferenceRequest> captor = ArgumentCaptor.forClass(InferenceRequest.class);
            verify(inferenceClient).generate(captor.capture());
            assertThat(captor.getValue().history())
                    .extracting(ConversationTurn::content)
                    .containsExactly("message 3", "message 4");
        }
    }

    @Nested
    @DisplayName("Failed turns")
    class Failures {

        @Test
        void shouldStopAtFailingNode() throws Exception {
            // Given
            Graph graph =
                    graphBuilder.build(
                            List.of(
                                    Node.of("t1", NodeKind.TRIGGER),
                                    Node.of("l1", NodeKind.LLM, Map.of("prompt", "{{input}}")),
                                    Node.of("r1", NodeKind.RESPONSE, Map.of("message", "{{l1}}"))),
                            List.of(Edge.of("t1", "l1"), Edge.of("l1", "r1")));
            when(inferenceClient.generate(any()))
                    .thenThrow(
                            new InferenceException(
                                    InferenceException.ErrorType.AUTHENTICATION, "invalid api key"));

            // When
            ExecutionResult result = engine().execute(graph, TurnInput.of("hi"));

            // Then
            assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(result.success()).isFalse();
            assertThat(result.nodesExecuted()).containsExactly("t1", "l1");
            assertThat(result.getError())
                    .get()
                    .isInstanceOfSatisfying(
                            ExecutionError.NodeExecutionFailed.class,
                            error -> {
                                assertThat(error.nodeId()).isEqualTo("l1");
                                assertThat(error.nodeKind()).isEqualTo(NodeKind.LLM);
                                assertThat(error.detail()).contains("invalid api key");
                                assertThat(error.cause()).isInstanceOf(InferenceException.class);
                                assertThat(error.metadata()).containsEntry("error_type", "AUTHENTICATION");
                            });
        }

        @Test
        void shouldFailOnUnregisteredKind() {
            // Given
            Graph graph =
                    graphBuilder.build(
                            List.of(
                                    Node.of("t1", NodeKind.TRIGGER),
                                    Node.of("w1", WEBHOOK),
                                    Node.of("r1", NodeKind.RESPONSE)),
                            List.of(Edge.of("t1", "w1"), Edge.of("w1", "r1")));

            // When
            ExecutionResult result = engine().execute(graph, TurnInput.of("hi"));

            // Then
            assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(result.getError())
                    .contains(new ExecutionError.UnknownNodeKind("w1", WEBHOOK));
        }

        @Test
        void shouldContainThrowingExecutor() {
            // Given
            NodeExecutor throwing = mock(NodeExecutor.class);
            when(throwing.getNodeKind()).thenReturn(WEBHOOK);
            when(throwing.execute(any(), any())).thenThrow(new IllegalStateException("boom"));
            registry.register(throwing);
            Graph graph =
                    graphBuilder.build(
                            List.of(
                                    Node.of("t1", NodeKind.TRIGGER),
                                    Node.of("w1", WEBHOOK),
                                    Node.of("r1", NodeKind.RESPONSE)),
                            List.of(Edge.of("t1", "w1"), Edge.of("w1", "r1")));

            // When
            ExecutionResult result = engine().execute(graph, TurnInput.of("hi"));

            // Then
            assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(result.getError().orElseThrow().kind())
                    .isEqualTo(ExecutionError.Kind.NODE_EXECUTION);
            assertThat(result.getError().orElseThrow().detail()).contains("boom");
        }

        @Test
        void shouldReportDeadEndWhenNoBranchMatches() {
            // Given only the true branch is wired
            Graph graph =
                    graphBuilder.build(
                            List.of(
                                    Node.of("t1", NodeKind.TRIGGER),
                                    Node.of("c1", NodeKind.CONDITION, Map.of("predicate", "needs_help")),
                                    Node.of("r1", NodeKind.RESPONSE)),
                            List.of(Edge.of("t1", "c1"), Edge.labeled("c1", "r1", "true")));

            // When
            ExecutionResult result = engine().execute(graph, TurnInput.of("bye"));

            // Then
            assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(result.getError())
                    .contains(new ExecutionError.DeadEnd("c1", "no outgoing edge labeled 'false'"));
        }

        @Test
        void shouldReportDeadEndAtNonResponseLeaf() throws Exception {
            // Given
            Graph graph =
                    graphBuilder.build(
                            List.of(
                                    Node.of("t1", NodeKind.TRIGGER),
                                    Node.of("c1", NodeKind.CONDITION, Map.of("predicate", "needs_help")),
                                    Node.of("r1", NodeKind.RESPONSE),
                                    Node.of("l1", NodeKind.LLM)),
                            List.of(
                                    Edge.of("t1", "c1"),
                                    Edge.labeled("c1", "r1", "true"),
                                    Edge.labeled("c1", "l1", "false")));
            when(inferenceClient.generate(any())).thenReturn(InferenceResponse.of("ok", TokenUsage.NONE));

            // When
            ExecutionResult result = engine().execute(graph, TurnInput.of("bye"));

            // Then
            assertThat(result.nodesExecuted()).containsExactly("t1", "c1", "l1");
            assertThat(result.getError().orElseThrow().kind()).isEqualTo(ExecutionError.Kind.DEAD_END);
        }

        @Test
        void shouldAbortWhenIterationCapReached() {
            // Given
            ChatflowDefinition definition =
                    ChatflowDefinition.builder()
                            .id("long")
                            .node(Node.of("t1", NodeKind.TRIGGER))
                            .node(Node.of("c1", NodeKind.CONDITION, Map.of("operator", "is_not_empty")))
                            .node(Node.of("c2", NodeKind.CONDITION, Map.of("operator", "is_not_empty")))
                            .node(Node.of("r1", NodeKind.RESPONSE))
                            .edge(Edge.of("t1", "c1"))
                            .edge(Edge.labeled("c1", "c2", "true"))
                            .edge(Edge.labeled("c2", "r1", "true"))
                            .settings(new ChatflowSettings(2, null))
                            .build();

            // When
            ExecutionResult result =
                    engine().execute(graphBuilder.build(definition), TurnInput.of("hi"));

            // Then
            assertThat(result.status()).isEqualTo(ExecutionStatus.ABORTED);
            assertThat(result.nodesExecuted()).containsExactly("t1", "c1");
            assertThat(result.getError()).contains(new ExecutionError.BudgetExceeded(2, "c1"));
        }

        @Test
        void shouldRejectInvalidGraph() {
            // Given
            Graph invalid = graphBuilder.build(List.of(Node.of("t1", NodeKind.TRIGGER)), List.of());

            // When / Then
            assertThatThrownBy(() -> engine().execute(invalid, TurnInput.of("hi")))
                    .isInstanceOf(ChatflowValidationException.class);
        }
    }

    @Nested
    @DisplayName("Listener")
    class Listener {

        @Test
        void shouldNotifyLifecycleInOrder() {
            // Given
            ExecutionListener listener = mock(ExecutionListener.class);
            Graph graph = branching();

            // When
            ExecutionResult result = engine().execute(graph, TurnInput.of("bye"), listener);

            // Then
            InOrder order = inOrder(listener);
            order.verify(listener).onTurnStart(any(Graph.class), any(TurnInput.class));
            order.verify(listener).onNodeStart(graph.getNodes().get("t1"));
            order.verify(listener).onNodeComplete(any(Node.class), any(NodeResult.class));
            order.verify(listener).onNodeStart(graph.getNodes().get("c1"));
            order.verify(listener).onNodeStart(graph.getNodes().get("r_false"));
            order.verify(listener).onTurnComplete(result);
        }

        @Test
        void shouldIgnoreThrowingListener() {
            // Given
            ExecutionListener listener = mock(ExecutionListener.class);
            doThrow(new IllegalStateException("listener bug")).when(listener).onNodeStart(any());

            // When
            ExecutionResult result = engine().execute(branching(), TurnInput.of("help"), listener);

            // Then
            assertThat(result.success()).isTrue();
        }
    }

    @Test
    void shouldIsolateContextsBetweenTurns() {
        // Given
        ChatflowEngine engine = engine();
        Graph graph = branching();

        // When
        ExecutionResult first = engine.execute(graph, TurnInput.of("help"));
        ExecutionResult second = engine.execute(graph, TurnInput.of("bye"));

        // Then
        assertThat(first.responseNodeId()).isEqualTo("r_true");
        assertThat(second.responseNodeId()).isEqualTo("r_false");
    }

    @Test
    void shouldKeepConcurrentTurnsIndependentOnSharedGraph() throws Exception {
        // Given
        ExecutorService inferencePool = Executors.newFixedThreadPool(4);
        ExecutorService callers = Executors.newFixedThreadPool(8);
        TemplateResolver templates = new SimpleTemplateResolver();
        InferenceClient echoClient =
                request -> InferenceResponse.of("llm:" + request.prompt(), TokenUsage.of(1, 1));
        ChatflowEngine engine =
                new ChatflowEngine(
                        DefaultNodeExecutorRegistry.builder()
                                .register(new TriggerNodeExecutor())
                                .register(new LlmNodeExecutor(echoClient, templates, inferencePool))
                                .register(
                                        new ConditionNodeExecutor(
                                                new DefaultConditionEvaluator(templates, Map.of())))
                                .register(new ResponseNodeExecutor(templates, new BasicJsonCodec()))
                                .build(),
                        new ChatflowConfig());
        Graph graph =
                graphBuilder.build(
                        List.of(
                                Node.of("t1", NodeKind.TRIGGER),
                                Node.of(
                                        "c1",
                                        NodeKind.CONDITION,
                                        Map.of("operator", "contains", "value", "help")),
                                Node.of("r_help", NodeKind.RESPONSE, Map.of("message", "Support: {{input}}")),
                                Node.of("l1", NodeKind.LLM, Map.of("prompt", "{{input}}")),
                                Node.of("r_llm", NodeKind.RESPONSE, Map.of("message", "{{l1}}"))),
                        List.of(
                                Edge.of("t1", "c1"),
                                Edge.labeled("c1", "r_help", "true"),
                                Edge.labeled("c1", "l1", "false"),
                                Edge.of("l1", "r_llm")));
        int turns = 64;
        CountDownLatch go = new CountDownLatch(1);

        try {
            List<Future<ExecutionResult>> futures = new ArrayList<>();
            for (int i = 0; i < turns; i++) {
                String message = (i % 2 == 0 ? "help " : "bye ") + i;
                futures.add(
                        callers.submit(
                                () -> {
                                    go.await();
                                    return engine.execute(graph, TurnInput.of(message));
                                }));
            }

            // When
            go.countDown();

            // Then
            for (int i = 0; i < turns; i++) {
                ExecutionResult result = futures.get(i).get(30, TimeUnit.SECONDS);
                assertThat(result.success()).as("turn %d", i).isTrue();
                if (i % 2 == 0) {
                    assertThat(result.responseNodeId()).isEqualTo("r_help");
                    assertThat(result.outputText()).isEqualTo("Support: help " + i);
                    assertThat(result.nodesExecuted()).containsExactly("t1", "c1", "r_help");
                } else {
                    assertThat(result.responseNodeId()).isEqualTo("r_llm");
                    assertThat(result.outputText()).isEqualTo("llm:bye " + i);
                    assertThat(result.nodesExecuted()).containsExactly("t1", "c1", "l1", "r_llm");
                }
            }
        } finally {
            callers.shutdownNow();
            inferencePool.shutdownNow();
        }
    }
}
