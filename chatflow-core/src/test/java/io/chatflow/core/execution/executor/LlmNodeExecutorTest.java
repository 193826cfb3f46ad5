package io.chatflow.core.execution.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.chatflow.core.graph.Node;
import io.chatflow.core.graph.NodeKind;
import io.chatflow.core.inference.InferenceClient;
import io.chatflow.core.inference.InferenceException;
import io.chatflow.core.inference.InferenceRequest;
import io.chatflow.core.inference.InferenceResponse;
import io.chatflow.core.inference.TokenUsage;
import io.chatflow.core.session.ConversationTurn;
import io.chatflow.core.template.SimpleTemplateResolver;
import java.time.Duration;
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
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("LlmNodeExecutor")
@ExtendWith(MockitoExtension.class)
class LlmNodeExecutorTest {

    @Mock private InferenceClient inferenceClient;

    private ExecutorService pool;
    private LlmNodeExecutor executor;

    @BeforeEach
    void setUp() {
        pool = Executors.newSingleThreadExecutor();
        executor = new LlmNodeExecutor(inferenceClient, new SimpleTemplateResolver(), pool);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private ExecutionContext context(String message) {
        return ExecutionContext.builder()
                .userMessage(message)
                .history(List.of(ConversationTurn.user("earlier"), ConversationTurn.assistant("reply")))
                .defaultTimeout(Duration.ofSeconds(5))
                .build();
    }

    @Nested
    class Success {

        @Test
        void shouldRenderPromptAndReportUsage() throws Exception {
            // Given
            Node node =
                    Node.of(
                            "l1",
                            NodeKind.LLM,
                            Map.of(
                                    "prompt", "Answer: {{input}}",
                                    "system_prompt", "Be brief",
                                    "model", "claude-sonnet-4",
                                    "temperature", 0.2,
                                    "max_tokens", "256"));
            when(inferenceClient.generate(any()))
                    .thenReturn(
                            new InferenceResponse(
                                    "42", TokenUsage.of(10, 2), "claude-sonnet-4", Map.of()));

            // When
            NodeResult result = executor.execute(node, context("what is it?"));

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getOutput()).isEqualTo("42");
            assertThat(result.getMetadata())
                    .containsEntry("tokens_used", 12)
                    .containsEntry("model", "claude-sonnet-4")
                    .containsEntry("prompt_length", "Answer: what is it?".length());

            ArgumentCaptor<InferenceRequest> captor = ArgumentCaptor.forClass(InferenceRequest.class);
            verify(inferenceClient).generate(captor.capture());
            InferenceRequest request = captor.getValue();
            assertThat(request.prompt()).isEqualTo("Answer: what is it?");
            assertThat(request.systemPrompt()).isEqualTo("Be brief");
            assertThat(request.temperature()).isEqualTo(0.2);
            assertThat(request.maxTokens()).isEqualTo(256);
            assertThat(request.history()).hasSize(2);
        }

        @Test
        void shouldApplyDefaultsAndOmitHistoryWhenDisabled() throws Exception {
            // Given
            Node node = Node.of("l1", NodeKind.LLM, Map.of("include_history", false));
            when(inferenceClient.generate(any())).thenReturn(InferenceResponse.of("ok", TokenUsage.NONE));

            // When
            executor.execute(node, context("hello"));

            // Then
            ArgumentCaptor<InferenceRequest> captor = ArgumentCaptor.forClass(InferenceRequest.class);
            verify(inferenceClient).generate(captor.capture());
            assertThat(captor.getValue().prompt()).isEqualTo("hello");
            assertThat(captor.getValue().model()).isEqualTo(LlmNodeExecutor.DEFAULT_MODEL);
            assertThat(captor.getValue().maxTokens()).isEqualTo(LlmNodeExecutor.DEFAULT_MAX_TOKENS);
            assertThat(captor.getValue().history()).isEmpty();
        }
    }

    @Nested
    class Failure {

        @Test
        void shouldReportInferenceErrorWithType() throws Exception {
            // Given
            Node node = Node.of("l1", NodeKind.LLM, Map.of("prompt", "{{input}}"));
            when(inferenceClient.generate(any()))
                    .thenThrow(
                            new InferenceException(
                                    InferenceException.ErrorType.RATE_LIMITED, "slow down"));

            // When
            NodeResult result = executor.execute(node, context("hi"));

            // Then
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getErrorMessage()).hasValueSatisfying(m -> assertThat(m).contains("slow down"));
            assertThat(result.getError()).isInstanceOf(InferenceException.class);
            assertThat(result.getMetadata()).containsEntry("error_type", "RATE_LIMITED");
        }

        @Test
        void shouldTimeOutSlowInference() throws Exception {
            // Given
            CountDownLatch never = new CountDownLatch(1);
            Node node = Node.of("l1", NodeKind.LLM, Map.of("prompt", "{{input}}", "timeout", 1));
            when(inferenceClient.generate(any()))
                    .thenAnswer(
                            invocation -> {
                                never.await();
                                return InferenceResponse.of("late", TokenUsage.NONE);
                            });

            // When
            NodeResult result = executor.execute(node, context("hi"));

            // Then
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getMetadata()).containsEntry("error_type", "TIMEOUT");
            assertThat(result.getErrorMessage()).hasValueSatisfying(m -> assertThat(m).contains("timed out"));
        }

        @Test
        void shouldRejectMalformedNumericConfig() {
            // Given
            Node node = Node.of("l1", NodeKind.LLM, Map.of("temperature", "warm"));

            // When
            NodeResult result = executor.execute(node, context("hi"));

            // Then
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getErrorMessage())
                    .hasValueSatisfying(m -> assertThat(m).startsWith("Invalid LLM configuration"));
        }
    }

    @Nested
    class SharedPool {

        @Test
        void shouldNotChargeQueueTimeAgainstCallTimeout() throws Exception {
            // Given
            pool.submit(
                    () -> {
                        Thread.sleep(700);
                        return null;
                    });
            Node node = Node.of("l1", NodeKind.LLM, Map.of("prompt", "{{input}}", "timeout", 1));
            when(inferenceClient.generate(any()))
                    .thenAnswer(
                            invocation -> {
                                Thread.sleep(500);
                                return InferenceResponse.of("done", TokenUsage.NONE);
                            });

            // When
            NodeResult result = executor.execute(node, context("hi"));

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getOutputText()).isEqualTo("done");
        }

        @Test
        void shouldCompleteEveryTurnWhenCallsOutnumberPoolThreads() throws Exception {
            // Given
            int threads = 4;
            ExecutorService inferencePool = Executors.newFixedThreadPool(threads);
            ExecutorService callers = Executors.newFixedThreadPool(threads + 1);
            InferenceClient slowClient =
                    request -> {
                        try {
                            Thread.sleep(700);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            throw new InferenceException(InferenceException.ErrorType.TIMEOUT, "interrupted");
                        }
                        return InferenceResponse.of("echo:" + request.prompt(), TokenUsage.NONE);
                    };
            LlmNodeExecutor shared =
                    new LlmNodeExecutor(slowClient, new SimpleTemplateResolver(), inferencePool);
            Node node = Node.of("l1", NodeKind.LLM, Map.of("prompt", "{{input}}", "timeout", 1));
            CountDownLatch go = new CountDownLatch(1);

            try {
                List<Future<NodeResult>> futures = new ArrayList<>();
                for (int i = 0; i <= threads; i++) {
                    String message = "turn-" + i;
                    futures.add(
                            callers.submit(
                                    () -> {
                                        go.await();
                                        return shared.execute(node, context(message));
                                    }));
                }

                // When
                go.countDown();

                // Then
                for (int i = 0; i <= threads; i++) {
                    NodeResult result = futures.get(i).get(10, TimeUnit.SECONDS);
                    assertThat(result.isSuccess()).as("turn %d", i).isTrue();
                    assertThat(result.getOutputText()).isEqualTo("echo:turn-" + i);
                }
            } finally {
                callers.shutdownNow();
                inferencePool.shutdownNow();
            }
        }

        @Test
        void shouldFailAsSaturatedWhenNoThreadFreesUp() throws Exception {
            // Given
            CountDownLatch release = new CountDownLatch(1);
            pool.submit(
                    () -> {
                        release.await();
                        return null;
                    });
            Node node = Node.of("l1", NodeKind.LLM, Map.of("prompt", "{{input}}", "timeout", 1));

            // When
            NodeResult result;
            try {
                result = executor.execute(node, context("hi"));
            } finally {
                release.countDown();
            }

            // Then
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getErrorMessage())
                    .hasValueSatisfying(m -> assertThat(m).contains("saturated"));
            assertThat(result.getMetadata()).containsEntry("error_type", "UNKNOWN");
            verify(inferenceClient, never()).generate(any());
        }
    }

    @Test
    void shouldRequirePromptInConfig() {
        assertThat(executor.validateConfig(Map.of())).containsExactly("LLM node requires a 'prompt'");
        assertThat(executor.validateConfig(Map.of("prompt", "x", "max_tokens", 0)))
                .containsExactly("'max_tokens' must be positive");
    }
}
