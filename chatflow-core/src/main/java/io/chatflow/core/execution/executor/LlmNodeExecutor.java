package io.chatflow.core.execution.executor;

import io.chatflow.core.graph.Node;
import io.chatflow.core.graph.NodeKind;
import io.chatflow.core.inference.InferenceClient;
import io.chatflow.core.inference.InferenceException;
import io.chatflow.core.inference.InferenceRequest;
import io.chatflow.core.inference.InferenceResponse;
import io.chatflow.core.template.TemplateResolver;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Renders a prompt and calls the injected {@link InferenceClient}.
///
/// ### Configuration
/// - `prompt`: template, default `{{input}}`
/// - `system_prompt`: template, optional
/// - `model`: default `secret-ai-v1`
/// - `temperature`: default `0.7`
/// - `max_tokens`: default `2000`
/// - `timeout`: seconds, default from the turn context
/// - `include_history`: pass the bounded conversation history, default `true`
///
/// The inference call runs on the supplied executor service so the timeout can
/// be enforced regardless of the client. The timeout is measured from the moment
/// the call starts on a pool thread, so time spent queued behind other turns is
/// not charged to it. A timed-out call is cancelled and reported as a failure
/// with `error_type` `TIMEOUT`. A call that cannot get a pool thread within the
/// same budget fails as saturated without ever reaching the client.
///
/// @implNote Stateless and thread-safe; the executor service is owned by the environment.
public class LlmNodeExecutor implements NodeExecutor {

    private static final Logger logger = Logger.getLogger(LlmNodeExecutor.class.getName());

    public static final String DEFAULT_MODEL = "secret-ai-v1";
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 2000;

    private final InferenceClient inferenceClient;
    private final TemplateResolver templateResolver;
    private final ExecutorService executorService;

    public LlmNodeExecutor(
            InferenceClient inferenceClient,
            TemplateResolver templateResolver,
            ExecutorService executorService) {
        this.inferenceClient = inferenceClient;
        this.templateResolver = templateResolver;
        this.executorService = executorService;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.LLM;
    }

    @Override
    public NodeResult execute(Node node, ExecutionContext context) {
        Map<String, Object> config = node.config();
        InferenceRequest request;
        Duration timeout;
        try {
            request = buildRequest(config, context);
            timeout = ConfigValues.timeout(config, context.getDefaultTimeout());
        } catch (IllegalArgumentException e) {
            return NodeResult.failure("Invalid LLM configuration: " + e.getMessage(), e);
        }

        InferenceRequest prepared = request;
        CompletableFuture<Long> started = new CompletableFuture<>();
        Future<InferenceResponse> call;
        try {
            call =
                    executorService.submit(
                            () -> {
                                started.complete(System.nanoTime());
                                return inferenceClient.generate(prepared);
                            });
        } catch (RejectedExecutionException e) {
            return failure(
                    "Inference pool rejected the call", e, InferenceException.ErrorType.UNKNOWN, request);
        }
        try {
            long startedAt;
            try {
                startedAt = started.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                call.cancel(true);
                logger.warning(
                        "LLM node '"
                                + node.id()
                                + "' waited "
                                + timeout.toSeconds()
                                + "s for a free inference thread");
                return failure(
                        "Inference pool saturated: call did not start within "
                                + timeout.toSeconds()
                                + "s",
                        e,
                        InferenceException.ErrorType.UNKNOWN,
                        request);
            }
            long remaining = timeout.toNanos() - (System.nanoTime() - startedAt);
            InferenceResponse response = call.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
            return NodeResult.success(response.text(), metadata(request, response));
        } catch (TimeoutException e) {
            call.cancel(true);
            logger.warning("LLM node '" + node.id() + "' timed out after " + timeout.toSeconds() + "s");
            return failure(
                    "LLM call timed out after " + timeout.toSeconds() + "s",
                    e,
                    InferenceException.ErrorType.TIMEOUT,
                    request);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            InferenceException.ErrorType type =
                    cause instanceof InferenceException inference
                            ? inference.getErrorType()
                            : InferenceException.ErrorType.UNKNOWN;
            return failure("Inference failed (" + type + "): " + cause.getMessage(), cause, type, request);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return failure("LLM call interrupted", e, InferenceException.ErrorType.UNKNOWN, request);
        }
    }

    @Override
    public List<String> validateConfig(Map<String, Object> config) {
        List<String> problems = new ArrayList<>();
        if (!ConfigValues.hasText(config, "prompt")) {
            problems.add("LLM node requires a 'prompt'");
        }
        try {
            ConfigValues.decimal(config, "temperature", DEFAULT_TEMPERATURE);
            if (ConfigValues.integer(config, "max_tokens", DEFAULT_MAX_TOKENS) <= 0) {
                problems.add("'max_tokens' must be positive");
            }
            ConfigValues.timeout(config, Duration.ofSeconds(1));
        } catch (IllegalArgumentException e) {
            problems.add(e.getMessage());
        }
        return problems;
    }

    private InferenceRequest buildRequest(Map<String, Object> config, ExecutionContext context) {
        Map<String, Object> values = context.templateVariables();
        String prompt =
                templateResolver.resolve(ConfigValues.string(config, "prompt", "{{input}}"), values);
        String systemPrompt =
                config.get("system_prompt") != null
                        ? templateResolver.resolve(config.get("system_prompt").toString(), values)
                        : null;

        return InferenceRequest.builder()
                .prompt(prompt)
                .systemPrompt(systemPrompt)
                .model(ConfigValues.string(config, "model", DEFAULT_MODEL))
                .temperature(ConfigValues.decimal(config, "temperature", DEFAULT_TEMPERATURE))
                .maxTokens(ConfigValues.integer(config, "max_tokens", DEFAULT_MAX_TOKENS))
                .history(
                        ConfigValues.bool(config, "include_history", true)
                                ? context.getHistory()
                                : List.of())
                .build();
    }

    private static Map<String, Object> metadata(InferenceRequest request, InferenceResponse response) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("tokens_used", response.usage().totalTokens());
        metadata.put("input_tokens", response.usage().inputTokens());
        metadata.put("output_tokens", response.usage().outputTokens());
        metadata.put("model", response.model() != null ? response.model() : request.model());
        metadata.put("prompt_length", request.prompt().length());
        metadata.putAll(response.metadata());
        return metadata;
    }

    private static NodeResult failure(
            String message,
            Throwable cause,
            InferenceException.ErrorType type,
            InferenceRequest request) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("error_type", type.name());
        metadata.put("model", request.model());
        return NodeResult.failure(message, cause, metadata);
    }
}
