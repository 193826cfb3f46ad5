package io.chatflow.adapter.langchain4j;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.TimeoutException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.ChatResponseMetadata;
import io.chatflow.core.inference.InferenceClient;
import io.chatflow.core.inference.InferenceException;
import io.chatflow.core.inference.InferenceException.ErrorType;
import io.chatflow.core.inference.InferenceRequest;
import io.chatflow.core.inference.InferenceResponse;
import io.chatflow.core.inference.TokenUsage;
import io.chatflow.core.session.ConversationTurn;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// {@link InferenceClient} backed by LangChain4j chat models.
///
/// Each request is sent as an ordered message list: the system prompt (when
/// present), the prior conversation, then the user prompt. Models are created
/// lazily through a {@link ChatModelFactory} and cached per {@link ModelSettings}.
///
/// ### Error mapping
/// | LangChain4j exception | {@link ErrorType} |
/// |---|---|
/// | `TimeoutException` | `TIMEOUT` |
/// | `AuthenticationException`, missing API key | `AUTHENTICATION` |
/// | `RateLimitException` | `RATE_LIMITED` |
/// | `InvalidRequestException`, unsupported model | `INVALID_REQUEST` |
/// | anything else | `UNKNOWN` |
///
/// {@snippet :
/// InferenceClient client = new LangChain4jInferenceClient(
///     new LangChain4jModelProvider(ChatflowFactory.loadCredentialsFromEnvironment()));
/// }
///
/// @implNote Thread-safe. LangChain4j chat models hold no per-call state, so one cached
/// model serves concurrent turns.
public class LangChain4jInferenceClient implements InferenceClient {

    private static final Logger logger =
            Logger.getLogger(LangChain4jInferenceClient.class.getName());

    private final ChatModelFactory modelFactory;
    private final Map<ModelSettings, ChatModel> models = new ConcurrentHashMap<>();

    public LangChain4jInferenceClient(ChatModelFactory modelFactory) {
        this.modelFactory = Objects.requireNonNull(modelFactory, "modelFactory must not be null");
    }

    @Override
    public InferenceResponse generate(InferenceRequest request) throws InferenceException {
        ChatModel model = modelFor(request);
        List<ChatMessage> messages = buildMessages(request);

        ChatResponse response;
        try {
            logger.fine(
                    "Sending "
                            + messages.size()
                            + " messages to model '"
                            + request.model()
                            + "'");
            response = model.chat(messages);
        } catch (RuntimeException e) {
            throw translate(request.model(), e);
        }

        if (response == null || response.aiMessage() == null) {
            throw new InferenceException(ErrorType.UNKNOWN, "No response from model");
        }
        String text = response.aiMessage().text();
        return new InferenceResponse(
                text != null ? text : "",
                usageOf(response.metadata()),
                modelNameOf(response.metadata(), request.model()),
                metadataOf(response.metadata()));
    }

    private ChatModel modelFor(InferenceRequest request) throws InferenceException {
        ModelSettings settings =
                new ModelSettings(request.model(), request.temperature(), request.maxTokens());
        try {
            return models.computeIfAbsent(settings, modelFactory::create);
        } catch (IllegalStateException e) {
            throw new InferenceException(ErrorType.AUTHENTICATION, e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new InferenceException(ErrorType.INVALID_REQUEST, e.getMessage(), e);
        }
    }

    /// Builds the ordered message list: system prompt, history, then user prompt.
    private static List<ChatMessage> buildMessages(InferenceRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.systemPrompt()));
        }
        for (ConversationTurn turn : request.history()) {
            messages.add(
                    turn.role() == ConversationTurn.Role.USER
                            ? UserMessage.from(turn.content())
                            : AiMessage.from(turn.content()));
        }
        messages.add(UserMessage.from(request.prompt()));
        return messages;
    }

    private static InferenceException translate(String model, RuntimeException e) {
        ErrorType type;
        if (e instanceof TimeoutException) {
            type = ErrorType.TIMEOUT;
        } else if (e instanceof AuthenticationException) {
            type = ErrorType.AUTHENTICATION;
        } else if (e instanceof RateLimitException) {
            type = ErrorType.RATE_LIMITED;
        } else if (e instanceof InvalidRequestException) {
            type = ErrorType.INVALID_REQUEST;
        } else {
            type = ErrorType.UNKNOWN;
        }
        logger.warning("Model '" + model + "' call failed (" + type + ")");
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new InferenceException(type, message, e);
    }

    private static TokenUsage usageOf(ChatResponseMetadata metadata) {
        if (metadata == null || metadata.tokenUsage() == null) {
            return TokenUsage.NONE;
        }
        var usage = metadata.tokenUsage();
        int input = usage.inputTokenCount() != null ? usage.inputTokenCount() : 0;
        int output = usage.outputTokenCount() != null ? usage.outputTokenCount() : 0;
        return usage.totalTokenCount() != null
                ? new TokenUsage(input, output, usage.totalTokenCount())
                : TokenUsage.of(input, output);
    }

    private static String modelNameOf(ChatResponseMetadata metadata, String requested) {
        return metadata != null && metadata.modelName() != null ? metadata.modelName() : requested;
    }

    private static Map<String, Object> metadataOf(ChatResponseMetadata metadata) {
        Map<String, Object> result = new HashMap<>();
        if (metadata != null && metadata.finishReason() != null) {
            result.put("finish_reason", metadata.finishReason().toString());
        }
        if (metadata != null && metadata.id() != null) {
            result.put("response_id", metadata.id());
        }
        return result;
    }
}
