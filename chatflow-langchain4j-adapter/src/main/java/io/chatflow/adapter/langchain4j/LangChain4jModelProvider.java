package io.chatflow.adapter.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Creates {@link ChatModel} instances for the supported providers, chosen by model
/// name prefix.
///
/// | Prefix | Provider | Credential keys |
/// |---|---|---|
/// | `claude` | Anthropic | `anthropic_api_key`, `ANTHROPIC_API_KEY` |
/// | `gpt`, `o1` | OpenAI | `openai_api_key`, `OPENAI_API_KEY` |
/// | `gemini`, `gemma` | Google AI | `google_api_key`, `GOOGLE_API_KEY` |
/// | `deepseek` | DeepSeek (OpenAI-compatible) | `deepseek_api_key`, `DEEPSEEK_API_KEY` |
///
/// @implNote Stateless apart from the immutable credential map, thread-safe.
public class LangChain4jModelProvider implements ChatModelFactory {

    private static final Logger logger = Logger.getLogger(LangChain4jModelProvider.class.getName());

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    private static final String DEEPSEEK_BASE_URL = "https://api.deepseek.com";

    private final Map<String, String> credentials;
    private final Duration timeout;

    /// Creates a provider with the default HTTP timeout.
    ///
    /// @param credentials API keys by name, not null
    public LangChain4jModelProvider(Map<String, String> credentials) {
        this(credentials, DEFAULT_TIMEOUT);
    }

    /// @param credentials API keys by name, not null
    /// @param timeout HTTP timeout applied to provider calls, not null
    public LangChain4jModelProvider(Map<String, String> credentials, Duration timeout) {
        this.credentials = Map.copyOf(Objects.requireNonNull(credentials, "credentials must not be null"));
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /// Returns whether a model name maps to a supported provider.
    public boolean supportsModel(String modelName) {
        if (modelName == null) return false;
        return modelName.startsWith("claude")
                || modelName.startsWith("gpt")
                || modelName.startsWith("o1")
                || modelName.startsWith("gemini")
                || modelName.startsWith("gemma")
                || modelName.startsWith("deepseek");
    }

    @Override
    public ChatModel create(ModelSettings settings) {
        String modelName = settings.modelName();
        logger.info("Creating LangChain4j chat model: " + modelName);

        if (modelName.startsWith("claude")) {
            return createAnthropicModel(settings);
        } else if (modelName.startsWith("gpt") || modelName.startsWith("o1")) {
            return createOpenAiModel(
                    settings, null, requireApiKey("openai_api_key", "OPENAI_API_KEY"));
        } else if (modelName.startsWith("gemini") || modelName.startsWith("gemma")) {
            return createGoogleAiModel(settings);
        } else if (modelName.startsWith("deepseek")) {
            return createOpenAiModel(
                    settings,
                    DEEPSEEK_BASE_URL,
                    requireApiKey("deepseek_api_key", "DEEPSEEK_API_KEY"));
        }

        throw new IllegalArgumentException("Unsupported model: " + modelName);
    }

    private ChatModel createAnthropicModel(ModelSettings settings) {
        return AnthropicChatModel.builder()
                .apiKey(requireApiKey("anthropic_api_key", "ANTHROPIC_API_KEY"))
                .modelName(settings.modelName())
                .temperature(settings.temperature())
                .maxTokens(settings.maxTokens())
                .timeout(timeout)
                .build();
    }

    /// Creates an OpenAI-compatible model, used for both OpenAI and DeepSeek.
    ///
    /// @param baseUrl custom API endpoint, may be null for the OpenAI default
    private ChatModel createOpenAiModel(ModelSettings settings, String baseUrl, String apiKey) {
        var builder =
                OpenAiChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(settings.modelName())
                        .temperature(settings.temperature())
                        .maxTokens(settings.maxTokens())
                        .timeout(timeout);

        if (baseUrl != null) builder.baseUrl(baseUrl);

        return builder.build();
    }

    private ChatModel createGoogleAiModel(ModelSettings settings) {
        return GoogleAiGeminiChatModel.builder()
                .apiKey(requireApiKey("google_api_key", "GOOGLE_API_KEY"))
                .modelName(settings.modelName())
                .temperature(settings.temperature())
                .maxOutputTokens(settings.maxTokens())
                .timeout(timeout)
                .build();
    }

    /// Looks up an API key, trying each key name in order.
    ///
    /// @throws IllegalStateException if no key name resolves to a value
    private String requireApiKey(String... keyNames) {
        for (String keyName : keyNames) {
            String value = credentials.get(keyName);
            if (value != null && !value.isBlank()) return value;
        }
        throw new IllegalStateException(
                "API key not found. Provide one of: " + String.join(", ", keyNames));
    }
}
