package io.chatflow.adapter.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LangChain4jModelProviderTest {

    private final LangChain4jModelProvider provider =
            new LangChain4jModelProvider(
                    Map.of(
                            "ANTHROPIC_API_KEY", "sk-ant-test",
                            "openai_api_key", "sk-test",
                            "GOOGLE_API_KEY", "g-test"));

    @Test
    void shouldSupportKnownPrefixesOnly() {
        assertThat(provider.supportsModel("claude-sonnet-4")).isTrue();
        assertThat(provider.supportsModel("gpt-4o")).isTrue();
        assertThat(provider.supportsModel("gemini-2.0-flash")).isTrue();
        assertThat(provider.supportsModel("deepseek-chat")).isTrue();
        assertThat(provider.supportsModel("secret-ai-v1")).isFalse();
        assertThat(provider.supportsModel(null)).isFalse();
    }

    @Test
    void shouldCreateModelForProviderPrefix() {
        assertThat(provider.create(new ModelSettings("claude-sonnet-4", 0.2, 500)))
                .isInstanceOf(AnthropicChatModel.class);
        assertThat(provider.create(new ModelSettings("gpt-4o", 0.2, 500)))
                .isInstanceOf(OpenAiChatModel.class);
        assertThat(provider.create(new ModelSettings("gemini-2.0-flash", 0.2, 500)))
                .isInstanceOf(GoogleAiGeminiChatModel.class);
    }

    @Test
    void shouldRejectUnsupportedModel() {
        assertThatThrownBy(() -> provider.create(new ModelSettings("secret-ai-v1", 0.7, 2000)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported model: secret-ai-v1");
    }

    @Test
    void shouldRequireProviderApiKey() {
        assertThatThrownBy(() -> provider.create(new ModelSettings("deepseek-chat", 0.7, 2000)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("API key not found. Provide one of: deepseek_api_key, DEEPSEEK_API_KEY");
    }
}
