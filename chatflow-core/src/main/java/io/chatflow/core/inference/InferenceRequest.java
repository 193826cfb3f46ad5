package io.chatflow.core.inference;

import io.chatflow.core.session.ConversationTurn;
import java.util.List;
import java.util.Objects;

/// A single prompt plus model parameters sent to an {@link InferenceClient}.
///
/// @param prompt the rendered user prompt, not null
/// @param systemPrompt the rendered system prompt, may be null
/// @param model model identifier, not null
/// @param temperature sampling temperature
/// @param maxTokens upper bound on generated tokens, positive
/// @param history prior conversation messages, oldest first, never null
public record InferenceRequest(
        String prompt,
        String systemPrompt,
        String model,
        double temperature,
        int maxTokens,
        List<ConversationTurn> history) {

    public InferenceRequest {
        Objects.requireNonNull(prompt, "prompt must not be null");
        Objects.requireNonNull(model, "model must not be null");
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        history = history != null ? List.copyOf(history) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link InferenceRequest}.
    public static final class Builder {
        private String prompt;
        private String systemPrompt;
        private String model;
        private double temperature = 0.7;
        private int maxTokens = 2000;
        private List<ConversationTurn> history = List.of();

        private Builder() {}

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder history(List<ConversationTurn> history) {
            this.history = history;
            return this;
        }

        public InferenceRequest build() {
            return new InferenceRequest(prompt, systemPrompt, model, temperature, maxTokens, history);
        }
    }
}
