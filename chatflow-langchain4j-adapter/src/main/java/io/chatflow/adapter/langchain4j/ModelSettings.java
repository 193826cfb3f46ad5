package io.chatflow.adapter.langchain4j;

import java.util.Objects;

/// Parameters that identify one configured chat model instance.
///
/// Used as the cache key in {@link LangChain4jInferenceClient}: two requests with
/// equal settings share a model.
///
/// @param modelName provider model name such as `claude-sonnet-4`, not null
/// @param temperature sampling temperature
/// @param maxTokens upper bound on generated tokens, positive
public record ModelSettings(String modelName, double temperature, int maxTokens) {

    public ModelSettings {
        Objects.requireNonNull(modelName, "modelName must not be null");
    }
}
