package io.chatflow.adapter.langchain4j;

import dev.langchain4j.model.chat.ChatModel;

/// Creates LangChain4j chat models for a given set of model settings.
///
/// @see LangChain4jModelProvider for the provider-backed implementation
@FunctionalInterface
public interface ChatModelFactory {

    /// Creates a chat model.
    ///
    /// @param settings model name and sampling parameters, not null
    /// @return configured chat model, never null
    /// @throws IllegalArgumentException if the model name is not supported
    /// @throws IllegalStateException if a required API key is missing
    ChatModel create(ModelSettings settings);
}
