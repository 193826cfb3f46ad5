package io.chatflow.core.inference;

/// Text generation capability used by LLM nodes.
///
/// Implementations talk to a model provider. They may block; the LLM node
/// executor enforces the per-call timeout around them.
///
/// @implNote Implementations must be thread-safe: concurrent turns share one client.
/// @see StubInferenceClient
@FunctionalInterface
public interface InferenceClient {

    /// Generates text for the given request.
    ///
    /// @param request prompt and model parameters, not null
    /// @return the generated response, never null
    /// @throws InferenceException if the provider rejects or fails the call
    InferenceResponse generate(InferenceRequest request) throws InferenceException;
}
