package io.chatflow.core.inference;

import java.util.Map;
import java.util.Objects;

/// Generated text returned by an {@link InferenceClient}.
///
/// @param text the generated text, not null
/// @param usage token accounting, not null
/// @param model the model that served the request, may be null when unknown
/// @param metadata provider-specific details such as finish reason, never null
public record InferenceResponse(
        String text, TokenUsage usage, String model, Map<String, Object> metadata) {

    public InferenceResponse {
        Objects.requireNonNull(text, "text must not be null");
        usage = usage != null ? usage : TokenUsage.NONE;
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static InferenceResponse of(String text, TokenUsage usage) {
        return new InferenceResponse(text, usage, null, Map.of());
    }
}
