package io.chatflow.core.inference;

/// Token accounting reported by an inference call.
///
/// @param inputTokens tokens consumed by the prompt, non-negative
/// @param outputTokens tokens generated, non-negative
/// @param totalTokens total billed tokens, non-negative
public record TokenUsage(int inputTokens, int outputTokens, int totalTokens) {

    public static final TokenUsage NONE = new TokenUsage(0, 0, 0);

    public TokenUsage {
        if (inputTokens < 0 || outputTokens < 0 || totalTokens < 0) {
            throw new IllegalArgumentException("Token counts must not be negative");
        }
    }

    /// Creates usage whose total is the sum of input and output.
    public static TokenUsage of(int inputTokens, int outputTokens) {
        return new TokenUsage(inputTokens, outputTokens, inputTokens + outputTokens);
    }
}
