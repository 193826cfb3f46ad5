package io.chatflow.core.graph;

import java.time.Duration;
import java.util.Optional;

/// Per-definition execution settings overriding the engine defaults.
///
/// @param maxIterations iteration cap for one turn, may be null to use the engine default
/// @param timeoutSeconds default per-call timeout for blocking nodes, may be null
public record ChatflowSettings(Integer maxIterations, Integer timeoutSeconds) {

    public static final ChatflowSettings DEFAULTS = new ChatflowSettings(null, null);

    public ChatflowSettings {
        if (maxIterations != null && maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        if (timeoutSeconds != null && timeoutSeconds < 1) {
            throw new IllegalArgumentException(
                    "timeoutSeconds must be positive: " + timeoutSeconds);
        }
    }

    public Optional<Integer> maxIterationsOverride() {
        return Optional.ofNullable(maxIterations);
    }

    public Optional<Duration> timeoutOverride() {
        return Optional.ofNullable(timeoutSeconds).map(Duration::ofSeconds);
    }
}
