package io.chatflow.core;

import java.time.Duration;

/// Configuration options for the chatflow execution environment.
///
/// ### Default Values
/// - `maxIterations`: `50` (turn-level iteration cap)
/// - `historyLimit`: `10` (prior messages passed to a turn)
/// - `defaultNodeTimeout`: `30s` (blocking calls without their own `timeout`)
/// - `strictBranching`: `false` (reject multi-edge non-condition nodes when `true`)
/// - `inferenceThreads`: `4` (pool running LLM calls under timeout)
///
/// Per-definition settings (`max_iterations`, `timeout_seconds`) override
/// `maxIterations` and `defaultNodeTimeout` for that chatflow.
///
/// @implNote **Not thread-safe**. This is a mutable configuration object
/// intended to be configured before passing to {@link ChatflowFactory}.
/// Do not modify after environment creation.
///
/// @see ChatflowFactory.Builder#config(ChatflowConfig)
public class ChatflowConfig {
    private int maxIterations = 50;
    private int historyLimit = 10;
    private Duration defaultNodeTimeout = Duration.ofSeconds(30);
    private boolean strictBranching = false;
    private int inferenceThreads = 4;

    /// Creates a configuration with default values.
    public ChatflowConfig() {}

    public int getMaxIterations() {
        return maxIterations;
    }

    /// Sets the hard cap on node executions per turn.
    ///
    /// ### Contracts
    /// - **Precondition**: `maxIterations` is positive
    ///
    /// @param maxIterations the cap, must be positive
    public void setMaxIterations(int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    /// Sets how many prior messages a turn receives. Zero disables history.
    ///
    /// @param historyLimit the limit, must not be negative
    public void setHistoryLimit(int historyLimit) {
        if (historyLimit < 0) {
            throw new IllegalArgumentException("historyLimit must not be negative: " + historyLimit);
        }
        this.historyLimit = historyLimit;
    }

    public Duration getDefaultNodeTimeout() {
        return defaultNodeTimeout;
    }

    /// Sets the timeout for LLM and HTTP calls whose node does not set one.
    ///
    /// @param defaultNodeTimeout the timeout, must be positive
    public void setDefaultNodeTimeout(Duration defaultNodeTimeout) {
        if (defaultNodeTimeout == null || defaultNodeTimeout.isZero() || defaultNodeTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultNodeTimeout must be positive");
        }
        this.defaultNodeTimeout = defaultNodeTimeout;
    }

    public boolean isStrictBranching() {
        return strictBranching;
    }

    /// Enables validation errors for ambiguous branching.
    ///
    /// When enabled, a non-condition node with several outgoing edges, or a
    /// condition edge without a `true`/`false` label, fails validation. When
    /// disabled, the engine follows the first declared edge and logs a warning.
    ///
    /// @param strictBranching `true` to reject ambiguous graphs
    public void setStrictBranching(boolean strictBranching) {
        this.strictBranching = strictBranching;
    }

    public int getInferenceThreads() {
        return inferenceThreads;
    }

    /// Sets the size of the pool that runs inference calls under timeout.
    ///
    /// @param inferenceThreads the pool size, must be positive
    public void setInferenceThreads(int inferenceThreads) {
        if (inferenceThreads < 1) {
            throw new IllegalArgumentException("inferenceThreads must be positive: " + inferenceThreads);
        }
        this.inferenceThreads = inferenceThreads;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link ChatflowConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns
    /// it on {@link #build()}.
    public static class Builder {
        private final ChatflowConfig config = new ChatflowConfig();

        public Builder maxIterations(int maxIterations) {
            config.setMaxIterations(maxIterations);
            return this;
        }

        public Builder historyLimit(int historyLimit) {
            config.setHistoryLimit(historyLimit);
            return this;
        }

        public Builder defaultNodeTimeout(Duration defaultNodeTimeout) {
            config.setDefaultNodeTimeout(defaultNodeTimeout);
            return this;
        }

        public Builder strictBranching(boolean strictBranching) {
            config.setStrictBranching(strictBranching);
            return this;
        }

        public Builder inferenceThreads(int inferenceThreads) {
            config.setInferenceThreads(inferenceThreads);
            return this;
        }

        /// Builds and returns the configured {@link ChatflowConfig} instance.
        ///
        /// @return the configured instance, never null
        public ChatflowConfig build() {
            return config;
        }
    }
}
