package io.chatflow.core.execution.executor;

import io.chatflow.core.execution.result.ResultStatus;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/// Immutable result of node execution containing status, output, and metadata.
///
/// Executors report every failure through this type instead of throwing, so a
/// failing node always yields exactly one result carrying its cause.
///
/// ### Factory Methods
/// - {@link #success(Object, Map)} for successful execution
/// - {@link #failure(String)} for errors described by a message
/// - {@link #failure(String, Throwable)} for errors with an underlying cause
///
/// @implNote Immutable after construction. Metadata is copied into an unmodifiable map.
/// @see ResultStatus
/// @see NodeExecutor
public final class NodeResult {

    private final ResultStatus status;
    private final Object output;
    private final Map<String, Object> metadata;
    private final String errorMessage;
    private final Throwable error;
    private final Instant timestamp;

    private NodeResult(Builder builder) {
        this.status = builder.status;
        this.output = builder.output;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.errorMessage = builder.errorMessage;
        this.error = builder.error;
        this.timestamp = builder.timestamp;
    }

    public ResultStatus getStatus() {
        return status;
    }

    /// Returns the execution output.
    ///
    /// @return output (text, boolean or parsed structure), may be null
    public Object getOutput() {
        return output;
    }

    /// Returns the output rendered as text, empty for null output.
    public String getOutputText() {
        return output != null ? String.valueOf(output) : "";
    }

    /// Returns additional execution metadata.
    ///
    /// @return unmodifiable metadata map, never null
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /// Returns the failure description, if any.
    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    /// Returns the exception that caused failure.
    ///
    /// @return the cause, or null when none was captured
    public Throwable getError() {
        return error;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean isSuccess() {
        return status == ResultStatus.SUCCESS;
    }

    /// Creates a success result with output and metadata.
    ///
    /// @param output the execution output, may be null
    /// @param metadata additional metadata, not null
    /// @return new success result, never null
    public static NodeResult success(Object output, Map<String, Object> metadata) {
        return builder().status(ResultStatus.SUCCESS).output(output).metadata(metadata).build();
    }

    /// Creates a failure result with an error message.
    ///
    /// @param message the error description, not null
    /// @return new failure result, never null
    public static NodeResult failure(String message) {
        return failure(message, null, Map.of());
    }

    /// Creates a failure result with an error message and its cause.
    ///
    /// @param message the error description, not null
    /// @param cause the underlying exception, may be null
    /// @return new failure result, never null
    public static NodeResult failure(String message, Throwable cause) {
        return failure(message, cause, Map.of());
    }

    /// Creates a failure result carrying diagnostic metadata.
    ///
    /// @param message the error description, not null
    /// @param cause the underlying exception, may be null
    /// @param metadata diagnostic metadata, not null
    /// @return new failure result, never null
    public static NodeResult failure(String message, Throwable cause, Map<String, Object> metadata) {
        return builder()
                .status(ResultStatus.FAILURE)
                .output(null)
                .errorMessage(message)
                .error(cause)
                .metadata(metadata)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing NodeResult instances.
    public static final class Builder {
        private ResultStatus status = ResultStatus.SUCCESS;
        private Object output = "";
        private Map<String, Object> metadata = Map.of();
        private String errorMessage;
        private Throwable error;
        private Instant timestamp = Instant.now();

        private Builder() {}

        public Builder status(ResultStatus status) {
            this.status = status;
            return this;
        }

        public Builder output(Object output) {
            this.output = output;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder error(Throwable error) {
            this.error = error;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public NodeResult build() {
            return new NodeResult(this);
        }
    }
}
