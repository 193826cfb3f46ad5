package io.chatflow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.chatflow.core.execution.result.ExecutionResult;
import io.chatflow.core.graph.ChatflowDefinition;
import io.chatflow.core.graph.ValidationReport;

/// Utility class for reading and writing chatflow JSON.
///
/// Provides a pre-configured `ObjectMapper` with the chatflow module and
/// `java.time` support.
///
/// ### Usage
/// {@snippet :
/// // Load a definition
/// ChatflowDefinition definition = ChatflowSerializer.fromJson(json);
///
/// // Write it back in canonical form
/// String canonical = ChatflowSerializer.toJson(definition);
///
/// // Report a turn
/// String report = ChatflowSerializer.toJson(result);
/// }
///
/// @implNote Thread-safe. The mapper is created per call via `createMapper()`.
/// For high-throughput scenarios, cache the mapper.
///
/// @see ChatflowJacksonModule for the registered type handlers
public final class ChatflowSerializer {

    private ChatflowSerializer() {}

    /// Deserializes a chatflow definition.
    ///
    /// @param json JSON string, not null
    /// @return deserialized definition, never null
    /// @throws IllegalArgumentException if the JSON is malformed or lacks required fields
    public static ChatflowDefinition fromJson(String json) {
        try {
            return createMapper().readValue(json, ChatflowDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize chatflow: " + e.getOriginalMessage(), e);
        }
    }

    /// Serializes a chatflow definition to pretty-printed JSON.
    ///
    /// @param definition the definition to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ChatflowDefinition definition) {
        return write(definition, "chatflow");
    }

    /// Serializes a turn result, including its structured error.
    ///
    /// @param result the result to serialize, not null
    /// @return JSON string representation, never null
    public static String toJson(ExecutionResult result) {
        return write(result, "execution result");
    }

    public static String toJson(ValidationReport report) {
        return write(report, "validation report");
    }

    /// Creates an ObjectMapper configured for chatflow serialization.
    ///
    /// Registers:
    /// - `ChatflowJacksonModule` for definitions and results
    /// - `JavaTimeModule` for `Duration` and `Instant` values
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled, so editor-only fields are ignored
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new ChatflowJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static String write(Object value, String what) {
        try {
            return createMapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize " + what + ": " + e.getMessage(), e);
        }
    }
}
