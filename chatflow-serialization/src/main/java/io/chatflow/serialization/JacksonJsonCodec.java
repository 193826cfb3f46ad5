package io.chatflow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.chatflow.core.json.JsonCodec;
import io.chatflow.core.json.JsonFormatException;
import java.util.Objects;

/// Jackson-based implementation of {@link JsonCodec}.
///
/// Parses HTTP response bodies into plain maps, lists and scalars so templates
/// can address nested fields (`{{weather.current.temp}}`). Writes compact JSON
/// for request bodies and `json`-format responses.
///
/// @implNote Thread-safe if the supplied {@link ObjectMapper} is thread-safe
/// (Jackson's default mapper is once configured).
/// @see io.chatflow.core.execution.executor.HttpRequestNodeExecutor for the primary caller
public class JacksonJsonCodec implements JsonCodec {

    private final ObjectMapper objectMapper;

    /// Creates a codec over a compact copy of {@link ChatflowSerializer#createMapper()}.
    public JacksonJsonCodec() {
        this(ChatflowSerializer.createMapper().disable(SerializationFeature.INDENT_OUTPUT));
    }

    /// Creates a codec backed by the given Jackson mapper.
    ///
    /// @param objectMapper the mapper to use, not null
    public JacksonJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public Object parse(String json) throws JsonFormatException {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return objectMapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new JsonFormatException("Failed to parse JSON: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to write JSON: " + e.getMessage(), e);
        }
    }
}
