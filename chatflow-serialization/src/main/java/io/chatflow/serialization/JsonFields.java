package io.chatflow.serialization;

import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;

/// Field helpers shared by the tree-based deserializers.
final class JsonFields {

    private JsonFields() {}

    /// Returns the field as text, or null when absent or JSON null.
    static String textOrNull(JsonNode root, String field) {
        JsonNode value = root.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /// Returns the field as non-blank text, reporting a mismatch otherwise.
    static String requiredText(
            DeserializationContext ctxt, JsonNode root, String field, Class<?> target)
            throws IOException {
        String value = textOrNull(root, field);
        if (value == null || value.isBlank()) {
            return ctxt.reportInputMismatch(
                    target, "Missing required field \"%s\" in %s", field, target.getSimpleName());
        }
        return value;
    }
}
