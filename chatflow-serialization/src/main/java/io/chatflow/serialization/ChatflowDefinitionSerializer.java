package io.chatflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.chatflow.core.graph.ChatflowDefinition;
import io.chatflow.core.graph.ChatflowSettings;
import io.chatflow.core.graph.Edge;
import io.chatflow.core.graph.Node;
import java.io.IOException;
import java.io.Serial;

/// Writes a definition in canonical form.
///
/// Nodes use `type` and a top-level `config`; edges use `branch_label`.
/// Unset settings are omitted.
///
/// @implNote Package-private. Registered by {@link ChatflowJacksonModule}.
class ChatflowDefinitionSerializer extends StdSerializer<ChatflowDefinition> {

    @Serial private static final long serialVersionUID = 3320984215406877109L;

    ChatflowDefinitionSerializer() {
        super(ChatflowDefinition.class);
    }

    @Override
    public void serialize(
            ChatflowDefinition definition, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", definition.getId());
        gen.writeStringField("name", definition.getName());
        gen.writeNumberField("version", definition.getVersion());

        gen.writeArrayFieldStart("nodes");
        for (Node node : definition.getNodes()) {
            gen.writeObject(node);
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("edges");
        for (Edge edge : definition.getEdges()) {
            gen.writeObject(edge);
        }
        gen.writeEndArray();

        if (!definition.getVariables().isEmpty()) {
            gen.writeObjectField("variables", definition.getVariables());
        }

        ChatflowSettings settings = definition.getSettings();
        if (settings.maxIterations() != null || settings.timeoutSeconds() != null) {
            gen.writeObjectFieldStart("settings");
            if (settings.maxIterations() != null) {
                gen.writeNumberField("max_iterations", settings.maxIterations());
            }
            if (settings.timeoutSeconds() != null) {
                gen.writeNumberField("timeout_seconds", settings.timeoutSeconds());
            }
            gen.writeEndObject();
        }
        gen.writeEndObject();
    }
}
