package io.chatflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.chatflow.core.graph.ChatflowDefinition;
import io.chatflow.core.graph.ChatflowSettings;
import io.chatflow.core.graph.Edge;
import io.chatflow.core.graph.Node;
import java.io.IOException;
import java.io.Serial;
import java.util.List;
import java.util.Map;

/// Deserializes a chatflow definition.
///
/// ### Format
/// ```json
/// {
///   "id": "support-bot", "name": "Support", "version": 3,
///   "nodes": [{"id": "t1", "type": "trigger", "data": {"config": {}}}],
///   "edges": [{"source": "t1", "target": "r1"}],
///   "variables": {"greeting": "Hello"},
///   "settings": {"max_iterations": 10, "timeout_seconds": 30}
/// }
/// ```
///
/// Node and edge order is preserved: it decides start-node reporting and
/// which edge an ambiguous node follows. Structural problems are not checked
/// here; they surface when the definition is built into a graph.
///
/// @implNote Package-private. Registered by {@link ChatflowJacksonModule}.
/// @see ChatflowDefinitionSerializer for the inverse operation
class ChatflowDefinitionDeserializer extends StdDeserializer<ChatflowDefinition> {

    @Serial private static final long serialVersionUID = -7406329183170318573L;

    private static final TypeReference<List<Node>> NODE_LIST = new TypeReference<>() {};
    private static final TypeReference<List<Edge>> EDGE_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    ChatflowDefinitionDeserializer() {
        super(ChatflowDefinition.class);
    }

    @Override
    public ChatflowDefinition deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        ChatflowDefinition.Builder builder =
                ChatflowDefinition.builder()
                        .id(JsonFields.requiredText(ctxt, root, "id", ChatflowDefinition.class))
                        .name(JsonFields.textOrNull(root, "name"))
                        .version(root.path("version").asInt(1));

        if (root.hasNonNull("nodes")) {
            builder.nodes(mapper.readerFor(NODE_LIST).readValue(root.get("nodes")));
        }
        if (root.hasNonNull("edges")) {
            builder.edges(mapper.readerFor(EDGE_LIST).readValue(root.get("edges")));
        }
        if (root.hasNonNull("variables")) {
            builder.variables(mapper.convertValue(root.get("variables"), OBJECT_MAP));
        }
        if (root.hasNonNull("settings")) {
            builder.settings(readSettings(ctxt, root.get("settings")));
        }
        return builder.build();
    }

    private static ChatflowSettings readSettings(DeserializationContext ctxt, JsonNode settings)
            throws IOException {
        try {
            return new ChatflowSettings(
                    intOrNull(settings, "max_iterations"), intOrNull(settings, "timeout_seconds"));
        } catch (IllegalArgumentException e) {
            return ctxt.reportInputMismatch(
                    ChatflowSettings.class, "Invalid settings: %s", e.getMessage());
        }
    }

    private static Integer intOrNull(JsonNode root, String field) {
        JsonNode value = root.get(field);
        return value == null || value.isNull() ? null : value.asInt();
    }
}
