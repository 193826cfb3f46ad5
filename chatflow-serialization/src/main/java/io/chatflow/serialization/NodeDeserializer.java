package io.chatflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.chatflow.core.graph.Node;
import io.chatflow.core.graph.NodeKind;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Deserializes a node from the editor format.
///
/// ### Accepted shapes
/// ```json
/// {"id": "l1", "type": "llm", "data": {"config": {"prompt": "{{input}}"}}}
/// {"id": "l1", "kind": "llm", "config": {"prompt": "{{input}}"}}
/// ```
///
/// A top-level `config` wins over `data.config`. Other editor fields
/// (`position`, `data.label`) are ignored.
///
/// @implNote Package-private. Registered by {@link ChatflowJacksonModule}.
class NodeDeserializer extends StdDeserializer<Node> {

    @Serial private static final long serialVersionUID = -2315839602447211808L;

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    NodeDeserializer() {
        super(Node.class);
    }

    @Override
    public Node deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String id = JsonFields.requiredText(ctxt, root, "id", Node.class);
        String kind =
                JsonFields.textOrNull(root, "type") != null
                        ? JsonFields.textOrNull(root, "type")
                        : JsonFields.textOrNull(root, "kind");
        if (kind == null || kind.isBlank()) {
            return ctxt.reportInputMismatch(
                    Node.class, "Node '%s' is missing its \"type\"", id);
        }

        JsonNode config = root.get("config");
        if (config == null || config.isNull()) {
            config = root.path("data").get("config");
        }
        Map<String, Object> values =
                config != null && config.isObject()
                        ? mapper.convertValue(config, OBJECT_MAP)
                        : Map.of();

        return Node.of(id, NodeKind.of(kind), values);
    }
}
