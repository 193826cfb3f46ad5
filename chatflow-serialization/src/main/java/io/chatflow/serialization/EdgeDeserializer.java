package io.chatflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.chatflow.core.graph.Edge;
import java.io.IOException;
import java.io.Serial;

/// Deserializes an edge.
///
/// The branch label is read from `"branch_label"`, falling back to the
/// editor's `"condition"` field. Boolean labels (`"condition": true`) are
/// accepted as their text. The editor's edge `"id"` is ignored.
///
/// @implNote Package-private. Registered by {@link ChatflowJacksonModule}.
class EdgeDeserializer extends StdDeserializer<Edge> {

    @Serial private static final long serialVersionUID = 8148519283360447625L;

    EdgeDeserializer() {
        super(Edge.class);
    }

    @Override
    public Edge deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode root = p.getCodec().readTree(p);

        String source = JsonFields.requiredText(ctxt, root, "source", Edge.class);
        String target = JsonFields.requiredText(ctxt, root, "target", Edge.class);
        String label = JsonFields.textOrNull(root, "branch_label");
        if (label == null) {
            label = JsonFields.textOrNull(root, "condition");
        }
        return Edge.labeled(source, target, label);
    }
}
