package io.chatflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.chatflow.core.graph.Node;
import java.io.IOException;
import java.io.Serial;

/// Writes a node in canonical form: `{"id", "type", "config"}`.
///
/// @implNote Package-private. Registered by {@link ChatflowJacksonModule}.
/// @see NodeDeserializer for the inverse operation
class NodeSerializer extends StdSerializer<Node> {

    @Serial private static final long serialVersionUID = 4403627311519203754L;

    NodeSerializer() {
        super(Node.class);
    }

    @Override
    public void serialize(Node node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", node.id());
        gen.writeStringField("type", node.kind().name());
        gen.writeObjectField("config", node.config());
        gen.writeEndObject();
    }
}
