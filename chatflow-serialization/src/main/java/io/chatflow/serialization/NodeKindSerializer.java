package io.chatflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.chatflow.core.graph.NodeKind;
import java.io.IOException;
import java.io.Serial;

/// Writes a node kind as its wire name.
class NodeKindSerializer extends StdSerializer<NodeKind> {

    @Serial private static final long serialVersionUID = 1784006612503457929L;

    NodeKindSerializer() {
        super(NodeKind.class);
    }

    @Override
    public void serialize(NodeKind kind, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeString(kind.name());
    }
}
