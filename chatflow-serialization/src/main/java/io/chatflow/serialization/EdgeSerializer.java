package io.chatflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.chatflow.core.graph.Edge;
import java.io.IOException;
import java.io.Serial;

/// Writes an edge as `{"source", "target"[, "branch_label"]}`.
///
/// @implNote Package-private. Registered by {@link ChatflowJacksonModule}.
class EdgeSerializer extends StdSerializer<Edge> {

    @Serial private static final long serialVersionUID = -5561990345780237160L;

    EdgeSerializer() {
        super(Edge.class);
    }

    @Override
    public void serialize(Edge edge, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("source", edge.source());
        gen.writeStringField("target", edge.target());
        if (edge.branchLabel() != null) {
            gen.writeStringField("branch_label", edge.branchLabel());
        }
        gen.writeEndObject();
    }
}
