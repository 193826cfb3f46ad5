package io.chatflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.chatflow.core.execution.result.ExecutionError;
import io.chatflow.core.execution.result.ExecutionResult;
import io.chatflow.core.execution.result.NodeTiming;
import java.io.IOException;
import java.io.Serial;

/// Writes a turn result for reporting.
///
/// ```json
/// {
///   "status": "FAILED", "success": false, "output_text": "",
///   "nodes_executed": ["t1", "l1"],
///   "timings": [{"node_id": "t1", "duration_ms": 0}, {"node_id": "l1", "duration_ms": 812}],
///   "total_duration_ms": 815,
///   "error": {"kind": "NODE_EXECUTION", "detail": "...", "node_id": "l1", "node_kind": "llm",
///             "cause": "io.chatflow.core.inference.InferenceException: ...",
///             "metadata": {"error_type": "AUTHENTICATION"}}
/// }
/// ```
///
/// The error cause is written as its `toString()` only; stack traces are not serialized.
///
/// @implNote Package-private. Write-only; results are reports, not inputs.
class ExecutionResultSerializer extends StdSerializer<ExecutionResult> {

    @Serial private static final long serialVersionUID = -1297301868025906043L;

    ExecutionResultSerializer() {
        super(ExecutionResult.class);
    }

    @Override
    public void serialize(ExecutionResult result, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("status", result.status().name());
        gen.writeBooleanField("success", result.success());
        gen.writeStringField("output_text", result.outputText());
        if (result.responseNodeId() != null) {
            gen.writeStringField("response_node_id", result.responseNodeId());
        }

        gen.writeArrayFieldStart("nodes_executed");
        for (String nodeId : result.nodesExecuted()) {
            gen.writeString(nodeId);
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("timings");
        for (NodeTiming timing : result.timings()) {
            gen.writeStartObject();
            gen.writeStringField("node_id", timing.nodeId());
            gen.writeNumberField("duration_ms", timing.durationMs());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeNumberField("total_duration_ms", result.totalDuration().toMillis());

        if (result.error() != null) {
            gen.writeFieldName("error");
            writeError(result.error(), gen);
        }
        gen.writeEndObject();
    }

    private static void writeError(ExecutionError error, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("kind", error.kind().name());
        gen.writeStringField("detail", error.detail());

        if (error instanceof ExecutionError.NodeError nodeError) {
            gen.writeStringField("node_id", nodeError.nodeId());
            gen.writeStringField("node_kind", nodeError.nodeKind().name());
        }
        if (error instanceof ExecutionError.NodeExecutionFailed failed) {
            if (failed.cause() != null) {
                gen.writeStringField("cause", failed.cause().toString());
            }
            gen.writeObjectField("metadata", failed.metadata());
        } else if (error instanceof ExecutionError.BudgetExceeded budget) {
            gen.writeNumberField("max_iterations", budget.maxIterations());
            gen.writeStringField("last_node_id", budget.lastNodeId());
        } else if (error instanceof ExecutionError.DeadEnd deadEnd) {
            gen.writeStringField("node_id", deadEnd.nodeId());
            gen.writeStringField("reason", deadEnd.reason());
        }
        gen.writeEndObject();
    }
}
