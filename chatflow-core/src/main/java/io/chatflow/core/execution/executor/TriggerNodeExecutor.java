package io.chatflow.core.execution.executor;

import io.chatflow.core.graph.Node;
import io.chatflow.core.graph.NodeKind;
import java.util.Map;

/// Entry point of a chatflow: passes the user message through as its output.
public class TriggerNodeExecutor implements NodeExecutor {

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.TRIGGER;
    }

    @Override
    public NodeResult execute(Node node, ExecutionContext context) {
        return NodeResult.success(
                context.getUserMessage(), Map.of("message_length", context.getUserMessage().length()));
    }
}
