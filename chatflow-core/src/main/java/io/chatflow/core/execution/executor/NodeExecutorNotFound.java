package io.chatflow.core.execution.executor;

import io.chatflow.core.graph.NodeKind;
import java.io.Serial;

public class NodeExecutorNotFound extends Exception {
    @Serial private static final long serialVersionUID = 4569044560797025331L;

    private final NodeKind nodeKind;

    public NodeExecutorNotFound(NodeKind nodeKind) {
        super("No executor registered for node kind: " + nodeKind);
        this.nodeKind = nodeKind;
    }

    public NodeKind getNodeKind() {
        return nodeKind;
    }
}
