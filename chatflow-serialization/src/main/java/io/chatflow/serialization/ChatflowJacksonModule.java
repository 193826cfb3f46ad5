package io.chatflow.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.chatflow.core.execution.result.ExecutionResult;
import io.chatflow.core.graph.ChatflowDefinition;
import io.chatflow.core.graph.Edge;
import io.chatflow.core.graph.Node;
import io.chatflow.core.graph.NodeKind;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all chatflow serialization configuration in one place.
///
/// - `ChatflowDefinition`: {@link ChatflowDefinitionSerializer} / {@link ChatflowDefinitionDeserializer}
/// - `Node`: {@link NodeSerializer} / {@link NodeDeserializer}, kind read from `"type"` or `"kind"`
/// - `Edge`: {@link EdgeSerializer} / {@link EdgeDeserializer}, label read from
///   `"branch_label"` or `"condition"`
/// - `NodeKind`: written as its lowercase name
/// - `ExecutionResult`: {@link ExecutionResultSerializer}, write-only
///
/// @implNote All registrations are explicit; no classpath scanning.
/// @see ChatflowSerializer for the convenience factory API
public class ChatflowJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 6120934818327046112L;

    public ChatflowJacksonModule() {
        super("ChatflowJacksonModule");

        addSerializer(ChatflowDefinition.class, new ChatflowDefinitionSerializer());
        addDeserializer(ChatflowDefinition.class, new ChatflowDefinitionDeserializer());

        addSerializer(Node.class, new NodeSerializer());
        addDeserializer(Node.class, new NodeDeserializer());

        addSerializer(Edge.class, new EdgeSerializer());
        addDeserializer(Edge.class, new EdgeDeserializer());

        addSerializer(NodeKind.class, new NodeKindSerializer());

        addSerializer(ExecutionResult.class, new ExecutionResultSerializer());
    }
}
