package io.chatflow.core.execution.executor;

import static org.assertj.core.api.Assertions.assertThat;

import io.chatflow.core.graph.Node;
import io.chatflow.core.graph.NodeKind;
import io.chatflow.core.json.BasicJsonCodec;
import io.chatflow.core.template.SimpleTemplateResolver;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ResponseNodeExecutor")
class ResponseNodeExecutorTest {

    private final ResponseNodeExecutor executor =
            new ResponseNodeExecutor(
                    new SimpleTemplateResolver(),
                    new BasicJsonCodec(),
                    Clock.fixed(Instant.parse("2026-01-02T03:04:05Z"), ZoneOffset.UTC));

    private final ExecutionContext context =
            ExecutionContext.builder()
                    .userMessage("hi")
                    .variables(Map.of("l1", "Hello there"))
                    .build();

    @Test
    void shouldRenderMessageFromPriorOutput() {
        // When
        NodeResult result =
                executor.execute(
                        Node.of("r1", NodeKind.RESPONSE, Map.of("message", "{{l1}} (you said {{input}})")),
                        context);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOutputText()).isEqualTo("Hello there (you said hi)");
        assertThat(result.getMetadata()).containsEntry("format", "text");
    }

    @Test
    void shouldEchoUserMessageByDefault() {
        assertThat(executor.execute(Node.of("r1", NodeKind.RESPONSE), context).getOutputText())
                .isEqualTo("hi");
    }

    @Test
    void shouldWrapJsonFormat() {
        // When
        NodeResult result =
                executor.execute(
                        Node.of("r1", NodeKind.RESPONSE, Map.of("message", "{{l1}}", "format", "JSON")),
                        context);

        // Then
        assertThat(result.getOutputText())
                .isEqualTo("{\"response\":\"Hello there\",\"timestamp\":\"2026-01-02T03:04:05Z\"}");
        assertThat(result.getMetadata()).containsEntry("format", "json");
    }

    @Test
    void shouldFailOnUnknownFormat() {
        // When
        NodeResult result =
                executor.execute(Node.of("r1", NodeKind.RESPONSE, Map.of("format", "xml")), context);

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(executor.validateConfig(Map.of("format", "xml")))
                .containsExactly(
                        "Response node requires a 'message'", "Unsupported response format: xml");
    }
}
