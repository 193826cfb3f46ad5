package io.chatflow.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatflow.core.execution.result.ExecutionError;
import io.chatflow.core.execution.result.ExecutionResult;
import io.chatflow.core.execution.result.ExecutionStatus;
import io.chatflow.core.execution.result.NodeTiming;
import io.chatflow.core.graph.ChatflowDefinition;
import io.chatflow.core.graph.ChatflowSettings;
import io.chatflow.core.graph.Edge;
import io.chatflow.core.graph.Graph;
import io.chatflow.core.graph.GraphBuilder;
import io.chatflow.core.graph.Node;
import io.chatflow.core.graph.NodeKind;
import io.chatflow.core.graph.ValidationReport;
import io.chatflow.core.inference.InferenceException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ChatflowSerializer")
class ChatflowSerializerTest {

    private static String resource(String path) throws IOException {
        try (InputStream in = ChatflowSerializerTest.class.getResourceAsStream(path)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Nested
    @DisplayName("definitions")
    class Definitions {

        @Test
        void shouldReadEditorFormat() throws IOException {
            // When
            ChatflowDefinition definition =
                    ChatflowSerializer.fromJson(resource("/chatflows/support-bot.json"));

            // Then
            assertThat(definition.getId()).isEqualTo("support-bot");
            assertThat(definition.getName()).isEqualTo("Support");
            assertThat(definition.getVersion()).isEqualTo(3);
            assertThat(definition.getNodes())
                    .extracting(Node::id)
                    .containsExactly("t1", "c1", "l1", "r_help", "r_bye");
            assertThat(definition.getNodes().get(2).kind()).isEqualTo(NodeKind.LLM);
            assertThat(definition.getNodes().get(2).config())
                    .containsEntry("model", "claude-sonnet-4")
                    .containsEntry("max_tokens", 500)
                    .containsEntry("temperature", 0.3);
            assertThat(definition.getNodes().get(4).config()).containsEntry("message", "Goodbye");
            assertThat(definition.getEdges())
                    .extracting(Edge::branchLabel)
                    .containsExactly(null, "true", "false", null);
            assertThat(definition.getVariables()).containsEntry("greeting", "Hello");
            assertThat(definition.getSettings()).isEqualTo(new ChatflowSettings(10, 20));
        }

        @Test
        void shouldBuildValidGraphFromEditorFormat() throws IOException {
            // When
            Graph graph =
                    new GraphBuilder()
                            .build(ChatflowSerializer.fromJson(resource("/chatflows/support-bot.json")));

            // Then
            assertThat(graph.isValid()).isTrue();
            assertThat(graph.getStart()).contains("t1");
        }

        @Test
        void shouldRoundTripCanonicalForm() {
            // Given
            ChatflowDefinition original =
                    ChatflowDefinition.builder()
                            .id("faq")
                            .version(2)
                            .node(Node.of("t1", NodeKind.TRIGGER))
                            .node(Node.of("c1", NodeKind.CONDITION, Map.of("operator", "is_empty")))
                            .node(Node.of("r1", NodeKind.RESPONSE, Map.of("message", "Say something")))
                            .node(Node.of("r2", NodeKind.RESPONSE, Map.of("message", "{{input}}")))
                            .edge(Edge.of("t1", "c1"))
                            .edge(Edge.labeled("c1", "r1", "true"))
                            .edge(Edge.labeled("c1", "r2", "false"))
                            .variable("tone", "warm")
                            .settings(new ChatflowSettings(5, null))
                            .build();

            // When
            ChatflowDefinition restored = ChatflowSerializer.fromJson(ChatflowSerializer.toJson(original));

            // Then
            assertThat(restored.getId()).isEqualTo("faq");
            assertThat(restored.getName()).isEqualTo("faq");
            assertThat(restored.getVersion()).isEqualTo(2);
            assertThat(restored.getNodes()).isEqualTo(original.getNodes());
            assertThat(restored.getEdges()).isEqualTo(original.getEdges());
            assertThat(restored.getVariables()).isEqualTo(original.getVariables());
            assertThat(restored.getSettings()).isEqualTo(original.getSettings());
        }

        @Test
        void shouldDefaultVersionAndIgnoreUnknownFields() {
            // When
            ChatflowDefinition definition =
                    ChatflowSerializer.fromJson(
                            "{\"id\": \"x\", \"owner\": \"ops\", \"nodes\": [{\"id\": \"t1\", \"type\": \"TRIGGER\"}]}");

            // Then
            assertThat(definition.getVersion()).isEqualTo(1);
            assertThat(definition.getNodes()).containsExactly(Node.of("t1", NodeKind.TRIGGER));
            assertThat(definition.getEdges()).isEmpty();
        }

        @Test
        void shouldRejectNodeWithoutType() {
            assertThatThrownBy(
                            () -> ChatflowSerializer.fromJson("{\"id\": \"x\", \"nodes\": [{\"id\": \"n1\"}]}"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("n1");
        }

        @Test
        void shouldRejectDefinitionWithoutId() {
            assertThatThrownBy(() -> ChatflowSerializer.fromJson("{\"nodes\": []}"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("\"id\"");
        }

        @Test
        void shouldRejectNonPositiveSettings() {
            assertThatThrownBy(
                            () ->
                                    ChatflowSerializer.fromJson(
                                            "{\"id\": \"x\", \"settings\": {\"max_iterations\": 0}}"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Invalid settings");
        }
    }

    @Nested
    @DisplayName("reports")
    class Reports {

        private final ObjectMapper mapper = new ObjectMapper();

        @Test
        void shouldWriteFailedResultWithStructuredError() throws IOException {
            // Given
            ExecutionResult result =
                    new ExecutionResult(
                            ExecutionStatus.FAILED,
                            "",
                            List.of("t1", "l1"),
                            List.of(new NodeTiming("t1", 0), new NodeTiming("l1", 812)),
                            new ExecutionError.NodeExecutionFailed(
                                    "l1",
                                    NodeKind.LLM,
                                    "Inference failed (AUTHENTICATION): bad key",
                                    new InferenceException(
                                            InferenceException.ErrorType.AUTHENTICATION, "bad key"),
                                    Map.of("error_type", "AUTHENTICATION")),
                            null,
                            Duration.ofMillis(815));

            // When
            JsonNode json = mapper.readTree(ChatflowSerializer.toJson(result));

            // Then
            assertThat(json.get("status").asText()).isEqualTo("FAILED");
            assertThat(json.get("success").asBoolean()).isFalse();
            assertThat(json.get("nodes_executed")).hasSize(2);
            assertThat(json.get("timings").get(1).get("duration_ms").asLong()).isEqualTo(812);
            assertThat(json.get("total_duration_ms").asLong()).isEqualTo(815);
            JsonNode error = json.get("error");
            assertThat(error.get("kind").asText()).isEqualTo("NODE_EXECUTION");
            assertThat(error.get("node_id").asText()).isEqualTo("l1");
            assertThat(error.get("node_kind").asText()).isEqualTo("llm");
            assertThat(error.get("cause").asText()).contains("bad key");
            assertThat(error.get("metadata").get("error_type").asText()).isEqualTo("AUTHENTICATION");
        }

        @Test
        void shouldWriteSucceededResultWithoutError() throws IOException {
            // Given
            ExecutionResult result =
                    new ExecutionResult(
                            ExecutionStatus.SUCCEEDED,
                            "hi",
                            List.of("t1", "r1"),
                            List.of(),
                            null,
                            "r1",
                            Duration.ofMillis(3));

            // When
            JsonNode json = mapper.readTree(ChatflowSerializer.toJson(result));

            // Then
            assertThat(json.get("output_text").asText()).isEqualTo("hi");
            assertThat(json.get("response_node_id").asText()).isEqualTo("r1");
            assertThat(json.has("error")).isFalse();
        }

        @Test
        void shouldWriteBudgetAndValidationReports() throws IOException {
            // Given
            ExecutionResult aborted =
                    new ExecutionResult(
                            ExecutionStatus.ABORTED,
                            null,
                            List.of("t1", "c1"),
                            List.of(),
                            new ExecutionError.BudgetExceeded(2, "c1"),
                            null,
                            Duration.ZERO);

            // When
            JsonNode abortedJson = mapper.readTree(ChatflowSerializer.toJson(aborted));
            JsonNode reportJson =
                    mapper.readTree(
                            ChatflowSerializer.toJson(
                                    ValidationReport.of(List.of("No trigger node found"))));

            // Then
            assertThat(abortedJson.get("error").get("kind").asText())
                    .isEqualTo("EXECUTION_BUDGET_EXCEEDED");
            assertThat(abortedJson.get("error").get("last_node_id").asText()).isEqualTo("c1");
            assertThat(reportJson.get("valid").asBoolean()).isFalse();
            assertThat(reportJson.get("errors").get(0).asText()).isEqualTo("No trigger node found");
        }
    }
}
