package io.chatflow.core.execution.executor;

import io.chatflow.core.graph.Node;
import io.chatflow.core.graph.NodeKind;
import io.chatflow.core.json.JsonCodec;
import io.chatflow.core.template.TemplateResolver;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Renders the turn's final answer. Reaching a response node ends the turn.
///
/// ### Configuration
/// - `message`: template, default `{{input}}`
/// - `format`: `text` (default), `markdown` or `json`; `json` wraps the message
///   as `{"response": ..., "timestamp": ...}`
public class ResponseNodeExecutor implements NodeExecutor {

    private static final Set<String> FORMATS = Set.of("text", "markdown", "json");

    private final TemplateResolver templateResolver;
    private final JsonCodec jsonCodec;
    private final Clock clock;

    public ResponseNodeExecutor(TemplateResolver templateResolver, JsonCodec jsonCodec) {
        this(templateResolver, jsonCodec, Clock.systemUTC());
    }

    public ResponseNodeExecutor(TemplateResolver templateResolver, JsonCodec jsonCodec, Clock clock) {
        this.templateResolver = templateResolver;
        this.jsonCodec = jsonCodec;
        this.clock = clock;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.RESPONSE;
    }

    @Override
    public NodeResult execute(Node node, ExecutionContext context) {
        Map<String, Object> config = node.config();
        String format = ConfigValues.string(config, "format", "text").toLowerCase(Locale.ROOT);
        if (!FORMATS.contains(format)) {
            return NodeResult.failure("Unsupported response format: " + format);
        }

        String message =
                templateResolver.resolve(
                        ConfigValues.string(config, "message", "{{input}}"),
                        context.templateVariables());

        Object output = message;
        if ("json".equals(format)) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("response", message);
            payload.put("timestamp", Instant.now(clock).toString());
            output = jsonCodec.write(payload);
        }
        return NodeResult.success(output, Map.of("format", format));
    }

    @Override
    public List<String> validateConfig(Map<String, Object> config) {
        List<String> problems = new ArrayList<>();
        if (!ConfigValues.hasText(config, "message")) {
            problems.add("Response node requires a 'message'");
        }
        String format = ConfigValues.string(config, "format", "text").toLowerCase(Locale.ROOT);
        if (!FORMATS.contains(format)) {
            problems.add("Unsupported response format: " + format);
        }
        return problems;
    }
}
