package io.chatflow.core.execution.executor;

import io.chatflow.core.credential.CredentialResolutionException;
import io.chatflow.core.credential.CredentialResolver;
import io.chatflow.core.graph.Node;
import io.chatflow.core.graph.NodeKind;
import io.chatflow.core.http.HttpMethod;
import io.chatflow.core.http.HttpTransport;
import io.chatflow.core.http.HttpTransportException;
import io.chatflow.core.http.OutboundRequest;
import io.chatflow.core.http.OutboundResponse;
import io.chatflow.core.json.JsonCodec;
import io.chatflow.core.json.JsonFormatException;
import io.chatflow.core.template.TemplateResolver;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Issues an outbound HTTP call and outputs the parsed response body.
///
/// ### Configuration
/// - `method`: GET (default), POST, PUT, PATCH or DELETE
/// - `url`: template, required
/// - `headers`: map of header templates
/// - `body`: map (or string) of templates; sent as JSON for POST, PUT and PATCH only
/// - `credential_id`: credential resolved into auth headers
/// - `timeout`: seconds, default from the turn context
///
/// ### Credentials
/// - `api_key` sets `Authorization: Bearer <key>`
/// - `username` and `password` set Basic authorization
/// - `header_name` and `header_value` set a custom header
///
/// A non-2xx status is a failure. A successful body is parsed as JSON through
/// the {@link JsonCodec}; unparseable bodies are returned as text.
public class HttpRequestNodeExecutor implements NodeExecutor {

    private static final int ERROR_BODY_LIMIT = 200;

    private final HttpTransport transport;
    private final CredentialResolver credentialResolver;
    private final JsonCodec jsonCodec;
    private final TemplateResolver templateResolver;

    public HttpRequestNodeExecutor(
            HttpTransport transport,
            CredentialResolver credentialResolver,
            JsonCodec jsonCodec,
            TemplateResolver templateResolver) {
        this.transport = transport;
        this.credentialResolver = credentialResolver;
        this.jsonCodec = jsonCodec;
        this.templateResolver = templateResolver;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.HTTP_REQUEST;
    }

    @Override
    public NodeResult execute(Node node, ExecutionContext context) {
        Map<String, Object> config = node.config();

        OutboundRequest request;
        try {
            request = buildRequest(config, context);
        } catch (IllegalArgumentException e) {
            return NodeResult.failure("Invalid HTTP configuration: " + e.getMessage(), e);
        } catch (CredentialResolutionException e) {
            return NodeResult.failure("Credential resolution failed: " + e.getMessage(), e);
        }

        long started = System.nanoTime();
        OutboundResponse response;
        try {
            response = transport.send(request);
        } catch (HttpTransportException e) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("url", request.url());
            metadata.put("error_type", e.isTimedOut() ? "TIMEOUT" : "NETWORK");
            return NodeResult.failure(e.getMessage(), e, metadata);
        } catch (RuntimeException e) {
            return NodeResult.failure("HTTP transport failed: " + e, e, Map.of("url", request.url()));
        }
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("status_code", response.status());
        metadata.put("response_time_ms", elapsedMs);
        metadata.put("url", request.url());

        if (!response.isSuccess()) {
            return NodeResult.failure(
                    "HTTP "
                            + response.status()
                            + ": "
                            + ConfigValues.truncate(response.body(), ERROR_BODY_LIMIT),
                    null,
                    metadata);
        }
        return NodeResult.success(parseBody(response.body()), metadata);
    }

    @Override
    public List<String> validateConfig(Map<String, Object> config) {
        List<String> problems = new ArrayList<>();
        if (!ConfigValues.hasText(config, "url")) {
            problems.add("HTTP request node requires a 'url'");
        }
        String method = ConfigValues.string(config, "method", "GET");
        if (HttpMethod.parse(method).isEmpty()) {
            problems.add("Unsupported HTTP method: " + method);
        }
        return problems;
    }

    private OutboundRequest buildRequest(Map<String, Object> config, ExecutionContext context)
            throws CredentialResolutionException {
        String methodName = ConfigValues.string(config, "method", "GET");
        HttpMethod method =
                HttpMethod.parse(methodName)
                        .orElseThrow(
                                () -> new IllegalArgumentException("unsupported method " + methodName));
        if (!ConfigValues.hasText(config, "url")) {
            throw new IllegalArgumentException("'url' is required");
        }

        Map<String, Object> values = context.templateVariables();
        String url = templateResolver.resolve(config.get("url").toString(), values);

        Map<String, String> headers = new LinkedHashMap<>();
        Object resolvedHeaders = templateResolver.resolveAll(ConfigValues.map(config, "headers"), values);
        ((Map<?, ?>) resolvedHeaders)
                .forEach((key, value) -> headers.put(String.valueOf(key), String.valueOf(value)));

        Object credentialId = config.get("credential_id");
        if (credentialId != null && !credentialId.toString().isBlank()) {
            applyCredential(credentialResolver.resolve(credentialId.toString()), headers);
        }

        String body = null;
        Object rawBody = config.get("body");
        if (method.carriesBody() && rawBody != null) {
            Object resolved = templateResolver.resolveAll(rawBody, values);
            body = resolved instanceof String text ? text : jsonCodec.write(resolved);
        }

        return new OutboundRequest(
                method, url, headers, body, ConfigValues.timeout(config, context.getDefaultTimeout()));
    }

    private static void applyCredential(Map<String, String> material, Map<String, String> headers) {
        if (material.containsKey("api_key")) {
            headers.put("Authorization", "Bearer " + material.get("api_key"));
        } else if (material.containsKey("username") && material.containsKey("password")) {
            String pair = material.get("username") + ":" + material.get("password");
            headers.put(
                    "Authorization",
                    "Basic " + Base64.getEncoder().encodeToString(pair.getBytes(StandardCharsets.UTF_8)));
        }
        if (material.containsKey("header_name") && material.containsKey("header_value")) {
            headers.put(material.get("header_name"), material.get("header_value"));
        }
    }

    private Object parseBody(String body) {
        if (body.isBlank()) {
            return "";
        }
        try {
            return jsonCodec.parse(body);
        } catch (JsonFormatException e) {
            return body;
        }
    }
}
