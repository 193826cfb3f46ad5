package io.chatflow.core.inference;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Inference client that answers without calling any provider.
///
/// Responses registered for a model take precedence; otherwise the reply echoes
/// the start of the prompt. Token usage is estimated from whitespace-separated words.
///
/// ### Usage
/// {@snippet :
/// var client = new StubInferenceClient()
///     .respondTo("support-model", "How can I help?");
/// }
///
/// @implNote Thread-safe.
public class StubInferenceClient implements InferenceClient {

    private static final Logger logger = Logger.getLogger(StubInferenceClient.class.getName());
    private static final int ECHO_LIMIT = 200;

    private final Map<String, String> responsesByModel = new ConcurrentHashMap<>();

    /// Registers a fixed response for a model.
    ///
    /// @param model the model identifier, not null
    /// @param response the text to return, not null
    /// @return this client for chaining
    public StubInferenceClient respondTo(String model, String response) {
        responsesByModel.put(model, response);
        return this;
    }

    @Override
    public InferenceResponse generate(InferenceRequest request) {
        logger.info(
                "[STUB] Model '"
                        + request.model()
                        + "' received prompt ("
                        + request.prompt().length()
                        + " chars)");

        String text = responsesByModel.get(request.model());
        if (text == null) {
            String prompt = request.prompt();
            text =
                    "[STUB RESPONSE] "
                            + (prompt.length() > ECHO_LIMIT
                                    ? prompt.substring(0, ECHO_LIMIT) + "..."
                                    : prompt);
        }

        TokenUsage usage = TokenUsage.of(countWords(request.prompt()), countWords(text));
        return new InferenceResponse(text, usage, request.model(), Map.of("stub", true));
    }

    private static int countWords(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
