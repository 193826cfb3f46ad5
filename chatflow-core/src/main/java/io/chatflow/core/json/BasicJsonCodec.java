package io.chatflow.core.json;

import io.chatflow.core.util.JsonUtil;

/// Dependency-free codec: writes JSON, but does not parse it.
///
/// With this codec HTTP responses are always kept as raw text. Register the
/// Jackson codec from `chatflow-serialization` to get structured bodies.
public class BasicJsonCodec implements JsonCodec {

    @Override
    public Object parse(String json) throws JsonFormatException {
        throw new JsonFormatException("JSON parsing is not available without a JSON library");
    }

    @Override
    public String write(Object value) {
        return JsonUtil.toJson(value);
    }
}
