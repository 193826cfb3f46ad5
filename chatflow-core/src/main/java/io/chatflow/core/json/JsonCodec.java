package io.chatflow.core.json;

/// Reads and writes JSON for node executors without tying core to a JSON library.
///
/// The HTTP node parses response bodies and encodes request bodies through this
/// interface; the response node uses it for `json` formatted replies. The
/// Jackson implementation lives in `chatflow-serialization` as `JacksonJsonCodec`.
///
/// @see BasicJsonCodec for the dependency-free default
public interface JsonCodec {

    /// Parses JSON text into maps, lists and scalar values.
    ///
    /// @param json the JSON text, not null
    /// @return the parsed value, may be null for the JSON literal `null`
    /// @throws JsonFormatException if the text is not valid JSON or parsing is unsupported
    Object parse(String json) throws JsonFormatException;

    /// Serializes maps, lists, strings, numbers, booleans and null to JSON text.
    ///
    /// @param value the value to write, may be null
    /// @return JSON text, never null
    String write(Object value);
}
