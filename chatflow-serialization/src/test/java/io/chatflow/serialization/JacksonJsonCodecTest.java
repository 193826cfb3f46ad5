package io.chatflow.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.chatflow.core.json.JsonFormatException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JacksonJsonCodecTest {

    private final JacksonJsonCodec codec = new JacksonJsonCodec();

    @Test
    void shouldParseIntoPlainMapsAndLists() throws Exception {
        // When
        Object parsed = codec.parse("{\"current\": {\"temp\": 21.5, \"tags\": [\"sunny\"]}}");

        // Then
        assertThat(parsed)
                .isEqualTo(Map.of("current", Map.of("temp", 21.5, "tags", List.of("sunny"))));
    }

    @Test
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> codec.parse("not json"))
                .isInstanceOf(JsonFormatException.class)
                .hasMessageStartingWith("Failed to parse JSON");
    }

    @Test
    void shouldWriteCompactJson() {
        // Given
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("response", "Hi \"there\"");
        payload.put("count", 2);

        // When / Then
        assertThat(codec.write(payload)).isEqualTo("{\"response\":\"Hi \\\"there\\\"\",\"count\":2}");
    }
}
