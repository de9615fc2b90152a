package io.safefetch.json.jackson;

import io.safefetch.json.spi.JsonCodec;
import io.safefetch.json.spi.JsonCodecProvider;
import io.safefetch.json.spi.JsonException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    private final JacksonJsonCodec codec = new JacksonJsonCodec();

    @Test
    void writesMapsAndListsAsJson() throws Exception {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("a", 1);
        value.put("tags", List.of("x", "y"));

        assertThat(codec.writeString(value)).isEqualTo("{\"a\":1,\"tags\":[\"x\",\"y\"]}");
        assertThat(new String(codec.writeBytes(List.of(1, 2)), StandardCharsets.UTF_8)).isEqualTo("[1,2]");
    }

    @Test
    void readsIntoTypedRecords() throws Exception {
        User user = codec.readValue("{\"name\":\"ada\",\"age\":36}", User.class);
        assertThat(user).isEqualTo(new User("ada", 36));

        User fromBytes = codec.readValue("{\"name\":\"bob\",\"age\":1}".getBytes(StandardCharsets.UTF_8), User.class);
        assertThat(fromBytes.name()).isEqualTo("bob");
    }

    @Test
    void invalidJsonIsReportedAsJsonException() {
        assertThatThrownBy(() -> codec.readValue("plain text", Map.class))
                .isInstanceOf(JsonException.class)
                .hasMessageContaining("java.util.Map");
    }

    @Test
    void providerIsDiscoveredThroughServiceLoader() {
        JsonCodec discovered = JsonCodecProvider.discover().orElseThrow();
        assertThat(discovered).isInstanceOf(JacksonJsonCodec.class);
    }

    record User(String name, int age) {}
}
