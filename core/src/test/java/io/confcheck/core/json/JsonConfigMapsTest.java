package io.confcheck.core.json;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.confcheck.core.engine.Configuration;
import io.confcheck.core.engine.Configurations;
import io.confcheck.core.testkit.TestSchemas;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link JsonConfigMaps}. */
@DisplayName("JsonConfigMaps")
class JsonConfigMapsTest {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON = new ObjectMapper();

    private static JsonNode fixture(String name) throws IOException {
        try (InputStream in = JsonConfigMapsTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return YAML.readTree(in);
        }
    }

    @Test
    @DisplayName("a YAML document becomes a raw map the engine accepts")
    void yamlFixture() throws IOException {
        Object raw = JsonConfigMaps.fromJsonNode(fixture("service.yaml"));

        assertThat(Configurations.make(TestSchemas.DEMO, List.of(), raw).map())
                .isEqualTo(Map.of("port", 9090, "db", Map.of("host", "db.internal")));
        assertThat(Configurations.make(TestSchemas.DEMO, List.of("local", "debug"), raw).map())
                .isEqualTo(Map.of("port", 5005, "db", Map.of("host", "localhost")));
    }

    @Test
    @DisplayName("scalars, arrays and nulls map to plain Java values")
    void plainValues() throws IOException {
        JsonNode node = JSON.readTree("""
                {"b": true, "s": "x", "n": 3, "big": 10000000000, "a": [1, "two"], "z": null}
                """);

        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) JsonConfigMaps.fromJsonNode(node);

        assertThat(map.keySet()).containsExactly("b", "s", "n", "big", "a", "z");
        assertThat(map).containsEntry("b", true).containsEntry("s", "x").containsEntry("n", 3);
        assertThat(map).containsEntry("big", 10000000000L).containsEntry("z", null);
        assertThat(map.get("a")).isEqualTo(Arrays.asList(1, "two"));
        assertThat(JsonConfigMaps.fromJsonNode(null)).isNull();
    }

    @Test
    @DisplayName("a configuration renders back as a JSON tree")
    void toJsonNode() throws IOException {
        Configuration config = Configurations.make(TestSchemas.DEMO, List.of(), Map.of("port", 9090));

        JsonNode node = JsonConfigMaps.toJsonNode(config);

        assertThat(node).isEqualTo(JSON.readTree("{\"port\":9090,\"db\":{\"host\":\"\"}}"));
    }
}
