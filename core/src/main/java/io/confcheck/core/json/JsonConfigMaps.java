package io.confcheck.core.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.confcheck.core.engine.Configuration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bridges Jackson trees and raw configuration data. Reading text (JSON, YAML, ...) is up to the
 * caller; anything Jackson parses into a {@link JsonNode} can be handed to
 * {@link #fromJsonNode(JsonNode)}.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class JsonConfigMaps {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonConfigMaps() {}

    /**
     * Converts a Jackson tree into raw configuration data.
     *
     * <ul>
     * <li>objects → unmodifiable insertion-ordered {@code Map<String, Object>}</li>
     * <li>arrays → unmodifiable {@code List<Object>}</li>
     * <li>integral numbers → {@code Integer}, {@code Long} or {@code BigInteger}, whichever Jackson
     * parsed</li>
     * <li>floating-point numbers → {@code Double} or {@code BigDecimal}</li>
     * <li>text → {@code String}, booleans → {@code Boolean}</li>
     * <li>{@code null}, {@code NullNode}, {@code MissingNode} → {@code null}</li>
     * </ul>
     *
     * @param node the parsed tree, may be {@code null}
     * @return raw data suitable for {@code Configurations.make}
     */
    public static Object fromJsonNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (Map.Entry<String, JsonNode> field : node.properties()) {
                map.put(field.getKey(), fromJsonNode(field.getValue()));
            }
            return Collections.unmodifiableMap(map);
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                list.add(fromJsonNode(element));
            }
            return Collections.unmodifiableList(list);
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBinary() || node.isPojo()) {
            return MAPPER.convertValue(node, Object.class);
        }
        return node.asText();
    }

    /**
     * Renders a configuration as a Jackson tree, e.g. for printing the effective configuration.
     * Sets become arrays and enum constants become their names.
     */
    public static JsonNode toJsonNode(Configuration configuration) {
        return MAPPER.valueToTree(configuration.map());
    }
}
