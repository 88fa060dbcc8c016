package io.confcheck.core.engine;

import io.confcheck.core.model.ConfigPath;
import io.confcheck.core.model.Schema;
import io.confcheck.core.model.Section;
import io.confcheck.core.model.Setting;
import io.confcheck.core.range.Completion;
import io.confcheck.core.range.RangeError;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates a raw configuration map against a {@link Schema} and completes it: every declared
 * setting and section ends up present, filled from the input, from an inherited outer value, or
 * from its range's default.
 *
 * <p>
 * Order of work at each level:
 * <ol>
 * <li>apply the requested profiles (entry map only; nested section maps are taken as given)</li>
 * <li>complete the settings present in the map; inheritable ones record their raw value</li>
 * <li>reject keys the schema does not declare</li>
 * <li>fill absent settings from inherited raw values, else from their defaults</li>
 * <li>recurse into the sections present; inheritable ones record their completed map</li>
 * <li>fill absent sections from inherited maps, else by normalizing an empty map</li>
 * </ol>
 * The first {@link RangeError} stops the whole pass and is returned unchanged.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class ConfigNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigNormalizer.class);

    private ConfigNormalizer() {}

    /**
     * Normalizes a top-level raw configuration map.
     *
     * @param schema       the schema to validate against
     * @param profileNames profiles to overlay before validation, in order
     * @param configMap    the raw map; {@code null} counts as empty
     * @return the completed, unmodifiable map, or the first range error
     */
    public static Completion normalizeAndCheck(Schema schema, List<String> profileNames, Object configMap) {
        return normalizeAndCheck(schema, profileNames, configMap, Map.of(), ConfigPath.root());
    }

    /**
     * Normalizes a raw configuration map found at {@code path}, with values inherited from the
     * enclosing levels.
     *
     * @param inheritedMap raw setting values and completed section maps marked inheritable at outer
     *                     levels, keyed by setting/section key. Not modified.
     */
    public static Completion normalizeAndCheck(
            Schema schema,
            List<String> profileNames,
            Object configMap,
            Map<String, Object> inheritedMap,
            ConfigPath path) {
        if (configMap != null && !(configMap instanceof Map)) {
            return new RangeError(null, path, configMap);
        }
        return normalizeSection(
                schema, ProfileMerger.applyProfiles(schema, configMap, profileNames), inheritedMap, path);
    }

    /**
     * Normalizes one level without touching profiles. The {@code profiles} key is reserved only in
     * the map handed to {@link #normalizeAndCheck}; in section maps it is validated like any other key.
     */
    static Completion normalizeSection(
            Schema schema, Object configMap, Map<String, Object> inheritedMap, ConfigPath path) {
        if (configMap != null && !(configMap instanceof Map)) {
            return new RangeError(null, path, configMap);
        }
        Map<?, ?> map = configMap == null ? Map.of() : (Map<?, ?>) configMap;
        Map<String, Object> inherited = new HashMap<>(inheritedMap);

        Map<String, Object> settings = new HashMap<>();
        for (Setting setting : schema.settings()) {
            if (!map.containsKey(setting.key())) {
                continue;
            }
            Object raw = map.get(setting.key());
            Completion completion = setting.range().complete(path.child(setting.key()), raw);
            if (completion instanceof RangeError error) {
                LOG.debug("Setting '{}' rejected: {}", setting.key(), error.message());
                return error;
            }
            settings.put(setting.key(), completion.completedValue());
            if (setting.inherit()) {
                inherited.put(setting.key(), raw);
            }
        }

        for (Map.Entry<?, ?> entry : map.entrySet()) {
            Object key = entry.getKey();
            if (!schema.hasSetting(key) && !schema.hasSection(key)) {
                LOG.debug("Unknown key '{}' at {}", key, path);
                return new RangeError(null, path.child(key), entry.getValue());
            }
        }

        for (Setting setting : schema.settings()) {
            if (map.containsKey(setting.key())) {
                continue;
            }
            Object raw = inherited.get(setting.key());
            Completion completion = setting.range().complete(path.child(setting.key()), raw);
            if (completion instanceof RangeError error) {
                return error;
            }
            settings.put(setting.key(), completion.completedValue());
        }

        Map<String, Object> sections = new HashMap<>();
        for (Section section : schema.sections()) {
            if (!map.containsKey(section.key())) {
                continue;
            }
            LOG.debug("Normalizing section '{}' at {}", section.key(), path);
            Completion completion =
                    normalizeSection(section.schema(), map.get(section.key()), inherited, path.child(section.key()));
            if (completion instanceof RangeError error) {
                return error;
            }
            sections.put(section.key(), completion.completedValue());
            if (section.inherit()) {
                inherited.put(section.key(), completion.completedValue());
            }
        }

        for (Section section : schema.sections()) {
            if (map.containsKey(section.key())) {
                continue;
            }
            if (inherited.containsKey(section.key())) {
                sections.put(section.key(), inherited.get(section.key()));
                continue;
            }
            Completion completion =
                    normalizeSection(section.schema(), Map.of(), inherited, path.child(section.key()));
            if (completion instanceof RangeError error) {
                return error;
            }
            sections.put(section.key(), completion.completedValue());
        }

        Map<String, Object> result = new LinkedHashMap<>();
        schema.settings().forEach(s -> result.put(s.key(), settings.get(s.key())));
        schema.sections().forEach(s -> result.put(s.key(), sections.get(s.key())));
        return Completion.completed(Collections.unmodifiableMap(result));
    }

    /** The range of whole configuration maps of {@code schema}. */
    public static SchemaRange schemaRange(Schema schema) {
        return new SchemaRange(schema);
    }
}
