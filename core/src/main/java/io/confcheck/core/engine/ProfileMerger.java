package io.confcheck.core.engine;

import io.confcheck.core.error.ConfigMergeException;
import io.confcheck.core.error.ProfileResolveException;
import io.confcheck.core.model.ConfigPath;
import io.confcheck.core.model.Schema;
import io.confcheck.core.model.Section;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composes raw configuration maps before validation: schema-guided deep merge of two maps and
 * overlay of named profiles.
 *
 * <p>
 * Raw maps may carry a reserved top-level key {@value #PROFILES_KEY} mapping profile names to raw
 * maps of the same shape. Profile definitions are not validated here; they are merged onto the base
 * map and validated together with it by {@link ConfigNormalizer}.
 *
 * <p>
 * Keys that name neither a setting nor a section are a programming error against the schema, not
 * bad data, and throw {@link ConfigMergeException}.
 *
 * <p>
 * Thread-safe: stateless utility class. Inputs are never modified.
 */
public final class ProfileMerger {

    /** Reserved top-level key holding profile definitions. */
    public static final String PROFILES_KEY = "profiles";

    private static final Logger LOG = LoggerFactory.getLogger(ProfileMerger.class);

    private ProfileMerger() {}

    /**
     * Deep-merges {@code c2} onto {@code c1}, guided by {@code schema}. For settings, {@code c2}
     * wins whenever it contains the key, even with a {@code null} value. Sections are merged
     * recursively, with a missing or {@code null} side treated as an empty map.
     *
     * @param schema schema of both maps
     * @param path   location of the maps, for error reports
     * @param c1     base raw map
     * @param c2     overriding raw map
     * @return a new unmodifiable map
     * @throws ConfigMergeException if an input is not a map or a key is not declared in the schema
     */
    public static Map<String, Object> mergeSansProfiles(Schema schema, ConfigPath path, Object c1, Object c2) {
        Objects.requireNonNull(schema, "schema must not be null");
        Map<?, ?> left = requireMap("mergeSansProfiles", path, c1);
        Map<?, ?> right = requireMap("mergeSansProfiles", path, c2);

        Set<Object> keys = new LinkedHashSet<>(left.keySet());
        keys.addAll(right.keySet());

        Map<String, Object> merged = new LinkedHashMap<>();
        for (Object key : keys) {
            if (schema.hasSetting(key)) {
                merged.put((String) key, right.containsKey(key) ? right.get(key) : left.get(key));
            } else if (schema.hasSection(key)) {
                Section section = schema.section((String) key);
                merged.put(
                        section.key(),
                        mergeSansProfiles(section.schema(), path.child(key), left.get(key), right.get(key)));
            } else {
                throw new ConfigMergeException(
                        "mergeSansProfiles",
                        "Key '" + key + "' at " + path + " is neither a setting nor a section of schema '"
                                + schema.description() + "'",
                        path.child(key),
                        schema.keys());
            }
        }
        return Collections.unmodifiableMap(merged);
    }

    /**
     * Merges two or more raw top-level maps left to right, later maps taking precedence. The
     * {@value #PROFILES_KEY} maps are merged by plain key overwrite; everything else goes through
     * {@link #mergeSansProfiles}.
     *
     * @throws ConfigMergeException if an input is not a map or a key is not declared in the schema
     */
    public static Map<String, Object> mergeConfigMaps(Schema schema, Object c1, Object c2, Object... more) {
        Map<String, Object> merged = mergeTwo(schema, c1, c2);
        for (Object next : more) {
            merged = mergeTwo(schema, merged, next);
        }
        return merged;
    }

    /**
     * Strips the {@value #PROFILES_KEY} key from {@code configMap} and overlays the named profiles
     * onto what remains, left to right: later profiles override earlier ones and the base. A map
     * without the {@value #PROFILES_KEY} key is returned as is, whatever names are requested.
     *
     * @param schema       schema of the map
     * @param configMap    raw top-level map
     * @param profileNames profiles to apply, in order
     * @return a new unmodifiable map without the {@value #PROFILES_KEY} key
     * @throws ProfileResolveException if the map defines profiles but not a requested one
     * @throws ConfigMergeException    if a profile is not a map or uses keys the schema does not declare
     */
    public static Map<String, Object> applyProfiles(Schema schema, Object configMap, List<String> profileNames) {
        Map<?, ?> map = requireMap("applyProfiles", ConfigPath.root(), configMap);
        List<String> names = profileNames == null ? List.of() : profileNames;
        if (!map.containsKey(PROFILES_KEY)) {
            return copyOf(map);
        }

        Map<?, ?> profiles = requireMap("applyProfiles", ConfigPath.of(PROFILES_KEY), map.get(PROFILES_KEY));
        Map<String, Object> base = new LinkedHashMap<>(copyOf(map));
        base.remove(PROFILES_KEY);

        Map<String, Object> result = Collections.unmodifiableMap(base);
        for (String name : names) {
            if (!profiles.containsKey(name)) {
                throw new ProfileResolveException("applyProfiles", name, profiles.keySet());
            }
            LOG.debug("Applying profile '{}'", name);
            result = mergeSansProfiles(schema, ConfigPath.of(PROFILES_KEY, name), result, profiles.get(name));
        }
        return result;
    }

    // --- Private helpers ---

    private static Map<String, Object> mergeTwo(Schema schema, Object c1, Object c2) {
        Map<?, ?> left = requireMap("mergeConfigMaps", ConfigPath.root(), c1);
        Map<?, ?> right = requireMap("mergeConfigMaps", ConfigPath.root(), c2);

        Map<Object, Object> leftBase = new LinkedHashMap<>(left);
        Map<Object, Object> rightBase = new LinkedHashMap<>(right);
        Object leftProfiles = leftBase.remove(PROFILES_KEY);
        Object rightProfiles = rightBase.remove(PROFILES_KEY);

        Map<String, Object> merged =
                new LinkedHashMap<>(mergeSansProfiles(schema, ConfigPath.root(), leftBase, rightBase));
        if (left.containsKey(PROFILES_KEY) || right.containsKey(PROFILES_KEY)) {
            Map<Object, Object> profiles =
                    new LinkedHashMap<>(requireMap("mergeConfigMaps", ConfigPath.of(PROFILES_KEY), leftProfiles));
            profiles.putAll(requireMap("mergeConfigMaps", ConfigPath.of(PROFILES_KEY), rightProfiles));
            merged.put(PROFILES_KEY, Collections.unmodifiableMap(profiles));
        }
        return Collections.unmodifiableMap(merged);
    }

    /** {@code null} counts as the empty map; any other non-map is fatal. */
    private static Map<?, ?> requireMap(String who, ConfigPath path, Object value) {
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> map) {
            return map;
        }
        throw new ConfigMergeException(who, "Expected a map at " + path + " but got: " + value, path, value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> copyOf(Map<?, ?> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>((Map<String, Object>) map));
    }
}
