package io.confcheck.core.engine;

import io.confcheck.core.error.ConfigAccessException;
import io.confcheck.core.model.ConfigPath;
import io.confcheck.core.model.Schema;
import io.confcheck.core.model.Section;
import java.util.Map;
import java.util.Objects;

/**
 * A validated, fully defaulted configuration together with the schema it was validated against.
 *
 * <p>
 * Only created by {@link Configurations#make}. Immutable, thread-safe: the map is the unmodifiable
 * result of normalization and every declared setting and section is present in it.
 */
public final class Configuration {

    private final Schema schema;
    private final Map<String, Object> map;

    Configuration(Schema schema, Map<String, Object> map) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.map = Objects.requireNonNull(map, "map must not be null");
    }

    public Schema schema() {
        return schema;
    }

    /** The normalized map: settings, then sections, in declaration order. */
    public Map<String, Object> map() {
        return map;
    }

    /**
     * Looks up a setting.
     *
     * @param setting  the setting key
     * @param sections keys of the enclosing sections, outermost first
     * @return the completed value, possibly {@code null} for optional settings
     * @throws ConfigAccessException if a section or the setting is not declared
     */
    public Object access(String setting, String... sections) {
        Located located = walk("access", sections);
        if (!located.schema().hasSetting(setting)) {
            throw new ConfigAccessException(
                    "access",
                    "No setting '" + setting + "' at " + located.path(),
                    located.path().child(setting));
        }
        return located.map().get(setting);
    }

    /**
     * Typed variant of {@link #access(String, String...)}.
     *
     * @throws ClassCastException if the value is not a {@code type}
     */
    public <T> T access(Class<T> type, String setting, String... sections) {
        return type.cast(access(setting, sections));
    }

    /**
     * Looks up the completed map of a (possibly nested) section.
     *
     * @throws ConfigAccessException if a section on the path is not declared
     */
    public Map<String, Object> accessSection(String... sections) {
        return walk("accessSection", sections).map();
    }

    /**
     * The configuration of a nested section, validated against that section's schema.
     *
     * @throws ConfigAccessException if a section on the path is not declared
     */
    public Configuration subconfig(String... sections) {
        Located located = walk("subconfig", sections);
        return new Configuration(located.schema(), located.map());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Configuration other && schema == other.schema && map.equals(other.map);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(schema), map);
    }

    @Override
    public String toString() {
        return "Configuration[" + schema.description() + ", " + map + "]";
    }

    // --- Private helpers ---

    private record Located(Schema schema, Map<String, Object> map, ConfigPath path) {}

    @SuppressWarnings("unchecked")
    private Located walk(String who, String... sections) {
        Schema current = schema;
        Map<String, Object> currentMap = map;
        ConfigPath path = ConfigPath.root();
        for (String key : sections) {
            Section section = current.section(key);
            if (section == null || !(currentMap.get(key) instanceof Map)) {
                throw new ConfigAccessException(who, "No section '" + key + "' at " + path, path.child(key));
            }
            current = section.schema();
            currentMap = (Map<String, Object>) currentMap.get(key);
            path = path.child(key);
        }
        return new Located(current, currentMap, path);
    }
}
