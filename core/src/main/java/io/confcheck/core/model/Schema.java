package io.confcheck.core.model;

import io.confcheck.core.error.SchemaDefinitionException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A named tree of {@link Setting}s and {@link Section}s. Sections carry schemas of their own, so
 * schemas nest to any depth.
 *
 * <p>
 * Keys are unique across the settings and sections of one schema; declaring a key twice is rejected
 * at construction time. Declaration order is kept and determines the order of normalized maps,
 * diffs and folds.
 *
 * <p>
 * Immutable and thread-safe. Built once and shared across validations.
 */
public final class Schema {

    private final String description;
    private final List<Setting> settings;
    private final Map<String, Setting> settingsByKey;
    private final List<Section> sections;
    private final Map<String, Section> sectionsByKey;

    private Schema(String description, List<Setting> settings, List<Section> sections) {
        this.description = description;
        this.settings = Collections.unmodifiableList(settings);
        this.sections = Collections.unmodifiableList(sections);

        Map<String, Setting> settingIndex = new LinkedHashMap<>();
        settings.forEach(s -> settingIndex.put(s.key(), s));
        this.settingsByKey = Collections.unmodifiableMap(settingIndex);

        Map<String, Section> sectionIndex = new LinkedHashMap<>();
        sections.forEach(s -> sectionIndex.put(s.key(), s));
        this.sectionsByKey = Collections.unmodifiableMap(sectionIndex);
    }

    /**
     * Creates a schema from settings and sections, partitioned by type.
     *
     * @param description human-readable description
     * @param entries     settings and sections in declaration order
     * @return the schema
     * @throws SchemaDefinitionException if two entries share a key
     */
    public static Schema of(String description, SchemaEntry... entries) {
        return of(description, List.of(entries));
    }

    /** List variant of {@link #of(String, SchemaEntry...)}. */
    public static Schema of(String description, List<? extends SchemaEntry> entries) {
        Objects.requireNonNull(entries, "entries must not be null");
        List<Setting> settings = new ArrayList<>();
        List<Section> sections = new ArrayList<>();
        Map<String, SchemaEntry> seen = new LinkedHashMap<>();
        for (SchemaEntry entry : entries) {
            SchemaEntry previous = seen.putIfAbsent(entry.key(), entry);
            if (previous != null) {
                throw new SchemaDefinitionException(
                        "schema",
                        "Duplicate key '" + entry.key() + "' in schema '" + description + "'",
                        previous,
                        entry);
            }
            if (entry instanceof Setting setting) {
                settings.add(setting);
            } else if (entry instanceof Section section) {
                sections.add(section);
            }
        }
        return new Schema(description, settings, sections);
    }

    public String description() {
        return description;
    }

    /** Settings in declaration order. */
    public List<Setting> settings() {
        return settings;
    }

    /** Sections in declaration order. */
    public List<Section> sections() {
        return sections;
    }

    /** The setting declared under {@code key}, or {@code null}. */
    public Setting setting(String key) {
        return settingsByKey.get(key);
    }

    /** The section declared under {@code key}, or {@code null}. */
    public Section section(String key) {
        return sectionsByKey.get(key);
    }

    public boolean hasSetting(Object key) {
        return settingsByKey.containsKey(key);
    }

    public boolean hasSection(Object key) {
        return sectionsByKey.containsKey(key);
    }

    /** All setting keys, then all section keys, in declaration order. */
    public Set<String> keys() {
        Set<String> keys = new LinkedHashSet<>(settingsByKey.keySet());
        keys.addAll(sectionsByKey.keySet());
        return Collections.unmodifiableSet(keys);
    }

    @Override
    public String toString() {
        return "Schema[" + description + ", keys=" + keys() + "]";
    }
}
