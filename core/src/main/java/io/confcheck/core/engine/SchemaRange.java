package io.confcheck.core.engine;

import io.confcheck.core.error.RangeInvariantException;
import io.confcheck.core.model.ConfigPath;
import io.confcheck.core.model.Schema;
import io.confcheck.core.model.Section;
import io.confcheck.core.model.Setting;
import io.confcheck.core.range.Completion;
import io.confcheck.core.range.Range;
import io.confcheck.core.range.RangeError;
import io.confcheck.core.range.ScalarFolder;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A {@link Range} over whole configuration maps of one schema. Completion is normalization with
 * the map taken as given, so a {@code profiles} key is only accepted where the schema declares it.
 * The fold visits settings, then sections, in declaration order, feeding each slot the same raw
 * value normalization would see (inherited values included).
 */
public final class SchemaRange implements Range {

    private final Schema schema;

    SchemaRange(Schema schema) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
    }

    public Schema schema() {
        return schema;
    }

    @Override
    public String description() {
        return "schema " + schema.description();
    }

    @Override
    public Completion complete(ConfigPath path, Object raw) {
        return ConfigNormalizer.normalizeSection(schema, raw, Map.of(), path);
    }

    @Override
    public <A> A fold(ConfigPath path, ScalarFolder<A> folder, A init, Object value) {
        return fold(path, folder, init, value, Map.of());
    }

    @SuppressWarnings("unchecked")
    private <A> A fold(
            ConfigPath path, ScalarFolder<A> folder, A init, Object value, Map<String, Object> inheritedMap) {
        Completion completion = ConfigNormalizer.normalizeSection(schema, value, inheritedMap, path);
        if (completion instanceof RangeError error) {
            throw new RangeInvariantException(
                    "reduceScalarSettings",
                    "Cannot fold a configuration the schema rejects: " + error.message(),
                    error.path(),
                    error.value(),
                    error.rangeDescription());
        }
        Map<String, Object> completed = (Map<String, Object>) completion.completedValue();
        Map<?, ?> map = value == null ? Map.of() : (Map<?, ?>) value;

        Map<String, Object> inherited = new HashMap<>(inheritedMap);
        A acc = init;
        for (Setting setting : schema.settings()) {
            boolean present = map.containsKey(setting.key());
            Object raw = present ? map.get(setting.key()) : inherited.get(setting.key());
            acc = setting.range().fold(path.child(setting.key()), folder, acc, raw);
            if (present && setting.inherit()) {
                inherited.put(setting.key(), raw);
            }
        }

        // absent sections see every present inheritable section, as in normalization
        Map<String, Object> inheritedForAbsent = new HashMap<>(inherited);
        for (Section section : schema.sections()) {
            if (map.containsKey(section.key()) && section.inherit()) {
                inheritedForAbsent.put(section.key(), completed.get(section.key()));
            }
        }

        for (Section section : schema.sections()) {
            SchemaRange nested = new SchemaRange(section.schema());
            ConfigPath sectionPath = path.child(section.key());
            if (map.containsKey(section.key())) {
                acc = nested.fold(sectionPath, folder, acc, map.get(section.key()), inherited);
                if (section.inherit()) {
                    inherited.put(section.key(), completed.get(section.key()));
                }
            } else if (inheritedForAbsent.containsKey(section.key())) {
                acc = nested.fold(sectionPath, folder, acc, inheritedForAbsent.get(section.key()), inheritedForAbsent);
            } else {
                acc = nested.fold(sectionPath, folder, acc, Map.of(), inheritedForAbsent);
            }
        }
        return acc;
    }

    @Override
    public String toString() {
        return "SchemaRange[" + schema.description() + "]";
    }
}
