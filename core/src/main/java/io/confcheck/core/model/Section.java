package io.confcheck.core.model;

import java.util.Objects;

/**
 * An internal node of a {@link Schema}: a nested map of settings and sections under one key.
 *
 * @param key     the configuration key
 * @param schema  schema of the nested map
 * @param inherit if {@code true}, the completed section becomes the default for same-named sections
 *                further down
 */
public record Section(String key, Schema schema, boolean inherit) implements SchemaEntry {

    public Section {
        Objects.requireNonNull(key, "section key must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
    }

    public static Section of(String key, Schema schema) {
        return new Section(key, schema, false);
    }

    public static Section inherited(String key, Schema schema) {
        return new Section(key, schema, true);
    }
}
