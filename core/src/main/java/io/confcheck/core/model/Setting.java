package io.confcheck.core.model;

import io.confcheck.core.range.Range;
import java.util.Objects;

/**
 * A leaf of a {@link Schema}: one configuration key governed by a {@link Range}.
 *
 * <p>
 * Immutable, thread-safe.
 *
 * @param key         the configuration key
 * @param description human-readable description
 * @param range       admissible values and default
 * @param inherit     if {@code true}, a value given for this setting becomes the default for
 *                    same-named settings in nested sections
 */
public record Setting(String key, String description, Range range, boolean inherit) implements SchemaEntry {

    /** Canonical constructor; validates required fields. */
    public Setting {
        Objects.requireNonNull(key, "setting key must not be null");
        Objects.requireNonNull(range, "range must not be null");
    }

    /** A non-inheriting setting. */
    public static Setting of(String key, String description, Range range) {
        return new Setting(key, description, range, false);
    }

    /** A setting whose value is inherited by nested sections. */
    public static Setting inherited(String key, String description, Range range) {
        return new Setting(key, description, range, true);
    }
}
