package io.confcheck.core.model;

import java.util.Objects;

/**
 * One setting whose value differs between two configurations.
 *
 * @param path  the setting's path, qualified by its enclosing section keys
 * @param left  value in the first configuration
 * @param right value in the second configuration
 */
public record SettingDiff(ConfigPath path, Object left, Object right) {

    public SettingDiff {
        Objects.requireNonNull(path, "path must not be null");
    }
}
