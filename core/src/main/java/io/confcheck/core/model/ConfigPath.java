package io.confcheck.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Location inside a configuration: an ordered list of setting/section keys and sequence indices.
 * Used both for error reporting and as fold context.
 *
 * <p>
 * Immutable, thread-safe.
 *
 * @param segments keys (usually {@link String}) and non-negative {@link Integer} indices
 */
public record ConfigPath(List<Object> segments) {

    private static final ConfigPath ROOT = new ConfigPath(List.of());

    /** Canonical constructor; copies the segments into an unmodifiable list. */
    public ConfigPath {
        Objects.requireNonNull(segments, "segments must not be null");
        segments = Collections.unmodifiableList(new ArrayList<>(segments));
    }

    /** The empty path. */
    public static ConfigPath root() {
        return ROOT;
    }

    /** A path made of the given segments, outermost first. */
    public static ConfigPath of(Object... segments) {
        return new ConfigPath(List.of(segments));
    }

    /** Returns a new path with {@code segment} appended. */
    public ConfigPath child(Object segment) {
        List<Object> extended = new ArrayList<>(segments.size() + 1);
        extended.addAll(segments);
        extended.add(segment);
        return new ConfigPath(extended);
    }

    /** Returns a new path with an index segment appended. */
    public ConfigPath index(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative, got: " + index);
        }
        return child(index);
    }

    /** Returns the last segment, or {@code null} for the root path. */
    public Object last() {
        return segments.isEmpty() ? null : segments.get(segments.size() - 1);
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public int depth() {
        return segments.size();
    }

    @Override
    public String toString() {
        return segments.toString();
    }
}
