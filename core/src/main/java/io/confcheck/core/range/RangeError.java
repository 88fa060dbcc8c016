package io.confcheck.core.range;

import io.confcheck.core.model.ConfigPath;
import java.util.Objects;

/**
 * A validation failure: the range that rejected a value, where, and what the value was. Plain data,
 * returned from {@link Range#complete}; it only turns into an exception when
 * {@code Configurations.make} gives up on it.
 *
 * @param range the rejecting range, or {@code null} when the data does not fit the schema shape at
 *              all (unknown key, non-map section)
 * @param path  the location of the rejected value
 * @param value the offending raw value
 */
public record RangeError(Range range, ConfigPath path, Object value) implements Completion {

    public RangeError {
        Objects.requireNonNull(path, "path must not be null");
    }

    @Override
    public boolean isError() {
        return true;
    }

    /**
     * Not available on an error.
     *
     * @throws IllegalStateException always
     */
    @Override
    public Object completedValue() {
        throw new IllegalStateException("No completed value: " + message());
    }

    /** Description of the rejecting range, or a generic label if there is none. */
    public String rangeDescription() {
        return range != null ? range.description() : "configuration schema";
    }

    /** Human-readable summary naming the range, path and offending value. */
    public String message() {
        return "value " + render(value) + " at " + path + " is not in range: " + rangeDescription();
    }

    private static String render(Object v) {
        return v instanceof String s ? "\"" + s + "\"" : String.valueOf(v);
    }
}
