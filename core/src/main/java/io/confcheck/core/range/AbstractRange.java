package io.confcheck.core.range;

import io.confcheck.core.error.RangeInvariantException;
import io.confcheck.core.model.ConfigPath;
import java.util.Objects;

/** Shared plumbing for the built-in ranges: the description and the fold precondition. */
abstract class AbstractRange implements Range {

    private final String description;

    protected AbstractRange(String description) {
        this.description = Objects.requireNonNull(description, "description must not be null");
    }

    @Override
    public final String description() {
        return description;
    }

    /**
     * Completes {@code value} with {@code range} before a fold descends into it.
     *
     * @throws RangeInvariantException if the range rejects the value
     */
    static Object completeForFold(Range range, ConfigPath path, Object value) {
        Completion completion = range.complete(path, value);
        if (completion instanceof RangeError error) {
            throw new RangeInvariantException(
                    "fold",
                    "Cannot fold a value the range rejects: " + error.message(),
                    error.path(),
                    error.value(),
                    error.rangeDescription());
        }
        return completion.completedValue();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + description + "]";
    }
}
