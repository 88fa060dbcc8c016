package io.confcheck.core.range;

import io.confcheck.core.model.ConfigPath;

/**
 * Wraps a range so that {@code null} is handled before delegation: either accepted as-is
 * ({@code optional}) or replaced by a default that must itself satisfy the wrapped range
 * ({@code optional-default}).
 */
final class OptionalRange extends AbstractRange {

    private final Range range;
    private final boolean substitute;
    private final Object defaultValue;

    private OptionalRange(String description, Range range, boolean substitute, Object defaultValue) {
        super(description);
        this.range = range;
        this.substitute = substitute;
        this.defaultValue = defaultValue;
    }

    static OptionalRange optional(Range range) {
        return new OptionalRange("optional " + range.description(), range, false, null);
    }

    static OptionalRange withDefault(Range range, Object defaultValue) {
        return new OptionalRange(
                range.description() + ", default " + defaultValue, range, true, defaultValue);
    }

    @Override
    public Completion complete(ConfigPath path, Object raw) {
        if (raw == null) {
            if (!substitute) {
                return Completion.completed(null);
            }
            return range.complete(path, defaultValue);
        }
        return range.complete(path, raw);
    }

    @Override
    public <A> A fold(ConfigPath path, ScalarFolder<A> folder, A init, Object value) {
        if (value == null) {
            return substitute ? range.fold(path, folder, init, defaultValue) : init;
        }
        return range.fold(path, folder, init, value);
    }
}
