package io.confcheck.core.range;

import io.confcheck.core.model.ConfigPath;

/**
 * Governs the admissible values of one schema slot. A range does two things:
 *
 * <ul>
 * <li>{@link #complete} validates a raw value and turns it into its completed form (filling in
 * defaults for {@code null}, coercing collections), or returns the {@link RangeError} of the range
 * that rejected it.</li>
 * <li>{@link #fold} walks the scalar leaves of a value, calling a {@link ScalarFolder} once per
 * leaf, left to right.</li>
 * </ul>
 *
 * <p>
 * Implementations must be immutable. {@code complete} never throws for values of any type; every
 * rejection is a returned {@link RangeError}. {@code fold} must accept raw values, so it completes
 * before it folds, and throws {@link io.confcheck.core.error.RangeInvariantException} if completion
 * fails.
 *
 * <p>
 * Most callers build ranges with {@link Ranges}; custom scalar ranges can be made with
 * {@link Ranges#scalar(String, Completer)} or by implementing this interface directly.
 */
public interface Range {

    /** Human-readable description used in error messages, e.g. {@code "integer between 1 and 65535"}. */
    String description();

    /**
     * Validates and completes {@code raw}.
     *
     * @param path location of {@code raw}, reported in errors
     * @param raw  the raw value, possibly {@code null}
     * @return the completed value, or the error of the range that rejected it
     */
    Completion complete(ConfigPath path, Object raw);

    /**
     * Folds {@code folder} over every scalar leaf of {@code value}, threading the accumulator.
     *
     * @param path   location of {@code value}
     * @param folder callback invoked once per scalar leaf
     * @param init   initial accumulator
     * @param value  raw or completed value
     * @return the final accumulator
     */
    <A> A fold(ConfigPath path, ScalarFolder<A> folder, A init, Object value);

    /** Convenience: an error naming this range as the rejecting one. */
    default RangeError reject(ConfigPath path, Object value) {
        return new RangeError(this, path, value);
    }
}
