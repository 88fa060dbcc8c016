package io.confcheck.core.range;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Factory for the built-in range combinators.
 *
 * <p>
 * Scalar ranges treat {@code null} as "not set" and complete it to their default. Composite ranges
 * ({@link #sequenceOf}, {@link #mapOf}, ...) derive both completion and fold from the ranges they
 * wrap. All ranges returned here are immutable and thread-safe.
 */
public final class Ranges {

    private Ranges() {}

    // ── Scalar ranges ──

    /** A scalar range built from a completion function. */
    public static Range scalar(String description, Completer completer) {
        return new ScalarRange(description, completer);
    }

    /** Accepts everything; {@code null} completes to {@code defaultValue}. */
    public static Range anyValue(Object defaultValue) {
        return scalar("any value", (self, path, raw) -> Completion.completed(raw == null ? defaultValue : raw));
    }

    /** Accepts everything, including {@code null}. */
    public static Range anyValue() {
        return anyValue(null);
    }

    /** Accepts any value except {@code null}. Useful for required settings. */
    public static Range nonNil() {
        return scalar(
                "non-nil value",
                (self, path, raw) -> raw == null ? self.reject(path, raw) : Completion.completed(raw));
    }

    /**
     * Accepts values satisfying {@code predicate}; {@code null} completes to {@code defaultValue}
     * without being tested.
     */
    public static Range predicate(String description, Predicate<Object> predicate, Object defaultValue) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        return scalar(description, (self, path, raw) -> {
            if (raw == null) {
                return Completion.completed(defaultValue);
            }
            return predicate.test(raw) ? Completion.completed(raw) : self.reject(path, raw);
        });
    }

    public static Range booleanRange(Boolean defaultValue) {
        return predicate("boolean", Boolean.class::isInstance, defaultValue);
    }

    public static Range stringRange(String defaultValue) {
        return predicate("string", String.class::isInstance, defaultValue);
    }

    public static Range nonEmptyStringRange(String defaultValue) {
        return predicate("non-empty string", v -> v instanceof String s && !s.isEmpty(), defaultValue);
    }

    /** Accepts integral numbers: {@code Byte}, {@code Short}, {@code Integer}, {@code Long}, {@code BigInteger}. */
    public static Range integerRange(Number defaultValue) {
        return predicate("integer", Ranges::isIntegral, defaultValue);
    }

    /** Accepts integral numbers within {@code [min, max]}, both inclusive. */
    public static Range integerBetween(long min, long max, Number defaultValue) {
        if (min > max) {
            throw new IllegalArgumentException("min must not exceed max: " + min + " > " + max);
        }
        return predicate(
                "integer between " + min + " and " + max,
                v -> isIntegral(v) && fitsLong(v) && within(((Number) v).longValue(), min, max),
                defaultValue);
    }

    /**
     * Accepts members of {@code values} (by {@link Object#equals}); {@code null} completes to
     * {@code defaultValue}.
     */
    public static Range oneOf(Collection<?> values, Object defaultValue) {
        return oneOf(values, Objects::equals, defaultValue);
    }

    /**
     * Accepts values that {@code equivalent} matches against a member of {@code values} and
     * completes them to that member. {@code equivalent} receives {@code (member, raw)}.
     */
    public static Range oneOf(Collection<?> values, BiPredicate<Object, Object> equivalent, Object defaultValue) {
        List<Object> members = List.copyOf(values);
        Objects.requireNonNull(equivalent, "equivalent must not be null");
        return scalar("one of " + members, (self, path, raw) -> {
            if (raw == null) {
                return Completion.completed(defaultValue);
            }
            for (Object member : members) {
                if (equivalent.test(member, raw)) {
                    return Completion.completed(member);
                }
            }
            return self.reject(path, raw);
        });
    }

    /**
     * Accepts constants of {@code type} and their names, case-insensitively, completing both to the
     * constant.
     */
    public static <E extends Enum<E>> Range enumRange(Class<E> type, E defaultValue) {
        return oneOf(
                Arrays.asList(type.getEnumConstants()),
                (member, raw) -> member == raw
                        || (raw instanceof String s && ((Enum<?>) member).name().equalsIgnoreCase(s)),
                defaultValue);
    }

    // ── Combinators ──

    /** {@code null} completes to {@code null}; everything else is delegated to {@code range}. */
    public static Range optional(Range range) {
        return OptionalRange.optional(range);
    }

    /**
     * {@code null} is replaced by {@code defaultValue} before delegating, so the default must satisfy
     * {@code range}.
     */
    public static Range optionalDefault(Range range, Object defaultValue) {
        return OptionalRange.withDefault(range, defaultValue);
    }

    /** Tries each range in order and takes the first that accepts the value. */
    public static Range anyOf(Range... ranges) {
        if (ranges.length == 0) {
            throw new IllegalArgumentException("anyOf requires at least one range");
        }
        return new AnyOfRange(List.of(ranges));
    }

    /** Lists whose elements all satisfy {@code elementRange}; {@code null} completes to an empty list. */
    public static Range sequenceOf(Range elementRange) {
        return SequenceRange.sequenceOf(elementRange);
    }

    /** Like {@link #sequenceOf}, completed to a set; duplicates collapse silently. */
    public static Range setOf(Range elementRange) {
        return SequenceRange.setOf(elementRange);
    }

    /** Sequences validated position by position against {@code ranges}. */
    public static Range tupleOf(Range... ranges) {
        return new TupleRange(List.of(ranges));
    }

    /**
     * Maps whose keys satisfy {@code keyRange} and values satisfy {@code valueRange}; {@code null}
     * completes to an empty map.
     */
    public static Range mapOf(Range keyRange, Range valueRange) {
        return new MapOfRange(keyRange, valueRange);
    }

    /** Applies {@code mapper} to values {@code range} accepts. */
    public static Range rangeMap(String description, Range range, Function<Object, Object> mapper) {
        return new MappedRange(description, range, Objects.requireNonNull(mapper, "mapper must not be null"));
    }

    // --- Private helpers ---

    private static boolean isIntegral(Object v) {
        return v instanceof Integer
                || v instanceof Long
                || v instanceof Short
                || v instanceof Byte
                || v instanceof BigInteger;
    }

    private static boolean within(long v, long min, long max) {
        return v >= min && v <= max;
    }

    private static boolean fitsLong(Object v) {
        return !(v instanceof BigInteger big) || big.bitLength() < Long.SIZE;
    }
}
