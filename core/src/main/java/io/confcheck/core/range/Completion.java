package io.confcheck.core.range;

/**
 * Outcome of {@link Range#complete}: either a completed value or the {@link RangeError} that
 * rejected the input. Errors are returned, never thrown.
 */
public sealed interface Completion permits Completion.Completed, RangeError {

    /** Wraps a successfully completed value. {@code value} may be {@code null}. */
    static Completion completed(Object value) {
        return new Completed(value);
    }

    /** {@code true} if this completion is a {@link RangeError}. */
    boolean isError();

    /**
     * Returns the completed value.
     *
     * @throws IllegalStateException if this completion is an error
     */
    Object completedValue();

    /** A successfully completed value. */
    record Completed(Object value) implements Completion {

        @Override
        public boolean isError() {
            return false;
        }

        @Override
        public Object completedValue() {
            return value;
        }
    }
}
