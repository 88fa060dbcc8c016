package io.confcheck.core.error;

/**
 * Thrown when a range is asked to fold a value it cannot complete. Folding always completes first,
 * so reaching this means the caller handed an unvalidated value to a fold.
 */
public final class RangeInvariantException extends ConfigException {

    private static final long serialVersionUID = 1L;

    public RangeInvariantException(String who, String message, Object... irritants) {
        super(Kind.ASSERTION_VIOLATION, who, message, irritants);
    }
}
