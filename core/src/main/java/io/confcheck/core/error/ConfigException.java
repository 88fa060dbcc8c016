package io.confcheck.core.error;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Abstract base for all fatal configuration errors. Never thrown directly; use the concrete
 * subclasses. Recoverable data errors are {@link io.confcheck.core.range.RangeError} values and
 * never reach this hierarchy until {@code Configurations.make} gives up on them.
 */
public abstract class ConfigException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Severity class of the report. */
    public enum Kind {
        /** Something went wrong in the interaction with the outside world or the user. */
        ERROR,
        /** A caller passed arguments the operation is not specified to handle. */
        ASSERTION_VIOLATION
    }

    private final Kind kind;
    private final String who;
    private final transient List<Object> irritants;

    protected ConfigException(Kind kind, String who, String message, Object... irritants) {
        super(message);
        this.kind = kind;
        this.who = who;
        this.irritants = Collections.unmodifiableList(Arrays.asList(irritants.clone()));
    }

    /** The severity class of this report. */
    public Kind kind() {
        return kind;
    }

    /** The operation that raised the report, e.g. {@code "mergeSansProfiles"}. */
    public String who() {
        return who;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** Free-form values describing the problem, in the order they were reported. May contain nulls. */
    public List<Object> irritants() {
        return irritants;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name().toLowerCase().replace('_', '-'))
                .append(": ")
                .append(getMessage());
        if (who != null) {
            sb.append(" [").append(who).append(']');
        }
        for (Object irritant : irritants) {
            sb.append("\n    ").append(irritant);
        }
        return sb.toString();
    }
}
