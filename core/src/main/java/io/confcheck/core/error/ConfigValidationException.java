package io.confcheck.core.error;

import io.confcheck.core.range.RangeError;

/**
 * Thrown by {@code Configurations.make} when normalization rejects the raw configuration. Carries
 * the {@link RangeError} that stopped normalization; the message names the rejecting range, the
 * path and the offending value.
 */
public final class ConfigValidationException extends ConfigException {

    private static final long serialVersionUID = 1L;

    private final transient RangeError rangeError;

    public ConfigValidationException(String who, RangeError rangeError) {
        super(
                Kind.ERROR,
                who,
                "Invalid configuration: " + rangeError.message(),
                rangeError.path(),
                rangeError.value(),
                rangeError.rangeDescription());
        this.rangeError = rangeError;
    }

    /** The validation failure that was surfaced. */
    public RangeError rangeError() {
        return rangeError;
    }
}
