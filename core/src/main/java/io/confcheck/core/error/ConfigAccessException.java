package io.confcheck.core.error;

/** Thrown when a setting or section is looked up under a path the configuration does not have. */
public final class ConfigAccessException extends ConfigException {

    private static final long serialVersionUID = 1L;

    public ConfigAccessException(String who, String message, Object... irritants) {
        super(Kind.ASSERTION_VIOLATION, who, message, irritants);
    }
}
