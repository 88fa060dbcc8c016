package io.confcheck.core.error;

/**
 * Thrown when two raw configuration maps cannot be merged: a key names neither a setting nor a
 * section of the schema, or an input that must be a map is not one.
 */
public final class ConfigMergeException extends ConfigException {

    private static final long serialVersionUID = 1L;

    public ConfigMergeException(String who, String message, Object... irritants) {
        super(Kind.ASSERTION_VIOLATION, who, message, irritants);
    }
}
