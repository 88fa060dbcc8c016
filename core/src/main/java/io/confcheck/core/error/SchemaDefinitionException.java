package io.confcheck.core.error;

/** Thrown when a schema is declared with two entries under the same key. */
public final class SchemaDefinitionException extends ConfigException {

    private static final long serialVersionUID = 1L;

    public SchemaDefinitionException(String who, String message, Object... irritants) {
        super(Kind.ASSERTION_VIOLATION, who, message, irritants);
    }
}
