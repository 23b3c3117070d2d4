package io.duomap.core;

/**
 * Raised when an entity definition cannot be turned into a persistence schema:
 * malformed type expressions, missing or invalid primary keys, and synthesized
 * foreign-key names that collide with declared fields.
 */
public class DefinitionException extends DuomapException {

    public DefinitionException(String message) {
        super(message);
    }

    public DefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
