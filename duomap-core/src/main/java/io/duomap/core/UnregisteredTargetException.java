package io.duomap.core;

/**
 * Raised when a relationship target is needed (schema derivation or first lazy
 * resolution) but no entity with that name has been declared yet.
 */
public class UnregisteredTargetException extends DuomapException {

    private final String fieldName;
    private final String targetEntityName;

    public UnregisteredTargetException(String fieldName, String targetEntityName) {
        super("Relationship '" + fieldName + "' targets unregistered entity '" + targetEntityName + "'");
        this.fieldName = fieldName;
        this.targetEntityName = targetEntityName;
    }

    public String fieldName() {
        return fieldName;
    }

    public String targetEntityName() {
        return targetEntityName;
    }
}
