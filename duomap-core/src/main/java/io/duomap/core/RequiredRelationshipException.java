package io.duomap.core;

/**
 * Raised before a write when a non-nullable to-one relationship has no foreign key.
 */
public class RequiredRelationshipException extends DuomapException {

    private final String fieldName;
    private final String targetEntityName;

    public RequiredRelationshipException(String fieldName, String targetEntityName) {
        super("Required relationship '" + fieldName + "' cannot be null. Provide a saved "
                + targetEntityName + " instance.");
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
