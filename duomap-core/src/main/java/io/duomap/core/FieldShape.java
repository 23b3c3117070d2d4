package io.duomap.core;

/**
 * Closed classification of a field once its type expression is unwrapped.
 */
public enum FieldShape {
    PLAIN_SCALAR,
    NULLABLE_SCALAR,
    TO_ONE,
    NULLABLE_TO_ONE,
    TO_MANY;

    public boolean isRelationship() {
        return this == TO_ONE || this == NULLABLE_TO_ONE || this == TO_MANY;
    }

    public boolean isNullable() {
        return this == NULLABLE_SCALAR || this == NULLABLE_TO_ONE;
    }
}
