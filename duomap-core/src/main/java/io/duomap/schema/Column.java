package io.duomap.schema;

import io.duomap.core.ScalarType;

/**
 * One storage column of a persistence schema.
 *
 * @param name              column name; equal to the field name
 * @param type              scalar type of stored values
 * @param nullable          whether null may be stored
 * @param primaryKey        whether this is the primary-key column
 * @param relationshipField owning relationship for synthesized foreign keys, {@code null} for declared fields
 */
public record Column(String name, ScalarType type, boolean nullable, boolean primaryKey, String relationshipField) {

    public static Column declared(String name, ScalarType type, boolean nullable, boolean primaryKey) {
        return new Column(name, type, nullable, primaryKey, null);
    }

    public static Column synthesized(String name, ScalarType type, boolean nullable, String relationshipField) {
        return new Column(name, type, nullable, false, relationshipField);
    }

    public boolean isSynthesized() {
        return relationshipField != null;
    }
}
