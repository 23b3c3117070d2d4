package io.duomap.core;

/**
 * Extracted metadata for one relationship field.
 *
 * @param fieldName        declaring field
 * @param targetEntityName target entity as written; may not be registered yet
 * @param cardinality      to-one or to-many
 * @param nullable         whether the declared type was nullable; to-many relationships are never required
 * @param reverseFieldName informational back-reference name, or {@code null}
 */
public record RelationshipDescriptor(
        String fieldName,
        String targetEntityName,
        Cardinality cardinality,
        boolean nullable,
        String reverseFieldName) {

    public boolean isToOne() {
        return cardinality == Cardinality.TO_ONE;
    }

    public boolean isRequired() {
        return isToOne() && !nullable;
    }

    /**
     * Name of the synthesized foreign key, or {@code null} for to-many relationships.
     */
    public String foreignKeyName() {
        return isToOne() ? ForeignKeySynthesizer.foreignKeyName(fieldName) : null;
    }
}
