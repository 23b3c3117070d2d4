package io.duomap.core;

/**
 * Relationship metadata attached to a field's type expression.
 *
 * @param reverseField name of the field on the target entity pointing back at
 *                     this one; informational only, never enforced
 */
public record Relation(String reverseField) {

    private static final Relation PLAIN = new Relation(null);

    public static Relation of() {
        return PLAIN;
    }

    public static Relation reversedBy(String reverseField) {
        if (reverseField == null || reverseField.isBlank()) {
            throw new IllegalArgumentException("reverseField required");
        }
        return new Relation(reverseField);
    }

    @Override
    public String toString() {
        return reverseField == null ? "Relation()" : "Relation(reverse=" + reverseField + ")";
    }
}
