package io.duomap.core;

/**
 * Canonical form of a field's type expression.
 *
 * @param bareType   the innermost {@link TypeExpression.Scalar} or {@link TypeExpression.EntityRef}
 * @param collection whether a list wrapper was stripped
 * @param nullable   whether a nullable wrapper was stripped
 * @param relation   relationship metadata, or {@code null} for plain fields
 */
public record UnwrappedType(TypeExpression bareType, boolean collection, boolean nullable, Relation relation) {

    public boolean isRelationship() {
        return relation != null;
    }

    public FieldShape shape() {
        if (relation == null) {
            return nullable ? FieldShape.NULLABLE_SCALAR : FieldShape.PLAIN_SCALAR;
        }
        if (collection) {
            return FieldShape.TO_MANY;
        }
        return nullable ? FieldShape.NULLABLE_TO_ONE : FieldShape.TO_ONE;
    }

    /**
     * @return the scalar type, or {@code null} when the bare type is an entity reference
     */
    public ScalarType scalarType() {
        return bareType instanceof TypeExpression.Scalar scalar ? scalar.type() : null;
    }

    /**
     * @return the referenced entity name as written, or {@code null} for scalars
     */
    public String targetEntityName() {
        return bareType instanceof TypeExpression.EntityRef ref ? ref.entityName() : null;
    }
}
