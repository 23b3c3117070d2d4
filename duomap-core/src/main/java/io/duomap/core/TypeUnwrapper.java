package io.duomap.core;

/**
 * Normalises a declared {@link TypeExpression} into an {@link UnwrappedType}.
 * <p>
 * Wrappers are stripped in a fixed order: relationship metadata first, then
 * nullability, then the collection wrapper. Any other nesting (a nullable
 * element inside a list, metadata below the outermost position, nested lists)
 * is rejected rather than guessed at.
 * <p>
 * Entity references are left as names; nothing is resolved here.
 */
public final class TypeUnwrapper {

    private TypeUnwrapper() {
    }

    public static UnwrappedType unwrap(TypeExpression expression) {
        return unwrap(null, expression);
    }

    /**
     * @param fieldName field the expression belongs to, used in error messages; may be null
     * @throws DefinitionException if the expression is not part of the supported grammar
     */
    public static UnwrappedType unwrap(String fieldName, TypeExpression expression) {
        if (expression == null) {
            throw malformed(fieldName, "missing type expression");
        }
        TypeExpression current = expression;

        Relation relation = null;
        if (current instanceof TypeExpression.Related related) {
            relation = related.relation();
            current = related.inner();
        }

        boolean nullable = false;
        if (current instanceof TypeExpression.Nullable wrapper) {
            nullable = true;
            current = wrapper.inner();
        }

        boolean collection = false;
        if (current instanceof TypeExpression.ListOf list) {
            collection = true;
            current = list.element();
        }

        if (!(current instanceof TypeExpression.Scalar) && !(current instanceof TypeExpression.EntityRef)) {
            throw malformed(fieldName, "unsupported nesting in " + expression.describe());
        }

        if (relation != null && current instanceof TypeExpression.Scalar) {
            throw malformed(fieldName, "relation metadata requires an entity reference, got "
                    + expression.describe());
        }
        if (relation == null && current instanceof TypeExpression.EntityRef) {
            throw malformed(fieldName, "entity reference " + current.describe()
                    + " must be declared with relation metadata");
        }
        if (relation == null && collection) {
            throw malformed(fieldName, "collections are only supported as relationships, got "
                    + expression.describe());
        }

        return new UnwrappedType(current, collection, nullable, relation);
    }

    private static DefinitionException malformed(String fieldName, String detail) {
        if (fieldName == null) {
            return new DefinitionException("Malformed type expression: " + detail);
        }
        return new DefinitionException("Malformed type expression for field '" + fieldName + "': " + detail);
    }
}
