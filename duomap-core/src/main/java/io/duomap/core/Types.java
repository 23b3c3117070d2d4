package io.duomap.core;

/**
 * Factory methods for {@link TypeExpression}s.
 * <pre>
 * Types.LONG                                              // plain scalar
 * Types.nullable(Types.STRING)                            // nullable scalar
 * Types.relation(Types.entity("Author"))                  // required to-one
 * Types.relation(Types.nullable(Types.entity("Author")))  // optional to-one
 * Types.relation(Types.listOf(Types.entity("Book")), Relation.reversedBy("author"))  // to-many
 * </pre>
 */
public final class Types {

    public static final TypeExpression INT = scalar(ScalarType.INT);
    public static final TypeExpression LONG = scalar(ScalarType.LONG);
    public static final TypeExpression BOOLEAN = scalar(ScalarType.BOOLEAN);
    public static final TypeExpression DOUBLE = scalar(ScalarType.DOUBLE);
    public static final TypeExpression DECIMAL = scalar(ScalarType.DECIMAL);
    public static final TypeExpression STRING = scalar(ScalarType.STRING);
    public static final TypeExpression UUID = scalar(ScalarType.UUID);
    public static final TypeExpression INSTANT = scalar(ScalarType.INSTANT);
    public static final TypeExpression LOCAL_DATE = scalar(ScalarType.LOCAL_DATE);
    public static final TypeExpression LOCAL_DATE_TIME = scalar(ScalarType.LOCAL_DATE_TIME);

    private Types() {
    }

    public static TypeExpression scalar(ScalarType type) {
        return new TypeExpression.Scalar(type);
    }

    public static TypeExpression entity(String entityName) {
        return new TypeExpression.EntityRef(entityName);
    }

    public static TypeExpression nullable(TypeExpression inner) {
        return new TypeExpression.Nullable(inner);
    }

    public static TypeExpression listOf(TypeExpression element) {
        return new TypeExpression.ListOf(element);
    }

    public static TypeExpression relation(TypeExpression inner) {
        return new TypeExpression.Related(inner, Relation.of());
    }

    public static TypeExpression relation(TypeExpression inner, Relation relation) {
        return new TypeExpression.Related(inner, relation);
    }
}
