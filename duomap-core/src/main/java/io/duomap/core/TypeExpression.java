package io.duomap.core;

import java.util.Objects;

/**
 * Declared type of a field.
 * <p>
 * Expressions compose from the outside in: an optional {@link Related} wrapper
 * carrying relationship metadata, an optional {@link Nullable} wrapper, an
 * optional {@link ListOf} wrapper, and finally a bare {@link Scalar} or
 * {@link EntityRef}. Build them with {@link Types}.
 *
 * @see TypeUnwrapper
 */
public sealed interface TypeExpression
        permits TypeExpression.Scalar, TypeExpression.EntityRef, TypeExpression.Nullable,
        TypeExpression.ListOf, TypeExpression.Related {

    /**
     * Human readable rendering, used in error messages.
     */
    String describe();

    record Scalar(ScalarType type) implements TypeExpression {
        public Scalar {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public String describe() {
            return type.name();
        }
    }

    /**
     * Reference to another entity by name. The target does not need to be
     * declared when the reference is created.
     */
    record EntityRef(String entityName) implements TypeExpression {
        public EntityRef {
            if (entityName == null || entityName.isBlank()) {
                throw new IllegalArgumentException("entityName required");
            }
        }

        @Override
        public String describe() {
            return "'" + entityName + "'";
        }
    }

    record Nullable(TypeExpression inner) implements TypeExpression {
        public Nullable {
            Objects.requireNonNull(inner, "inner");
        }

        @Override
        public String describe() {
            return "nullable(" + inner.describe() + ")";
        }
    }

    record ListOf(TypeExpression element) implements TypeExpression {
        public ListOf {
            Objects.requireNonNull(element, "element");
        }

        @Override
        public String describe() {
            return "listOf(" + element.describe() + ")";
        }
    }

    record Related(TypeExpression inner, Relation relation) implements TypeExpression {
        public Related {
            Objects.requireNonNull(inner, "inner");
            Objects.requireNonNull(relation, "relation");
        }

        @Override
        public String describe() {
            return "relation(" + inner.describe() + ", " + relation + ")";
        }
    }
}
