package io.duomap.core;

import java.util.Objects;

/**
 * A declared field: name, type expression and optional default value.
 */
public record FieldDefinition(String name, TypeExpression type, boolean hasDefault, Object defaultValue) {

    public FieldDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("field name required");
        }
        Objects.requireNonNull(type, "type");
        if (!hasDefault && defaultValue != null) {
            throw new IllegalArgumentException("defaultValue given without hasDefault for field " + name);
        }
    }

    public static FieldDefinition of(String name, TypeExpression type) {
        return new FieldDefinition(name, type, false, null);
    }

    public static FieldDefinition withDefault(String name, TypeExpression type, Object defaultValue) {
        return new FieldDefinition(name, type, true, defaultValue);
    }

    public UnwrappedType unwrap() {
        return TypeUnwrapper.unwrap(name, type);
    }
}
