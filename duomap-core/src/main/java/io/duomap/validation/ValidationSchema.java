package io.duomap.validation;

import io.duomap.core.ScalarType;
import io.duomap.schema.Column;
import io.duomap.schema.PersistenceSchema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field rules handed to a {@link ValueValidator}.
 * <p>
 * Derived from a persistence schema: declared scalar columns keep their
 * nullability, synthesized foreign keys are always nullable here (a missing
 * required relationship is reported by {@link RequiredRelationshipValidator}
 * instead), and an auto-assignable primary key may be absent before insert.
 */
public record ValidationSchema(String entityName, Map<String, FieldRule> rules) {

    public ValidationSchema {
        rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public static ValidationSchema forSchema(PersistenceSchema schema) {
        var rules = new LinkedHashMap<String, FieldRule>();
        for (Column column : schema.columns()) {
            boolean nullable = column.nullable()
                    || column.isSynthesized()
                    || (column.primaryKey() && isAutoAssignable(column.type()));
            rules.put(column.name(), new FieldRule(column.name(), column.type(), nullable));
        }
        return new ValidationSchema(schema.entityName(), rules);
    }

    /**
     * Primary keys the storage engine can generate when none is supplied.
     */
    public static boolean isAutoAssignable(ScalarType type) {
        return type == ScalarType.LONG || type == ScalarType.INT || type == ScalarType.UUID;
    }

    public FieldRule rule(String field) {
        return rules.get(field);
    }

    public record FieldRule(String name, ScalarType type, boolean nullable) {
    }
}
