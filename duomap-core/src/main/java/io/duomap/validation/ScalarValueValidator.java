package io.duomap.validation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default validator: unknown fields, null checks and scalar type checks.
 * Accepted values are coerced to their column's carrier type (for example an
 * {@code Integer} given for a {@code LONG} field becomes a {@code Long}).
 */
public final class ScalarValueValidator implements ValueValidator {

    @Override
    public ValidationResult validate(ValidationSchema schema, Map<String, Object> values) {
        var errors = new ArrayList<FieldError>();
        var normalised = new LinkedHashMap<String, Object>();

        for (var key : values.keySet()) {
            if (schema.rule(key) == null) {
                errors.add(new FieldError(key, "unknown field"));
            }
        }

        for (var rule : schema.rules().values()) {
            Object value = values.get(rule.name());
            if (value == null) {
                if (!rule.nullable()) {
                    errors.add(new FieldError(rule.name(), "field required"));
                }
                normalised.put(rule.name(), null);
                continue;
            }
            if (!rule.type().accepts(value)) {
                errors.add(new FieldError(rule.name(), "expected " + rule.type() + " but got "
                        + value.getClass().getSimpleName()));
                continue;
            }
            normalised.put(rule.name(), rule.type().coerce(value));
        }
        return new ValidationResult(schema.entityName(), normalised, errors);
    }
}
