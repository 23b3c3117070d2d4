package io.duomap.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a validation: the normalised values, or the field errors.
 */
public record ValidationResult(String entityName, Map<String, Object> values, List<FieldError> errors) {

    public ValidationResult {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        errors = List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * @return the normalised values
     * @throws ValidationException if any field error was reported
     */
    public Map<String, Object> orThrow() {
        if (!errors.isEmpty()) {
            throw new ValidationException(entityName, errors);
        }
        return values;
    }
}
