package io.duomap.validation;

import io.duomap.core.DuomapException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when field values fail validation. Carries every field error found.
 */
public class ValidationException extends DuomapException {

    private final String entityName;
    private final List<FieldError> fieldErrors;

    public ValidationException(String entityName, List<FieldError> fieldErrors) {
        super("Validation failed for " + entityName + ": "
                + fieldErrors.stream().map(FieldError::toString).collect(Collectors.joining("; ")));
        this.entityName = entityName;
        this.fieldErrors = List.copyOf(fieldErrors);
    }

    public String entityName() {
        return entityName;
    }

    public List<FieldError> fieldErrors() {
        return fieldErrors;
    }
}
