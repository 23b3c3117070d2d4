package io.duomap.validation;

import java.util.Map;

/**
 * Validation collaborator: checks a value map against field rules.
 * <p>
 * Implementations must not throw for invalid input; they report every
 * problem in the returned {@link ValidationResult}.
 */
@FunctionalInterface
public interface ValueValidator {

    ValidationResult validate(ValidationSchema schema, Map<String, Object> values);
}
