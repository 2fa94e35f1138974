package com.trainingplan.generator.validation;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of validating a plan configuration. Valid iff there are no errors.
 */
@Value
@Builder
public class ValidationResult {

    @Singular
    List<ValidationError> errors;

    @Singular
    List<ValidationWarning> warnings;

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> errorMessages() {
        return errors.stream().map(ValidationError::getMessage).toList();
    }

    public boolean hasErrorCode(String code) {
        return errors.stream().anyMatch(e -> e.getCode().equals(code));
    }

    public boolean hasWarningCode(String code) {
        return warnings.stream().anyMatch(w -> w.getCode().equals(code));
    }
}
