package com.trainingplan.generator.validation;

import com.trainingplan.generator.model.Severity;

import lombok.NonNull;
import lombok.Value;

/**
 * Advisory configuration finding. Never blocks generation.
 */
@Value
public class ValidationWarning {

    @NonNull
    String code;

    @NonNull
    String field;

    @NonNull
    String message;

    @NonNull
    Severity severity;
}
