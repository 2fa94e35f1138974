package com.trainingplan.generator.validation;

import lombok.NonNull;
import lombok.Value;

/**
 * Blocking configuration problem.
 */
@Value
public class ValidationError {

    /**
     * Stable machine-readable code, e.g. {@code PROGRAM_TOO_SHORT}.
     */
    @NonNull
    String code;

    @NonNull
    String field;

    @NonNull
    String message;
}
