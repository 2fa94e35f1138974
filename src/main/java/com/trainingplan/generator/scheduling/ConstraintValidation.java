package com.trainingplan.generator.scheduling;

import java.util.List;

import lombok.Value;

@Value
public class ConstraintValidation {
    boolean valid;
    List<String> errors;
    List<String> warnings;
}
