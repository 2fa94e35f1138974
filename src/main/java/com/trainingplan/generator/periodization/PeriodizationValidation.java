package com.trainingplan.generator.periodization;

import java.util.List;

import lombok.Value;

@Value
public class PeriodizationValidation {
    boolean valid;
    List<String> warnings;
    List<String> recommendations;
}
