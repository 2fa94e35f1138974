package com.trainingplan.generator.generator;

import com.trainingplan.generator.model.Severity;

import lombok.NonNull;
import lombok.Value;

/**
 * Advisory finding returned alongside a plan, tagged with the stage that produced it.
 */
@Value
public class PlanWarning {

    @NonNull
    GenerationStep step;

    @NonNull
    Severity severity;

    @NonNull
    String message;

    @Override
    public String toString() {
        return "[" + severity + "] " + step.getLabel() + ": " + message;
    }
}
