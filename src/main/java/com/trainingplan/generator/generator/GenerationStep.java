package com.trainingplan.generator.generator;

import lombok.Getter;

/**
 * Pipeline stages, in execution order.
 */
@Getter
public enum GenerationStep {

    VALIDATION("Configuration validation"),
    PERIODIZATION("Phase periodization"),
    PROGRESSION("Volume progression"),
    DISTRIBUTION("Workout distribution"),
    SCHEDULING("Weekly scheduling"),
    DELOAD("Deload scheduling"),
    ASSEMBLY("Plan assembly"),
    PLAN_VALIDATION("Plan validation");

    private final String label;

    GenerationStep(String label) {
        this.label = label;
    }
}
