package com.trainingplan.generator.generator;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class PlanGenerationOptions {

    /**
     * Stop after configuration validation; the result carries no plan.
     */
    boolean validateOnly;

    /**
     * Leave deload weeks out of the plan. The volume sequence still contains its deload weeks.
     */
    boolean skipDeload;

    /**
     * Seed for the deload quality-skip draw. Null means an unseeded generator.
     */
    Long randomSeed;

    public static PlanGenerationOptions defaults() {
        return PlanGenerationOptions.builder().build();
    }
}
