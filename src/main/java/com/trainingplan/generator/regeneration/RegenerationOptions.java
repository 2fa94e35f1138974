package com.trainingplan.generator.regeneration;

import com.trainingplan.generator.generator.PlanGenerationOptions;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class RegenerationOptions {

    boolean forceFullRegeneration;

    /**
     * Passed to the generator when the plan is generated again.
     */
    @NonNull
    @Builder.Default
    PlanGenerationOptions generationOptions = PlanGenerationOptions.defaults();

    public static RegenerationOptions defaults() {
        return RegenerationOptions.builder().build();
    }
}
