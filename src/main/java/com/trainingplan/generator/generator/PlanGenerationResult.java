package com.trainingplan.generator.generator;

import java.util.List;

import com.trainingplan.generator.plan.TrainingPlan;
import com.trainingplan.generator.validation.ValidationResult;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Result of a generation run.
 *
 * A successful run carries the plan, except for validate-only runs. A failed run carries the
 * blocking errors of the stage that stopped it and no plan.
 */
@Value
@Builder
public class PlanGenerationResult {

    boolean success;

    TrainingPlan plan;

    @NonNull
    @Builder.Default
    List<String> errors = List.of();

    @NonNull
    @Builder.Default
    List<PlanWarning> warnings = List.of();

    /**
     * Null only when generation failed before validation finished.
     */
    ValidationResult validationResult;

    public static PlanGenerationResult failure(List<String> errors, List<PlanWarning> warnings,
                                               ValidationResult validationResult) {
        return PlanGenerationResult.builder()
                .success(false)
                .errors(List.copyOf(errors))
                .warnings(List.copyOf(warnings))
                .validationResult(validationResult)
                .build();
    }

    public List<String> warningMessages() {
        return warnings.stream().map(PlanWarning::getMessage).toList();
    }
}
