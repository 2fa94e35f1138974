package com.trainingplan.generator.regeneration;

import java.util.List;

import com.trainingplan.generator.plan.TrainingPlan;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of a regeneration. {@code newPlan} and {@code comparison} are null when it failed.
 */
@Value
@Builder
public class RegenerationResult {

    boolean success;

    TrainingPlan newPlan;

    ComparisonReport comparison;

    @NonNull
    @Builder.Default
    List<String> errors = List.of();

    @NonNull
    @Builder.Default
    List<String> warnings = List.of();

    @NonNull
    RegenerationStrategy strategyUsed;

    public static RegenerationResult failure(RegenerationStrategy strategy, List<String> errors,
                                             List<String> warnings) {
        return RegenerationResult.builder()
                .success(false)
                .errors(List.copyOf(errors))
                .warnings(List.copyOf(warnings))
                .strategyUsed(strategy)
                .build();
    }
}
