package com.trainingplan.generator.model;

import java.time.DayOfWeek;
import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Runner preferences that a training plan is generated from.
 *
 * Pure structure only: consistency checks live in the configuration validator,
 * so fields a caller may leave unset are nullable here.
 */
@Value
@Builder(toBuilder = true)
public class PlanConfiguration {

    RaceDistance raceDistance;

    /**
     * Program length in weeks.
     */
    int programLength;

    int trainingDaysPerWeek;

    /**
     * Days without training. Kept as a list so duplicates can be reported rather than silently collapsed.
     */
    @NonNull
    @Builder.Default
    List<DayOfWeek> restDays = List.of();

    DayOfWeek longRunDay;

    /**
     * Every n-th week is a deload week (3 or 4).
     */
    int deloadFrequency;

    @Builder.Default
    ExperienceLevel experience = ExperienceLevel.INTERMEDIATE;

    @Builder.Default
    DifficultyLevel difficulty = DifficultyLevel.MODERATE;

    /**
     * Optional; only changes pace-guidance wording.
     */
    PaceMethod paceMethod;

    public ExperienceLevel effectiveExperience() {
        return experience != null ? experience : ExperienceLevel.INTERMEDIATE;
    }

    public DifficultyLevel effectiveDifficulty() {
        return difficulty != null ? difficulty : DifficultyLevel.MODERATE;
    }
}
