package com.trainingplan.generator.deload;

import java.time.DayOfWeek;

import com.trainingplan.generator.distribution.Workout;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * How one scheduled workout changes in a deload week.
 */
@Value
@Builder(toBuilder = true)
public class DeloadWorkoutModification {

    @NonNull
    DayOfWeek day;

    @NonNull
    Workout originalWorkout;

    /**
     * The reduced workout, or a zero-distance rest placeholder when skipped.
     */
    @NonNull
    Workout modifiedWorkout;

    @NonNull
    ModificationType modificationType;

    /**
     * Fraction removed, 1.0 for a skip.
     */
    double reductionAmount;

    @NonNull
    String rationale;

    public boolean isSkip() {
        return modificationType == ModificationType.SKIP;
    }
}
