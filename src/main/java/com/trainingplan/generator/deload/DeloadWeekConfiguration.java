package com.trainingplan.generator.deload;

import java.util.List;

import com.trainingplan.generator.model.TrainingPhase;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A deload week and the reduction it should apply.
 */
@Value
@Builder(toBuilder = true)
public class DeloadWeekConfiguration {

    int weekNumber;

    boolean deloadWeek;

    @NonNull
    TrainingPhase phase;

    /**
     * Midpoint of the phase's allowed reduction range.
     */
    double volumeReduction;

    /**
     * Filled in once the week has been scheduled.
     */
    @NonNull
    @Builder.Default
    List<DeloadWorkoutModification> workoutModifications = List.of();

    @NonNull
    @Builder.Default
    List<String> phaseConflicts = List.of();

    @NonNull
    @Builder.Default
    List<String> schedulingNotes = List.of();
}
