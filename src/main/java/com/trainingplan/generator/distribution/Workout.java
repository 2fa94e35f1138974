package com.trainingplan.generator.distribution;

import com.trainingplan.generator.model.IntensityZone;
import com.trainingplan.generator.model.QualityWorkoutType;
import com.trainingplan.generator.model.WorkoutType;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A single prescribed session, not yet tied to a day.
 */
@Value
@Builder(toBuilder = true)
public class Workout {

    @NonNull
    WorkoutType type;

    double distanceKm;

    int durationMinutes;

    @NonNull
    IntensityZone intensity;

    @NonNull
    String description;

    @NonNull
    String paceGuidance;

    int recoveryHours;

    /**
     * Set once the scheduler has assigned this week's rotation; null for non-quality workouts.
     */
    QualityWorkoutType qualityType;
}
