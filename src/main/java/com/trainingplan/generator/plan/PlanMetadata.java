package com.trainingplan.generator.plan;

import java.time.Instant;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class PlanMetadata {

    public static final String VERSION = "1.0.0";

    double totalDistanceKm;

    double totalDistanceMiles;

    int totalWorkouts;

    int totalTrainingDays;

    int totalRestDays;

    @NonNull
    Instant createdAt;

    /**
     * Average of the weekly durations, in minutes.
     */
    int estimatedWeeklyMinutes;

    @NonNull
    WorkoutTypeDistribution workoutTypeDistribution;

    @NonNull
    PhaseDistribution phaseDistribution;

    @NonNull
    @Builder.Default
    String version = VERSION;
}
