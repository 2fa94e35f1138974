package com.trainingplan.generator.distribution;

import java.util.List;

import com.trainingplan.generator.model.TrainingPhase;
import com.trainingplan.generator.model.WorkoutType;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One week's workouts before they are placed on days.
 */
@Value
@Builder
public class WeeklyWorkoutDistribution {

    int trainingDays;

    double weeklyDistanceKm;

    @NonNull
    TrainingPhase phase;

    @NonNull
    WorkoutCounts counts;

    /**
     * Training workouts in template order; rest days carry no workout.
     */
    @NonNull
    List<Workout> workouts;

    public List<Workout> workoutsOfType(WorkoutType type) {
        return workouts.stream().filter(w -> w.getType() == type).toList();
    }
}
