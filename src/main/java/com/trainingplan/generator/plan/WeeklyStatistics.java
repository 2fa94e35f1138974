package com.trainingplan.generator.plan;

import java.util.Map;

import com.trainingplan.generator.model.IntensityZone;
import com.trainingplan.generator.model.WorkoutType;

import lombok.Value;

@Value
public class WeeklyStatistics {
    int weekNumber;
    double distanceKm;
    int durationMinutes;
    Map<WorkoutType, Integer> workoutBreakdown;

    /**
     * Whole-number share of training sessions per zone; every zone is present.
     */
    Map<IntensityZone, Integer> intensityDistribution;
}
