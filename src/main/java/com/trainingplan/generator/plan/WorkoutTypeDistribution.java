package com.trainingplan.generator.plan;

import lombok.Value;

/**
 * Scheduled session counts by category across the whole plan.
 */
@Value
public class WorkoutTypeDistribution {
    int easy;
    int longRuns;
    int quality;
    int rest;
}
