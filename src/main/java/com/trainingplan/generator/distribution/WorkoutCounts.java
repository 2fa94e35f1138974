package com.trainingplan.generator.distribution;

import lombok.Value;

/**
 * Number of sessions per category in one week. The four counts add up to seven.
 */
@Value
public class WorkoutCounts {
    int easy;
    int longRuns;
    int quality;
    int rest;

    public int trainingSessions() {
        return easy + longRuns + quality;
    }
}
