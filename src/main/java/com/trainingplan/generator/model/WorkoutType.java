package com.trainingplan.generator.model;

import lombok.Getter;

/**
 * Workout categories used for distribution and scheduling.
 */
@Getter
public enum WorkoutType {

    EASY("Easy Run", IntensityZone.ZONE_2, 0),
    LONG("Long Run", IntensityZone.ZONE_2, 24),
    QUALITY("Quality Workout", IntensityZone.ZONE_4, 48),
    REST("Rest Day", IntensityZone.ZONE_1, 0);

    private final String displayName;
    private final IntensityZone defaultZone;
    private final int recoveryHours;

    WorkoutType(String displayName, IntensityZone defaultZone, int recoveryHours) {
        this.displayName = displayName;
        this.defaultZone = defaultZone;
        this.recoveryHours = recoveryHours;
    }
}
