package com.trainingplan.generator.model;

import java.util.Locale;

import lombok.Getter;

/**
 * Quality workout sub-types, declared in rotation order.
 */
@Getter
public enum QualityWorkoutType {

    TEMPO("Tempo Run", "Comfortably hard sustained effort",
            IntensityZone.ZONE_3, 48, "Lactate threshold development"),
    THRESHOLD("Threshold Intervals", "Broken lactate threshold efforts with short recoveries",
            IntensityZone.ZONE_3, 42, "Lactate threshold power and buffering"),
    INTERVALS("Interval Training", "High-intensity intervals with recovery",
            IntensityZone.ZONE_4, 48, "VO2 max and speed development"),
    HILLS("Hill Repeats", "Uphill intervals for strength and power",
            IntensityZone.ZONE_4, 48, "Strength, power, and running economy"),
    FARTLEK("Fartlek Training", "Unstructured speed play with varied pace",
            IntensityZone.ZONE_3, 36, "Speed development and mental adaptability");

    private final String workoutName;
    private final String description;
    private final IntensityZone zone;
    private final int recoveryHours;
    private final String purpose;

    QualityWorkoutType(String workoutName, String description, IntensityZone zone,
                       int recoveryHours, String purpose) {
        this.workoutName = workoutName;
        this.description = description;
        this.zone = zone;
        this.recoveryHours = recoveryHours;
        this.purpose = purpose;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
