package com.trainingplan.generator.model;

import lombok.Getter;

/**
 * Heart-rate training zones.
 */
@Getter
public enum IntensityZone {

    ZONE_1("Recovery", 50, 60, "Very Easy"),
    ZONE_2("Aerobic Base", 60, 70, "Easy"),
    ZONE_3("Aerobic Threshold", 70, 80, "Moderate"),
    ZONE_4("Lactate Threshold", 80, 90, "Hard"),
    ZONE_5("VO2 Max", 90, 100, "Very Hard");

    private final String zoneName;
    private final int minHeartRatePercent;
    private final int maxHeartRatePercent;
    private final String effortLevel;

    IntensityZone(String zoneName, int minHeartRatePercent, int maxHeartRatePercent, String effortLevel) {
        this.zoneName = zoneName;
        this.minHeartRatePercent = minHeartRatePercent;
        this.maxHeartRatePercent = maxHeartRatePercent;
        this.effortLevel = effortLevel;
    }

    public int number() {
        return ordinal() + 1;
    }

    /**
     * One zone easier, never below zone 1.
     */
    public IntensityZone easier() {
        return this == ZONE_1 ? ZONE_1 : values()[ordinal() - 1];
    }
}
