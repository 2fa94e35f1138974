package com.trainingplan.generator.model;

import java.util.Arrays;
import java.util.Optional;

import lombok.Getter;

/**
 * Supported target race distances with their program-length guidance.
 */
@Getter
public enum RaceDistance {

    FIVE_K("5K", 5000, 6, 8, 12, "Fast-paced race focusing on speed and VO2 max"),
    TEN_K("10K", 10000, 8, 10, 16, "Balance of speed and endurance"),
    HALF_MARATHON("Half Marathon", 21097, 10, 12, 20, "Endurance race with lactate threshold focus"),
    MARATHON("Marathon", 42195, 12, 16, 24, "Ultimate endurance challenge");

    private final String label;
    private final int meters;

    /**
     * Shortest program that still counts as adequate preparation.
     */
    private final int recommendedMinimumWeeks;

    private final int optimalWeeks;
    private final int maximumWeeks;
    private final String description;

    RaceDistance(String label, int meters, int recommendedMinimumWeeks, int optimalWeeks,
                 int maximumWeeks, String description) {
        this.label = label;
        this.meters = meters;
        this.recommendedMinimumWeeks = recommendedMinimumWeeks;
        this.optimalWeeks = optimalWeeks;
        this.maximumWeeks = maximumWeeks;
        this.description = description;
    }

    /**
     * Resolves a race distance from its display label ("Half Marathon") or enum name ("HALF_MARATHON").
     */
    public static Optional<RaceDistance> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(r -> r.label.equalsIgnoreCase(trimmed) || r.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }

    @Override
    public String toString() {
        return label;
    }
}
