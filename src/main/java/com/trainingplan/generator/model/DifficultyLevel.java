package com.trainingplan.generator.model;

import lombok.Getter;

/**
 * Requested training load. Carried on the configuration and reported with the plan.
 */
@Getter
public enum DifficultyLevel {

    VERY_EASY("Recovery/Base Building", 0.70, 0.95, 1.50, 0.05),
    EASY("Conservative", 0.85, 0.97, 1.25, 0.07),
    MODERATE("Standard", 1.00, 1.00, 1.00, 0.10),
    HARD("Aggressive", 1.15, 1.02, 0.90, 0.12),
    VERY_HARD("Advanced/Competitive", 1.30, 1.03, 0.80, 0.15);

    private final String label;
    private final double volumeAdjustment;
    private final double intensityAdjustment;
    private final double recoveryMultiplier;
    private final double progressionRate;

    DifficultyLevel(String label, double volumeAdjustment, double intensityAdjustment,
                    double recoveryMultiplier, double progressionRate) {
        this.label = label;
        this.volumeAdjustment = volumeAdjustment;
        this.intensityAdjustment = intensityAdjustment;
        this.recoveryMultiplier = recoveryMultiplier;
        this.progressionRate = progressionRate;
    }
}
