package com.trainingplan.generator.progression;

import java.util.Map;

import com.trainingplan.generator.model.ExperienceLevel;

import lombok.Value;

/**
 * Progression guidance for a race distance.
 */
@Value
public class ProgressionRecommendations {
    int minimumWeeks;
    int recommendedWeeks;
    int maximumWeeks;
    Map<ExperienceLevel, Integer> startingVolume;
    Map<ExperienceLevel, Integer> maximumVolume;
    int recommendedDeloadFrequency;
    double safeProgressionRate;
    double maxProgressionRate;
}
