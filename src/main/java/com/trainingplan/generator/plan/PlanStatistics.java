package com.trainingplan.generator.plan;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PlanStatistics {

    double averageWeeklyKm;

    double peakWeeklyKm;

    double totalEasyKm;

    double totalQualityKm;

    double totalLongRunKm;

    double longestRunKm;

    double averageWorkoutsPerWeek;

    int deloadWeekCount;

    /**
     * Mean week-over-week change of weekly distance, in percent.
     */
    double averageProgressionRate;
}
