package com.trainingplan.generator.plan;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.trainingplan.generator.model.IntensityZone;
import com.trainingplan.generator.model.WorkoutType;
import com.trainingplan.generator.scheduling.DailyWorkout;
import com.trainingplan.generator.util.DistanceUtil;

/**
 * Derived figures for a finished plan. Distances come from the effective (deload-adjusted) days.
 */
public class PlanStatisticsCalculator {

    public PlanStatistics calculate(TrainingPlan plan) {
        List<WeeklyPlan> weeks = plan.getWeeks();
        if (weeks.isEmpty()) {
            return PlanStatistics.builder().build();
        }

        double easy = 0;
        double quality = 0;
        double longRuns = 0;
        double longest = 0;
        for (WeeklyPlan week : weeks) {
            for (DailyWorkout day : week.effectiveDays()) {
                if (!day.isTraining()) {
                    continue;
                }
                double distance = day.getWorkout().getDistanceKm();
                switch (day.getWorkout().getType()) {
                    case EASY -> easy += distance;
                    case QUALITY -> quality += distance;
                    case LONG -> {
                        longRuns += distance;
                        longest = Math.max(longest, distance);
                    }
                    default -> {
                    }
                }
            }
        }

        return PlanStatistics.builder()
                .averageWeeklyKm(DistanceUtil.roundOneDecimal(
                        weeks.stream().mapToDouble(WeeklyPlan::getDistanceKm).average().orElse(0)))
                .peakWeeklyKm(weeks.stream().mapToDouble(WeeklyPlan::getDistanceKm).max().orElse(0))
                .totalEasyKm(DistanceUtil.roundOneDecimal(easy))
                .totalQualityKm(DistanceUtil.roundOneDecimal(quality))
                .totalLongRunKm(DistanceUtil.roundOneDecimal(longRuns))
                .longestRunKm(longest)
                .averageWorkoutsPerWeek((double) plan.getMetadata().getTotalWorkouts() / weeks.size())
                .deloadWeekCount((int) weeks.stream().filter(WeeklyPlan::isDeloadWeek).count())
                .averageProgressionRate(progressionRate(weeks))
                .build();
    }

    public WeeklyStatistics weeklyStatistics(WeeklyPlan week) {
        Map<WorkoutType, Integer> breakdown = new EnumMap<>(WorkoutType.class);
        for (WorkoutType type : WorkoutType.values()) {
            breakdown.put(type, 0);
        }
        Map<IntensityZone, Integer> zoneCounts = new EnumMap<>(IntensityZone.class);
        for (IntensityZone zone : IntensityZone.values()) {
            zoneCounts.put(zone, 0);
        }

        int sessions = 0;
        for (DailyWorkout day : week.effectiveDays()) {
            if (day.isTraining()) {
                breakdown.merge(day.getWorkout().getType(), 1, Integer::sum);
                zoneCounts.merge(day.getWorkout().getIntensity(), 1, Integer::sum);
                sessions++;
            } else {
                breakdown.merge(WorkoutType.REST, 1, Integer::sum);
            }
        }

        Map<IntensityZone, Integer> distribution = new EnumMap<>(IntensityZone.class);
        for (Map.Entry<IntensityZone, Integer> entry : zoneCounts.entrySet()) {
            distribution.put(entry.getKey(),
                    sessions == 0 ? 0 : (int) Math.round(entry.getValue() * 100.0 / sessions));
        }

        return new WeeklyStatistics(week.getWeekNumber(), week.getDistanceKm(), week.getDurationMinutes(),
                breakdown, distribution);
    }

    private static double progressionRate(List<WeeklyPlan> weeks) {
        double total = 0;
        int counted = 0;
        for (int i = 1; i < weeks.size(); i++) {
            double previous = weeks.get(i - 1).getDistanceKm();
            if (previous > 0) {
                total += (weeks.get(i).getDistanceKm() - previous) / previous * 100;
                counted++;
            }
        }
        return counted == 0 ? 0 : total / counted;
    }
}
