package com.trainingplan.generator.plan;

import com.trainingplan.generator.deload.DeloadScheduler;
import com.trainingplan.generator.deload.DeloadWorkoutModification;
import com.trainingplan.generator.generator.PlanGenerationOptions;
import com.trainingplan.generator.generator.PlanGenerator;
import com.trainingplan.generator.model.IntensityZone;
import com.trainingplan.generator.model.RaceDistance;
import com.trainingplan.generator.model.WorkoutType;
import com.trainingplan.generator.scheduling.DailyWorkout;
import com.trainingplan.generator.validation.ConfigurationValidator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PlanStatisticsCalculator.
 */
class PlanStatisticsCalculatorTest {

    private PlanStatisticsCalculator calculator;
    private TrainingPlan plan;

    @BeforeEach
    void setUp() {
        calculator = new PlanStatisticsCalculator();
        plan = new PlanGenerator()
                .generatePlan(ConfigurationValidator.defaultConfiguration(RaceDistance.TEN_K).toBuilder()
                                .programLength(8)
                                .build(),
                        PlanGenerationOptions.builder().skipDeload(true).build())
                .getPlan();
    }

    @Test
    void testCalculate() {
        PlanStatistics statistics = calculator.calculate(plan);

        double weeklyTotal = plan.getWeeks().stream().mapToDouble(WeeklyPlan::getDistanceKm).sum();
        assertThat(statistics.getTotalEasyKm() + statistics.getTotalQualityKm() + statistics.getTotalLongRunKm())
                .isCloseTo(weeklyTotal, within(0.5));
        assertThat(statistics.getAverageWeeklyKm()).isCloseTo(weeklyTotal / 8, within(0.05));
        assertThat(statistics.getPeakWeeklyKm())
                .isEqualTo(plan.getWeeks().stream().mapToDouble(WeeklyPlan::getDistanceKm).max().orElseThrow());
        assertThat(statistics.getLongestRunKm())
                .isEqualTo(plan.getWeeks().stream()
                        .mapToDouble(w -> w.day(DayOfWeek.SUNDAY).getWorkout().getDistanceKm())
                        .max().orElseThrow());
        assertThat(statistics.getAverageWorkoutsPerWeek()).isEqualTo(4.0);
        assertThat(statistics.getDeloadWeekCount()).isZero();
    }

    @Test
    void testAverageProgressionRate() {
        PlanStatistics statistics = calculator.calculate(plan);

        double expected = 0;
        List<WeeklyPlan> weeks = plan.getWeeks();
        for (int i = 1; i < weeks.size(); i++) {
            double previous = weeks.get(i - 1).getDistanceKm();
            expected += (weeks.get(i).getDistanceKm() - previous) / previous * 100;
        }
        assertThat(statistics.getAverageProgressionRate()).isCloseTo(expected / 7, within(1e-9));
    }

    @Test
    void testEmptyPlan() {
        TrainingPlan empty = plan.toBuilder()
                .weeks(List.of())
                .metadata(PlanMetadata.builder()
                        .createdAt(Instant.now())
                        .workoutTypeDistribution(new WorkoutTypeDistribution(0, 0, 0, 0))
                        .phaseDistribution(new PhaseDistribution(0, 0, 0, 0))
                        .build())
                .build();

        PlanStatistics statistics = calculator.calculate(empty);

        assertThat(statistics.getAverageWeeklyKm()).isZero();
        assertThat(statistics.getDeloadWeekCount()).isZero();
    }

    @Test
    void testWeeklyStatistics() {
        WeeklyStatistics statistics = calculator.weeklyStatistics(plan.week(1));

        assertThat(statistics.getWeekNumber()).isEqualTo(1);
        assertThat(statistics.getWorkoutBreakdown())
                .containsEntry(WorkoutType.EASY, 2)
                .containsEntry(WorkoutType.LONG, 1)
                .containsEntry(WorkoutType.QUALITY, 1)
                .containsEntry(WorkoutType.REST, 3);
        assertThat(statistics.getIntensityDistribution())
                .containsEntry(IntensityZone.ZONE_2, 75)
                .containsEntry(IntensityZone.ZONE_3, 25)
                .containsEntry(IntensityZone.ZONE_4, 0)
                .hasSize(IntensityZone.values().length);
    }

    @Test
    void testWeeklyStatisticsUseDeloadAdjustedDays() {
        WeeklyPlan week = plan.week(1);
        List<DeloadWorkoutModification> modifications = new DeloadScheduler()
                .modifyWorkoutsForDeload(week.getDays(), 0.20, new AlwaysSkip());
        WeeklyPlan deload = week.toBuilder().deloadWeek(true).deloadModifications(modifications).build();

        WeeklyStatistics statistics = calculator.weeklyStatistics(deload);

        assertThat(statistics.getWorkoutBreakdown())
                .containsEntry(WorkoutType.QUALITY, 0)
                .containsEntry(WorkoutType.REST, 4);
        assertThat(statistics.getIntensityDistribution()).containsEntry(IntensityZone.ZONE_2, 100);

        List<DailyWorkout> effective = deload.effectiveDays();
        assertThat(effective).hasSize(7);
        assertThat(effective.get(DayOfWeek.TUESDAY.ordinal()).isTraining()).isFalse();
        assertThat(effective.get(DayOfWeek.SUNDAY.ordinal()).getWorkout().getDistanceKm())
                .isLessThan(week.day(DayOfWeek.SUNDAY).getWorkout().getDistanceKm());
    }

    private static final class AlwaysSkip extends Random {
        private static final long serialVersionUID = 1L;

        @Override
        public double nextDouble() {
            return 0.0;
        }
    }
}
