package com.trainingplan.generator.distribution;

import com.trainingplan.generator.model.IntensityZone;
import com.trainingplan.generator.model.PaceMethod;
import com.trainingplan.generator.model.PlanConfiguration;
import com.trainingplan.generator.model.RaceDistance;
import com.trainingplan.generator.model.TrainingPhase;
import com.trainingplan.generator.model.WorkoutType;
import com.trainingplan.generator.validation.ConfigurationValidator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for WorkoutDistributor.
 */
class WorkoutDistributorTest {

    private WorkoutDistributor distributor;

    @BeforeEach
    void setUp() {
        distributor = new WorkoutDistributor();
    }

    @ParameterizedTest
    @ValueSource(ints = {3, 4, 5, 6, 7})
    void testTemplateHasOneLongAndOneQuality(int days) {
        List<WorkoutType> template = WorkoutDistributor.template(days);

        assertThat(template).hasSize(days);
        assertThat(template).filteredOn(t -> t == WorkoutType.LONG).hasSize(1);
        assertThat(template).filteredOn(t -> t == WorkoutType.QUALITY).hasSize(1);
        assertThat(template).filteredOn(t -> t == WorkoutType.EASY).hasSize(days - 2);
        assertThat(template).doesNotContain(WorkoutType.REST);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 2, 8})
    void testTemplateRejectsInvalidDayCounts(int days) {
        assertThatThrownBy(() -> WorkoutDistributor.template(days))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid training days per week: " + days + ". Must be between 3-7.");
    }

    @Test
    void testWorkoutDistances() {
        Map<WorkoutType, Double> distances = distributor.workoutDistances(RaceDistance.TEN_K, 40, 4);

        assertThat(distances.get(WorkoutType.EASY)).isEqualTo(12.0);
        assertThat(distances.get(WorkoutType.LONG)).isEqualTo(22.0);
        assertThat(distances.get(WorkoutType.QUALITY)).isEqualTo(10.0);
        assertThat(distances.get(WorkoutType.REST)).isEqualTo(0.0);
    }

    @Test
    void testWorkoutDistancesRaisedToMinimums() {
        Map<WorkoutType, Double> distances = distributor.workoutDistances(RaceDistance.FIVE_K, 6, 3);

        assertThat(distances.get(WorkoutType.EASY)).isEqualTo(3.0);
        assertThat(distances.get(WorkoutType.LONG)).isEqualTo(8.0);
        assertThat(distances.get(WorkoutType.QUALITY)).isEqualTo(4.0);
    }

    @Test
    void testDistributeBuildsTemplateWorkouts() {
        PlanConfiguration config = ConfigurationValidator.defaultConfiguration(RaceDistance.TEN_K);

        WeeklyWorkoutDistribution distribution = distributor.distribute(config, 40, TrainingPhase.BASE);

        assertThat(distribution.getTrainingDays()).isEqualTo(4);
        assertThat(distribution.getWorkouts()).extracting(Workout::getType)
                .containsExactly(WorkoutType.EASY, WorkoutType.QUALITY, WorkoutType.EASY, WorkoutType.LONG);
        assertThat(distribution.getCounts().getEasy()).isEqualTo(2);
        assertThat(distribution.getCounts().getLongRuns()).isEqualTo(1);
        assertThat(distribution.getCounts().getQuality()).isEqualTo(1);
        assertThat(distribution.getCounts().getRest()).isEqualTo(3);

        Workout longRun = distribution.workoutsOfType(WorkoutType.LONG).get(0);
        assertThat(longRun.getDistanceKm()).isEqualTo(22.0);
        assertThat(longRun.getDurationMinutes()).isEqualTo(143);
        assertThat(longRun.getIntensity()).isEqualTo(IntensityZone.ZONE_2);
        assertThat(longRun.getDescription()).isEqualTo("Long run - 22 km at steady, comfortable effort");

        Workout quality = distribution.workoutsOfType(WorkoutType.QUALITY).get(0);
        assertThat(quality.getDurationMinutes()).isEqualTo(50);
        assertThat(quality.getIntensity()).isEqualTo(IntensityZone.ZONE_4);
        assertThat(quality.getDescription()).startsWith("Tempo run - 10 km");
    }

    @Test
    void testPhaseOnlyChangesQualityWording() {
        PlanConfiguration config = ConfigurationValidator.defaultConfiguration(RaceDistance.TEN_K);

        WeeklyWorkoutDistribution base = distributor.distribute(config, 40, TrainingPhase.BASE);
        WeeklyWorkoutDistribution taper = distributor.distribute(config, 40, TrainingPhase.TAPER);

        assertThat(taper.getWorkouts()).extracting(Workout::getDistanceKm)
                .isEqualTo(base.getWorkouts().stream().map(Workout::getDistanceKm).toList());
        assertThat(taper.workoutsOfType(WorkoutType.EASY)).isEqualTo(base.workoutsOfType(WorkoutType.EASY));
        assertThat(taper.workoutsOfType(WorkoutType.QUALITY).get(0).getDescription()).startsWith("Sharpening workout");
    }

    @Test
    void testPaceMethodNoteAppended() {
        PlanConfiguration config = ConfigurationValidator.defaultConfiguration(RaceDistance.TEN_K).toBuilder()
                .paceMethod(PaceMethod.TIME_TRIAL)
                .build();

        WeeklyWorkoutDistribution distribution = distributor.distribute(config, 40, TrainingPhase.BUILD);

        assertThat(distribution.getWorkouts())
                .allSatisfy(w -> assertThat(w.getPaceGuidance()).endsWith(PaceMethod.TIME_TRIAL.guidanceNote()));
    }

    @Test
    void testValidateFourDayWeek() {
        PlanConfiguration config = ConfigurationValidator.defaultConfiguration(RaceDistance.TEN_K);

        DistributionValidation validation = distributor.validate(distributor.distribute(config, 40, TrainingPhase.BASE));

        assertThat(validation.isValid()).isTrue();
        assertThat(validation.getWarnings()).containsExactly("Consider more easy runs to follow the 80/20 training principle");
    }

    @Test
    void testValidateSevenDayWeekWarnsAboutRest() {
        PlanConfiguration config = ConfigurationValidator.defaultConfiguration(RaceDistance.MARATHON).toBuilder()
                .trainingDaysPerWeek(7)
                .restDays(List.of())
                .build();

        DistributionValidation validation = distributor.validate(distributor.distribute(config, 70, TrainingPhase.PEAK));

        assertThat(validation.isValid()).isTrue();
        assertThat(validation.getWarnings()).contains("No rest days scheduled - recovery is essential for adaptation");
        assertThat(validation.getRecommendations()).contains("Include at least 1 rest day per week");
    }
}
