package com.trainingplan.generator.periodization;

import com.trainingplan.generator.model.RaceDistance;
import com.trainingplan.generator.model.TrainingPhase;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PhasePeriodizer.
 */
class PhasePeriodizerTest {

    private PhasePeriodizer periodizer;

    @BeforeEach
    void setUp() {
        periodizer = new PhasePeriodizer();
    }

    @ParameterizedTest
    @EnumSource(RaceDistance.class)
    void testPhasesCoverProgramContiguously(RaceDistance race) {
        for (int weeks = 6; weeks <= 24; weeks++) {
            PhasePeriodization periodization = periodizer.periodize(weeks, race);
            List<PhaseConfiguration> phases = periodization.getPhases();

            assertThat(phases).extracting(PhaseConfiguration::getPhase)
                    .containsExactly(TrainingPhase.BASE, TrainingPhase.BUILD, TrainingPhase.PEAK, TrainingPhase.TAPER);
            assertThat(phases.stream().mapToInt(PhaseConfiguration::getDurationWeeks).sum()).isEqualTo(weeks);
            assertThat(phases.get(0).getStartWeek()).isEqualTo(1);
            assertThat(phases.get(3).getEndWeek()).isEqualTo(weeks);
            for (int i = 1; i < phases.size(); i++) {
                assertThat(phases.get(i).getStartWeek()).isEqualTo(phases.get(i - 1).getEndWeek() + 1);
            }
            for (PhaseConfiguration phase : phases) {
                assertThat(phase.getDurationWeeks()).isGreaterThanOrEqualTo(1);
                assertThat(phase.getEndWeek() - phase.getStartWeek() + 1).isEqualTo(phase.getDurationWeeks());
            }
        }
    }

    @ParameterizedTest
    @EnumSource(RaceDistance.class)
    void testPhaseMinimumsHeldWhenProgramIsLongEnough(RaceDistance race) {
        for (int weeks = PhasePeriodizer.totalMinimumWeeks(); weeks <= 24; weeks++) {
            PhasePeriodization periodization = periodizer.periodize(weeks, race);

            for (PhaseConfiguration phase : periodization.getPhases()) {
                assertThat(phase.getDurationWeeks())
                        .as("%s %d weeks, %s", race, weeks, phase.getPhase())
                        .isGreaterThanOrEqualTo(PhasePeriodizer.minimumWeeks(phase.getPhase()));
            }
            assertThat(periodizer.validate(periodization).isValid()).isTrue();
        }
    }

    @ParameterizedTest
    @CsvSource({
            "TEN_K, 8, 2, 4, 1, 1",
            "TEN_K, 12, 4, 5, 2, 1",
            "MARATHON, 16, 8, 4, 3, 1",
            "FIVE_K, 9, 3, 3, 2, 1"
    })
    void testPhaseDurations(RaceDistance race, int weeks, int base, int build, int peak, int taper) {
        PhasePeriodization periodization = periodizer.periodize(weeks, race);

        assertThat(periodization.durationOf(TrainingPhase.BASE)).isEqualTo(base);
        assertThat(periodization.durationOf(TrainingPhase.BUILD)).isEqualTo(build);
        assertThat(periodization.durationOf(TrainingPhase.PEAK)).isEqualTo(peak);
        assertThat(periodization.durationOf(TrainingPhase.TAPER)).isEqualTo(taper);
    }

    @Test
    void testPhaseForWeek() {
        PhasePeriodization periodization = periodizer.periodize(8, RaceDistance.TEN_K);

        assertThat(periodizer.phaseForWeek(1, periodization)).isEqualTo(TrainingPhase.BASE);
        assertThat(periodizer.phaseForWeek(2, periodization)).isEqualTo(TrainingPhase.BASE);
        assertThat(periodizer.phaseForWeek(3, periodization)).isEqualTo(TrainingPhase.BUILD);
        assertThat(periodizer.phaseForWeek(6, periodization)).isEqualTo(TrainingPhase.BUILD);
        assertThat(periodizer.phaseForWeek(7, periodization)).isEqualTo(TrainingPhase.PEAK);
        assertThat(periodizer.phaseForWeek(8, periodization)).isEqualTo(TrainingPhase.TAPER);
    }

    @Test
    void testPhaseForWeekOutsideProgram() {
        PhasePeriodization periodization = periodizer.periodize(8, RaceDistance.TEN_K);

        assertThatThrownBy(() -> periodizer.phaseForWeek(0, periodization))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> periodizer.phaseForWeek(9, periodization))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Week 9");
    }

    @Test
    void testPeriodizeRejectsTooFewWeeks() {
        assertThatThrownBy(() -> periodizer.periodize(3, RaceDistance.FIVE_K))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> periodizer.periodize(8, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testTransitionsFollowPhaseOrder() {
        PhasePeriodization periodization = periodizer.periodize(12, RaceDistance.HALF_MARATHON);

        assertThat(periodization.getTransitions()).hasSize(3);
        PhaseTransition first = periodization.getTransitions().get(0);
        assertThat(first.getFromPhase()).isEqualTo(TrainingPhase.BASE);
        assertThat(first.getToPhase()).isEqualTo(TrainingPhase.BUILD);
        assertThat(first.getTransitionWeek())
                .isEqualTo(periodization.configurationFor(TrainingPhase.BUILD).orElseThrow().getStartWeek());
    }

    @Test
    void testShortProgramValidationWarnings() {
        PeriodizationValidation validation = periodizer.validate(periodizer.periodize(7, RaceDistance.TEN_K));

        assertThat(validation.isValid()).isFalse();
        assertThat(validation.getWarnings()).contains("Program may be too short for optimal adaptation");
        assertThat(validation.getRecommendations()).contains("Consider extending program length for better results");
    }

    @Test
    void testMarathonRecommendations() {
        assertThat(periodizer.recommendations(RaceDistance.MARATHON, 10))
                .contains("Marathon requires extensive base building phase",
                        "Consider longer program for optimal marathon preparation");
        assertThat(periodizer.recommendations(RaceDistance.MARATHON, 16))
                .containsExactly("Marathon requires extensive base building phase");
    }
}
