package com.trainingplan.generator.progression;

import com.trainingplan.generator.model.ExperienceLevel;
import com.trainingplan.generator.model.RaceDistance;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for VolumeProgressor.
 */
class VolumeProgressorTest {

    private VolumeProgressor progressor;

    @BeforeEach
    void setUp() {
        progressor = new VolumeProgressor();
    }

    @ParameterizedTest
    @CsvSource({
            "1, 4, false",
            "3, 3, true",
            "4, 4, true",
            "6, 3, true",
            "6, 4, false",
            "8, 4, true"
    })
    void testIsDeloadWeek(int week, int cadence, boolean expected) {
        assertThat(VolumeProgressor.isDeloadWeek(week, cadence)).isEqualTo(expected);
    }

    @Test
    void testWeekOneIsNeverDeload() {
        assertThat(VolumeProgressor.isDeloadWeek(1, 1)).isFalse();
    }

    @Test
    void testTenKIntermediateSequence() {
        List<WeeklyVolume> volumes = progressor.calculateWeeklyVolumes(RaceDistance.TEN_K, 8, 4,
                ExperienceLevel.INTERMEDIATE);

        assertThat(volumes).extracting(WeeklyVolume::getAdjustedVolume)
                .containsExactly(40, 43, 46, 35, 46, 50, 54, 41);
        assertThat(volumes).extracting(WeeklyVolume::isDeloadWeek)
                .containsExactly(false, false, false, true, false, false, false, true);
        assertThat(volumes.get(4).getNotes()).contains("Returning to pre-deload volume of 46 km");
    }

    @ParameterizedTest
    @EnumSource(RaceDistance.class)
    void testNonDeloadWeeksNeverIncreaseMoreThanTenPercent(RaceDistance race) {
        for (ExperienceLevel level : ExperienceLevel.values()) {
            for (int cadence = 3; cadence <= 4; cadence++) {
                List<WeeklyVolume> volumes = progressor.calculateWeeklyVolumes(race, 24, cadence, level);

                assertThat(volumes).hasSize(24);
                assertThat(volumes.get(0).getAdjustedVolume()).isEqualTo(progressor.startingVolume(race, level));
                for (int i = 1; i < volumes.size(); i++) {
                    WeeklyVolume previous = volumes.get(i - 1);
                    WeeklyVolume current = volumes.get(i);
                    assertThat(current.getAdjustedVolume()).isLessThanOrEqualTo(progressor.maximumVolume(race, level));
                    if (!previous.isDeloadWeek() && !current.isDeloadWeek()) {
                        assertThat(current.getAdjustedVolume())
                                .isLessThanOrEqualTo((int) Math.floor(previous.getAdjustedVolume() * 1.10));
                    }
                }
                assertThat(progressor.validate(volumes).isValid()).isTrue();
            }
        }
    }

    @Test
    void testDeloadWeeksReduceTwentyToThirtyPercent() {
        List<WeeklyVolume> volumes = progressor.calculateWeeklyVolumes(RaceDistance.MARATHON, 18, 3,
                ExperienceLevel.ADVANCED);

        for (WeeklyVolume volume : volumes) {
            if (volume.isDeloadWeek()) {
                double reduction = 1 - volume.getAdjustedVolume() / volume.getBaseVolume();
                assertThat(reduction).isBetween(0.19, 0.31);
                assertThat(volume.getProgressionRate()).isNegative();
            }
        }
    }

    @Test
    void testVolumeCappedAtMaximum() {
        List<WeeklyVolume> volumes = progressor.calculateWeeklyVolumes(RaceDistance.FIVE_K, 24, 4,
                ExperienceLevel.BEGINNER);

        assertThat(volumes).allSatisfy(v -> assertThat(v.getAdjustedVolume()).isLessThanOrEqualTo(56));
        assertThat(volumes).anySatisfy(v -> assertThat(v.getNotes()).contains("Volume capped at 56 km for safety"));
    }

    @Test
    void testDeloadVolume() {
        assertThat(progressor.deloadVolume(40, null)).isEqualTo(30);
        assertThat(progressor.deloadVolume(40, 0.2)).isEqualTo(32);
        assertThat(VolumeProgressor.defaultDeloadReduction()).isCloseTo(0.25, within(1e-9));
    }

    @Test
    void testValidateFlagsSteepIncrease() {
        List<WeeklyVolume> volumes = List.of(
                WeeklyVolume.builder().weekNumber(1).baseVolume(40).adjustedVolume(40).build(),
                WeeklyVolume.builder().weekNumber(2).baseVolume(40).adjustedVolume(50).build());

        ProgressionValidation validation = progressor.validate(volumes);

        assertThat(validation.isValid()).isFalse();
        assertThat(validation.getWarnings())
                .contains("Week 2: 25% increase exceeds 10% safety limit",
                        "Week 2: 25% increase is aggressive - monitor recovery");
    }

    @Test
    void testInvalidCadence() {
        assertThatThrownBy(() -> VolumeProgressor.isDeloadWeek(2, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
