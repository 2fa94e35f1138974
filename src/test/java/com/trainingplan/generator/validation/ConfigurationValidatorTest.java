package com.trainingplan.generator.validation;

import com.trainingplan.generator.model.PlanConfiguration;
import com.trainingplan.generator.model.RaceDistance;
import com.trainingplan.generator.model.Severity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.DayOfWeek;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ConfigurationValidator.
 */
class ConfigurationValidatorTest {

    private ConfigurationValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ConfigurationValidator();
    }

    @ParameterizedTest
    @EnumSource(RaceDistance.class)
    void testDefaultConfigurationIsValid(RaceDistance race) {
        ValidationResult result = validator.validate(ConfigurationValidator.defaultConfiguration(race));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getErrors()).isEmpty();
    }

    @Test
    void testDefaultConfigurationHasNoWarnings() {
        ValidationResult result = validator.validate(ConfigurationValidator.defaultConfiguration(RaceDistance.TEN_K));

        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void testMissingRaceDistance() {
        PlanConfiguration config = ConfigurationValidator.defaultConfiguration(RaceDistance.TEN_K).toBuilder()
                .raceDistance(null)
                .build();

        ValidationResult result = validator.validate(config);

        assertThat(result.isValid()).isFalse();
        assertThat(result.hasErrorCode("INVALID_RACE_DISTANCE")).isTrue();
    }

    @Test
    void testProgramLengthBounds() {
        PlanConfiguration base = ConfigurationValidator.defaultConfiguration(RaceDistance.TEN_K);

        assertThat(validator.validate(base.toBuilder().programLength(5).build()).hasErrorCode("PROGRAM_TOO_SHORT"))
                .isTrue();
        assertThat(validator.validate(base.toBuilder().programLength(25).build()).hasErrorCode("PROGRAM_TOO_LONG"))
                .isTrue();
        assertThat(validator.validate(base.toBuilder().programLength(6).build()).isValid()).isTrue();
        assertThat(validator.validate(base.toBuilder().programLength(24).build()).isValid()).isTrue();
    }

    @Test
    void testShortProgramWarnings() {
        PlanConfiguration config = ConfigurationValidator.defaultConfiguration(RaceDistance.MARATHON).toBuilder()
                .programLength(10)
                .build();

        ValidationResult result = validator.validate(config);

        assertThat(result.isValid()).isTrue();
        assertThat(result.hasWarningCode("SUBOPTIMAL_PROGRAM_LENGTH")).isTrue();
        assertThat(result.hasWarningCode("NON_OPTIMAL_LENGTH")).isTrue();
        assertThat(result.hasWarningCode("RISKY_MARATHON_PREPARATION")).isTrue();
        assertThat(result.getWarnings())
                .filteredOn(w -> w.getCode().equals("RISKY_MARATHON_PREPARATION"))
                .extracting(ValidationWarning::getSeverity)
                .containsExactly(Severity.HIGH);
    }

    @Test
    void testTrainingDayBounds() {
        PlanConfiguration base = ConfigurationValidator.defaultConfiguration(RaceDistance.TEN_K);

        ValidationResult tooFew = validator.validate(base.toBuilder()
                .trainingDaysPerWeek(2)
                .restDays(List.of(DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY, DayOfWeek.THURSDAY,
                        DayOfWeek.FRIDAY))
                .build());
        assertThat(tooFew.hasErrorCode("TOO_FEW_TRAINING_DAYS")).isTrue();

        ValidationResult tooMany = validator.validate(base.toBuilder()
                .trainingDaysPerWeek(8)
                .restDays(List.of())
                .build());
        assertThat(tooMany.hasErrorCode("TOO_MANY_TRAINING_DAYS")).isTrue();
    }

    @Test
    void testThreeDaysWarnsAboutFrequency() {
        PlanConfiguration config = ConfigurationValidator.defaultConfiguration(RaceDistance.TEN_K).toBuilder()
                .trainingDaysPerWeek(3)
                .restDays(List.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY, DayOfWeek.FRIDAY, DayOfWeek.SATURDAY))
                .build();

        ValidationResult result = validator.validate(config);

        assertThat(result.isValid()).isTrue();
        assertThat(result.hasWarningCode("LIMITED_TRAINING_FREQUENCY")).isTrue();
        assertThat(result.hasWarningCode("CONSECUTIVE_REST_DAYS")).isTrue();
    }

    @Test
    void testRestDayCountMustMatchTrainingDays() {
        PlanConfiguration config = ConfigurationValidator.defaultConfiguration(RaceDistance.TEN_K).toBuilder()
                .restDays(List.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY))
                .build();

        ValidationResult result = validator.validate(config);

        assertThat(result.hasErrorCode("INCORRECT_REST_DAYS_COUNT")).isTrue();
        assertThat(result.errorMessages())
                .contains("Expected 3 rest days for 4 training days per week, but got 2.");
    }

    @Test
    void testDuplicateAndUnsetRestDays() {
        PlanConfiguration config = ConfigurationValidator.defaultConfiguration(RaceDistance.TEN_K).toBuilder()
                .restDays(Arrays.asList(DayOfWeek.MONDAY, DayOfWeek.MONDAY, null))
                .build();

        ValidationResult result = validator.validate(config);

        assertThat(result.hasErrorCode("DUPLICATE_REST_DAYS")).isTrue();
        assertThat(result.hasErrorCode("INVALID_DAY_NAMES")).isTrue();
    }

    @Test
    void testRestDaysLeavingTooFewAvailableDays() {
        PlanConfiguration config = ConfigurationValidator.defaultConfiguration(RaceDistance.TEN_K).toBuilder()
                .trainingDaysPerWeek(6)
                .restDays(List.of(DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY, DayOfWeek.THURSDAY,
                        DayOfWeek.FRIDAY))
                .build();

        ValidationResult result = validator.validate(config);

        assertThat(result.isValid()).isFalse();
        assertThat(result.hasErrorCode("NOT_ENOUGH_AVAILABLE_DAYS")).isTrue();
        assertThat(result.hasErrorCode("INCORRECT_REST_DAYS_COUNT")).isTrue();
    }

    @Test
    void testLongRunDayChecks() {
        PlanConfiguration base = ConfigurationValidator.defaultConfiguration(RaceDistance.TEN_K);

        assertThat(validator.validate(base.toBuilder().longRunDay(null).build())
                .hasErrorCode("INVALID_LONG_RUN_DAY")).isTrue();
        assertThat(validator.validate(base.toBuilder().longRunDay(DayOfWeek.MONDAY).build())
                .hasErrorCode("LONG_RUN_ON_REST_DAY")).isTrue();

        ValidationResult weekday = validator.validate(base.toBuilder().longRunDay(DayOfWeek.THURSDAY).build());
        assertThat(weekday.isValid()).isTrue();
        assertThat(weekday.hasWarningCode("NON_WEEKEND_LONG_RUN")).isTrue();
    }

    @Test
    void testDeloadFrequencyMustBeThreeOrFour() {
        PlanConfiguration base = ConfigurationValidator.defaultConfiguration(RaceDistance.TEN_K);

        assertThat(validator.validate(base.toBuilder().deloadFrequency(2).build())
                .hasErrorCode("INVALID_DELOAD_FREQUENCY")).isTrue();
        assertThat(validator.validate(base.toBuilder().deloadFrequency(3).build()).isValid()).isTrue();
    }

    @Test
    void testAllProblemsReportedAtOnce() {
        PlanConfiguration config = PlanConfiguration.builder()
                .programLength(3)
                .trainingDaysPerWeek(4)
                .restDays(List.of(DayOfWeek.MONDAY))
                .deloadFrequency(5)
                .build();

        ValidationResult result = validator.validate(config);

        assertThat(result.getErrors())
                .extracting(ValidationError::getCode)
                .contains("INVALID_RACE_DISTANCE", "PROGRAM_TOO_SHORT", "INCORRECT_REST_DAYS_COUNT",
                        "INVALID_LONG_RUN_DAY", "INVALID_DELOAD_FREQUENCY");
    }

    @Test
    void testSuggestImprovements() {
        PlanConfiguration config = ConfigurationValidator.defaultConfiguration(RaceDistance.HALF_MARATHON).toBuilder()
                .programLength(8)
                .trainingDaysPerWeek(3)
                .restDays(List.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY, DayOfWeek.FRIDAY, DayOfWeek.SUNDAY))
                .longRunDay(DayOfWeek.SATURDAY)
                .build();

        List<String> suggestions = validator.suggestImprovements(config);

        assertThat(suggestions).contains(
                "For Half Marathon, we recommend at least 10 weeks for optimal preparation.",
                "Consider increasing to 4-5 training days per week for better fitness gains.",
                "Consider extending to 12 weeks for optimal Half Marathon preparation.");
    }
}
