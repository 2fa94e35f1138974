package com.trainingplan.generator.validation;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trainingplan.generator.model.DifficultyLevel;
import com.trainingplan.generator.model.ExperienceLevel;
import com.trainingplan.generator.model.PlanConfiguration;
import com.trainingplan.generator.model.RaceDistance;
import com.trainingplan.generator.model.Severity;
import com.trainingplan.generator.util.DayOfWeekUtil;

/**
 * Checks a plan configuration for internal consistency and physiological soundness.
 *
 * Every check runs regardless of earlier failures so the caller sees all problems at once.
 */
public class ConfigurationValidator {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationValidator.class);

    public static final int MIN_PROGRAM_WEEKS = 6;
    public static final int MAX_PROGRAM_WEEKS = 24;
    public static final int MIN_TRAINING_DAYS = 3;
    public static final int MAX_TRAINING_DAYS = 7;
    public static final int RECOMMENDED_TRAINING_DAYS = 5;

    public ValidationResult validate(PlanConfiguration config) {
        ValidationResult.ValidationResultBuilder result = ValidationResult.builder();

        validateRaceDistance(config, result);
        validateProgramLength(config, result);
        validateTrainingDays(config, result);
        validateRestDays(config, result);
        validateLongRunDay(config, result);
        validateDeloadFrequency(config, result);
        crossValidate(config, result);

        ValidationResult built = result.build();
        log.debug("Configuration validated: {} error(s), {} warning(s)",
                built.getErrors().size(), built.getWarnings().size());
        return built;
    }

    /**
     * Textual improvement suggestions: high-severity warnings first, then general advice.
     */
    public List<String> suggestImprovements(PlanConfiguration config) {
        List<String> suggestions = new ArrayList<>();
        validate(config).getWarnings().stream()
                .filter(w -> w.getSeverity() == Severity.HIGH)
                .forEach(w -> suggestions.add(w.getMessage()));

        if (config.getTrainingDaysPerWeek() == MIN_TRAINING_DAYS) {
            suggestions.add("Consider increasing to 4-5 training days per week for better fitness gains.");
        }
        if (config.getLongRunDay() != null && !DayOfWeekUtil.isWeekend(config.getLongRunDay())) {
            suggestions.add("Schedule long runs on weekends for better recovery and time availability.");
        }
        RaceDistance race = config.getRaceDistance();
        if (race != null && config.getProgramLength() < race.getOptimalWeeks()) {
            suggestions.add("Consider extending to " + race.getOptimalWeeks() + " weeks for optimal "
                    + race.getLabel() + " preparation.");
        }
        return suggestions;
    }

    /**
     * Sensible starting configuration: optimal length, four days, rest Monday/Wednesday/Friday, long run Sunday.
     */
    public static PlanConfiguration defaultConfiguration(RaceDistance race) {
        return PlanConfiguration.builder()
                .raceDistance(race)
                .programLength(race.getOptimalWeeks())
                .trainingDaysPerWeek(4)
                .restDays(List.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY, DayOfWeek.FRIDAY))
                .longRunDay(DayOfWeek.SUNDAY)
                .deloadFrequency(4)
                .experience(ExperienceLevel.INTERMEDIATE)
                .difficulty(DifficultyLevel.MODERATE)
                .build();
    }

    private static void validateRaceDistance(PlanConfiguration config, ValidationResult.ValidationResultBuilder result) {
        if (config.getRaceDistance() == null) {
            result.error(new ValidationError("INVALID_RACE_DISTANCE", "raceDistance",
                    "Invalid race distance. Must be 5K, 10K, Half Marathon, or Marathon."));
        }
    }

    private static void validateProgramLength(PlanConfiguration config, ValidationResult.ValidationResultBuilder result) {
        int weeks = config.getProgramLength();
        if (weeks < MIN_PROGRAM_WEEKS) {
            result.error(new ValidationError("PROGRAM_TOO_SHORT", "programLength",
                    "Program length must be at least " + MIN_PROGRAM_WEEKS + " weeks."));
        }
        if (weeks > MAX_PROGRAM_WEEKS) {
            result.error(new ValidationError("PROGRAM_TOO_LONG", "programLength",
                    "Program length cannot exceed " + MAX_PROGRAM_WEEKS + " weeks."));
        }

        RaceDistance race = config.getRaceDistance();
        if (race == null) {
            return;
        }
        if (weeks >= MIN_PROGRAM_WEEKS && weeks < race.getRecommendedMinimumWeeks()) {
            result.warning(new ValidationWarning("SUBOPTIMAL_PROGRAM_LENGTH", "programLength",
                    "For " + race.getLabel() + ", we recommend at least " + race.getRecommendedMinimumWeeks()
                            + " weeks for optimal preparation.",
                    Severity.HIGH));
        }
        if (weeks != race.getOptimalWeeks()) {
            result.warning(new ValidationWarning("NON_OPTIMAL_LENGTH", "programLength",
                    "For " + race.getLabel() + ", the optimal program length is " + race.getOptimalWeeks() + " weeks.",
                    Severity.LOW));
        }
    }

    private static void validateTrainingDays(PlanConfiguration config, ValidationResult.ValidationResultBuilder result) {
        int days = config.getTrainingDaysPerWeek();
        if (days < MIN_TRAINING_DAYS) {
            result.error(new ValidationError("TOO_FEW_TRAINING_DAYS", "trainingDaysPerWeek",
                    "Training days per week must be at least " + MIN_TRAINING_DAYS + "."));
        }
        if (days > MAX_TRAINING_DAYS) {
            result.error(new ValidationError("TOO_MANY_TRAINING_DAYS", "trainingDaysPerWeek",
                    "Training days per week cannot exceed " + MAX_TRAINING_DAYS + "."));
        }
        if (days == MIN_TRAINING_DAYS) {
            result.warning(new ValidationWarning("LIMITED_TRAINING_FREQUENCY", "trainingDaysPerWeek",
                    "Training only 3 days per week may limit your progress. Consider 4-5 days for better results.",
                    Severity.MEDIUM));
        }
        if (days >= 6 && days <= MAX_TRAINING_DAYS) {
            result.warning(new ValidationWarning("HIGH_TRAINING_FREQUENCY", "trainingDaysPerWeek",
                    "Training 6+ days per week increases injury risk. Ensure adequate recovery.",
                    Severity.HIGH));
        }
    }

    private static void validateRestDays(PlanConfiguration config, ValidationResult.ValidationResultBuilder result) {
        List<DayOfWeek> restDays = config.getRestDays();
        int trainingDays = config.getTrainingDaysPerWeek();
        int expected = 7 - trainingDays;

        if (restDays.size() != expected) {
            result.error(new ValidationError("INCORRECT_REST_DAYS_COUNT", "restDays",
                    "Expected " + expected + " rest days for " + trainingDays + " training days per week, but got "
                            + restDays.size() + "."));
        }

        long invalid = restDays.stream().filter(d -> d == null).count();
        if (invalid > 0) {
            result.error(new ValidationError("INVALID_DAY_NAMES", "restDays",
                    "Invalid day names: " + invalid + " unset entr" + (invalid == 1 ? "y" : "ies")
                            + ". Must be valid day names."));
        }

        Set<DayOfWeek> distinct = new HashSet<>();
        boolean duplicates = false;
        for (DayOfWeek day : restDays) {
            if (day != null && !distinct.add(day)) {
                duplicates = true;
            }
        }
        if (duplicates) {
            result.error(new ValidationError("DUPLICATE_REST_DAYS", "restDays",
                    "Rest days cannot contain duplicates."));
        }

        int available = 7 - distinct.size();
        if (trainingDays >= MIN_TRAINING_DAYS && trainingDays <= MAX_TRAINING_DAYS && available < trainingDays) {
            result.error(new ValidationError("NOT_ENOUGH_AVAILABLE_DAYS", "restDays",
                    "Not enough available days: " + available + " available, " + trainingDays + " required"));
        }

        if (DayOfWeekUtil.hasConsecutiveDays(distinct)) {
            result.warning(new ValidationWarning("CONSECUTIVE_REST_DAYS", "restDays",
                    "Consecutive rest days may disrupt training rhythm. Consider spreading them out.",
                    Severity.MEDIUM));
        }
    }

    private static void validateLongRunDay(PlanConfiguration config, ValidationResult.ValidationResultBuilder result) {
        DayOfWeek longRunDay = config.getLongRunDay();
        if (longRunDay == null) {
            result.error(new ValidationError("INVALID_LONG_RUN_DAY", "longRunDay",
                    "Invalid long run day. Must be a valid day of the week."));
            return;
        }
        if (config.getRestDays().contains(longRunDay)) {
            result.error(new ValidationError("LONG_RUN_ON_REST_DAY", "longRunDay",
                    "Long run day cannot be a rest day."));
        }
        if (!DayOfWeekUtil.isWeekend(longRunDay)) {
            result.warning(new ValidationWarning("NON_WEEKEND_LONG_RUN", "longRunDay",
                    "Long runs are typically scheduled on weekends for better recovery.",
                    Severity.LOW));
        }
    }

    private static void validateDeloadFrequency(PlanConfiguration config, ValidationResult.ValidationResultBuilder result) {
        int cadence = config.getDeloadFrequency();
        if (cadence != 3 && cadence != 4) {
            result.error(new ValidationError("INVALID_DELOAD_FREQUENCY", "deloadFrequency",
                    "Deload frequency must be either 3 or 4 weeks."));
            return;
        }
        if (config.getProgramLength() < cadence + 2) {
            result.warning(new ValidationWarning("SHORT_PROGRAM_DELOAD", "deloadFrequency",
                    "Program may be too short for effective deload scheduling with " + cadence + "-week frequency.",
                    Severity.LOW));
        }
    }

    private static void crossValidate(PlanConfiguration config, ValidationResult.ValidationResultBuilder result) {
        RaceDistance race = config.getRaceDistance();
        int weeks = config.getProgramLength();

        if (race == RaceDistance.MARATHON && weeks < 12) {
            result.warning(new ValidationWarning("RISKY_MARATHON_PREPARATION", "programLength",
                    "Marathon training with less than 12 weeks significantly increases injury risk.",
                    Severity.HIGH));
        }
        if (config.getTrainingDaysPerWeek() >= 6 && weeks < 8) {
            result.warning(new ValidationWarning("HIGH_INTENSITY_SHORT_PROGRAM", "trainingDaysPerWeek",
                    "High training frequency with short program duration may lead to overtraining.",
                    Severity.HIGH));
        }
        if (race == RaceDistance.FIVE_K && weeks > 16) {
            result.warning(new ValidationWarning("EXCESSIVE_5K_PROGRAM", "programLength",
                    "5K training programs longer than 16 weeks may lead to staleness.",
                    Severity.MEDIUM));
        }
    }
}
