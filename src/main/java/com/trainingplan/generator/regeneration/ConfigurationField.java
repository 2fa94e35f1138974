package com.trainingplan.generator.regeneration;

import java.util.function.Function;

import com.trainingplan.generator.model.PlanConfiguration;
import com.trainingplan.generator.model.Severity;

import lombok.Getter;

/**
 * Configuration fields compared during regeneration, with the impact a change to each has on the plan.
 */
@Getter
public enum ConfigurationField {

    RACE_DISTANCE("raceDistance", Severity.HIGH, PlanConfiguration::getRaceDistance),
    PROGRAM_LENGTH("programLength", Severity.HIGH, PlanConfiguration::getProgramLength),
    TRAINING_DAYS_PER_WEEK("trainingDaysPerWeek", Severity.MEDIUM, PlanConfiguration::getTrainingDaysPerWeek),
    REST_DAYS("restDays", Severity.MEDIUM, PlanConfiguration::getRestDays),
    LONG_RUN_DAY("longRunDay", Severity.MEDIUM, PlanConfiguration::getLongRunDay),
    DELOAD_FREQUENCY("deloadFrequency", Severity.MEDIUM, PlanConfiguration::getDeloadFrequency),
    EXPERIENCE("experience", Severity.MEDIUM, PlanConfiguration::effectiveExperience),
    DIFFICULTY("difficulty", Severity.MEDIUM, PlanConfiguration::effectiveDifficulty),
    PACE_METHOD("paceMethod", Severity.LOW, PlanConfiguration::getPaceMethod);

    private final String fieldName;
    private final Severity impact;
    private final Function<PlanConfiguration, Object> accessor;

    ConfigurationField(String fieldName, Severity impact, Function<PlanConfiguration, Object> accessor) {
        this.fieldName = fieldName;
        this.impact = impact;
        this.accessor = accessor;
    }

    public Object valueOf(PlanConfiguration config) {
        return accessor.apply(config);
    }

    /**
     * Impact of changing this field from {@code oldValue} to {@code newValue}. Moving the training day
     * count by more than one day is high impact.
     */
    public Severity impact(Object oldValue, Object newValue) {
        if (this == TRAINING_DAYS_PER_WEEK && oldValue instanceof Integer oldDays
                && newValue instanceof Integer newDays && Math.abs(newDays - oldDays) > 1) {
            return Severity.HIGH;
        }
        return impact;
    }
}
