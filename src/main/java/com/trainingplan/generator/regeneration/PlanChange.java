package com.trainingplan.generator.regeneration;

import java.time.DayOfWeek;

import com.trainingplan.generator.model.Severity;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class PlanChange {

    public enum Category {
        CONFIGURATION,
        WORKOUT
    }

    @NonNull
    Category category;

    /**
     * Configuration field name, or {@code week_added}, {@code week_removed}, {@code daily_workout}.
     */
    @NonNull
    String field;

    /**
     * Null for configuration changes.
     */
    Integer weekNumber;

    /**
     * Set for daily workout changes only.
     */
    DayOfWeek day;

    @NonNull
    Severity impact;

    @NonNull
    String description;
}
