package com.trainingplan.generator.scheduling;

import java.time.DayOfWeek;
import java.util.List;

import com.trainingplan.generator.model.PlanConfiguration;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Day-placement rules for one week.
 */
@Value
@Builder
public class SchedulingConstraints {

    public static final int DEFAULT_RECOVERY_HOURS = 48;

    @NonNull
    List<DayOfWeek> restDays;

    @NonNull
    DayOfWeek longRunDay;

    int trainingDaysPerWeek;

    /**
     * Minimum gap between two quality sessions.
     */
    @Builder.Default
    int minimumRecoveryHours = DEFAULT_RECOVERY_HOURS;

    public static SchedulingConstraints from(PlanConfiguration config) {
        return SchedulingConstraints.builder()
                .restDays(List.copyOf(config.getRestDays()))
                .longRunDay(config.getLongRunDay())
                .trainingDaysPerWeek(config.getTrainingDaysPerWeek())
                .build();
    }

    public boolean isRestDay(DayOfWeek day) {
        return restDays.contains(day);
    }

    /**
     * Recovery window expressed in whole days.
     */
    public int minimumRecoveryDays() {
        return (int) Math.ceil(minimumRecoveryHours / 24.0);
    }
}
