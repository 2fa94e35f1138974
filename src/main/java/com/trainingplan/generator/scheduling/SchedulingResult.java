package com.trainingplan.generator.scheduling;

import java.util.List;

import lombok.Value;

/**
 * Outcome of scheduling one week.
 *
 * When constraints are infeasible there is no week and {@code errors} explains why. When the week
 * was built but breaks a rule, the week is still returned, {@code success} is false and
 * {@code errors} repeats the constraint violations.
 */
@Value
public class SchedulingResult {
    boolean success;
    ScheduledWeek scheduledWeek;
    List<String> errors;
    List<String> warnings;

    public boolean isInfeasible() {
        return scheduledWeek == null;
    }
}
