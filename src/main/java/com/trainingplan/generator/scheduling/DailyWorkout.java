package com.trainingplan.generator.scheduling;

import java.time.DayOfWeek;

import com.trainingplan.generator.distribution.Workout;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One calendar day of a week: a configured rest day, a placed workout, or an open day.
 */
@Value
@Builder(toBuilder = true)
public class DailyWorkout {

    @NonNull
    DayOfWeek day;

    /**
     * True for the configured rest days and for sessions skipped during a deload.
     */
    boolean restDay;

    /**
     * Null on rest days and on open days nothing was placed on.
     */
    Workout workout;

    public static DailyWorkout empty(DayOfWeek day, boolean restDay) {
        return DailyWorkout.builder().day(day).restDay(restDay).build();
    }

    public boolean isTraining() {
        return !restDay && workout != null;
    }
}
