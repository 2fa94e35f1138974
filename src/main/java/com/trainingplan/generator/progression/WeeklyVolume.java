package com.trainingplan.generator.progression;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Target training distance for one week, in kilometres.
 */
@Value
@Builder
public class WeeklyVolume {

    int weekNumber;

    /**
     * Volume carried into this week before any increase or reduction.
     */
    double baseVolume;

    /**
     * Final whole-kilometre target for the week.
     */
    int adjustedVolume;

    boolean deloadWeek;

    /**
     * Applied rate: positive for an increase, negative for a deload reduction, zero for a hold.
     */
    double progressionRate;

    @NonNull
    @Builder.Default
    List<String> notes = List.of();
}
