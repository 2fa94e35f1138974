package com.trainingplan.generator.periodization;

import java.util.List;

import com.trainingplan.generator.model.TrainingPhase;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One contiguous block of weeks sharing a training emphasis.
 */
@Value
@Builder
public class PhaseConfiguration {

    @NonNull
    TrainingPhase phase;

    /**
     * First week of the phase, 1-indexed and inclusive.
     */
    int startWeek;

    /**
     * Last week of the phase, inclusive.
     */
    int endWeek;

    int durationWeeks;

    /**
     * Share of the whole program, 0-100.
     */
    double percentage;

    @NonNull
    String focus;

    @NonNull
    List<String> characteristics;

    @NonNull
    List<String> workoutEmphasis;

    public boolean contains(int week) {
        return week >= startWeek && week <= endWeek;
    }
}
