package com.trainingplan.generator.periodization;

import java.util.List;
import java.util.Optional;

import com.trainingplan.generator.model.RaceDistance;
import com.trainingplan.generator.model.TrainingPhase;

import lombok.NonNull;
import lombok.Value;

/**
 * The four phases of a program laid out over its weeks, plus the transitions between them.
 */
@Value
public class PhasePeriodization {

    int totalWeeks;

    @NonNull
    RaceDistance raceDistance;

    /**
     * Base, build, peak, taper; contiguous from week 1.
     */
    @NonNull
    List<PhaseConfiguration> phases;

    @NonNull
    List<PhaseTransition> transitions;

    /**
     * Phase whose week range contains {@code week}.
     *
     * @throws IllegalArgumentException when the week is outside {@code [1, totalWeeks]}
     */
    public TrainingPhase phaseForWeek(int week) {
        return phases.stream()
                .filter(p -> p.contains(week))
                .map(PhaseConfiguration::getPhase)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Week " + week + " is outside the program (1-" + totalWeeks + ")"));
    }

    public Optional<PhaseConfiguration> configurationFor(TrainingPhase phase) {
        return phases.stream().filter(p -> p.getPhase() == phase).findFirst();
    }

    public int durationOf(TrainingPhase phase) {
        return configurationFor(phase).map(PhaseConfiguration::getDurationWeeks).orElse(0);
    }
}
