package com.trainingplan.generator.deload;

import java.util.List;

import com.trainingplan.generator.model.Severity;

import lombok.Value;

/**
 * Program-wide deload plan.
 *
 * {@code success} is false when any deload lands in a phase that disallows it; the result is advisory
 * either way.
 */
@Value
public class DeloadSchedulingResult {
    boolean success;
    List<DeloadWeekConfiguration> deloadWeeks;
    List<PhaseConflict> phaseConflicts;
    List<String> warnings;
    List<String> recommendations;

    public int totalDeloadWeeks() {
        return deloadWeeks.size();
    }

    /**
     * Deload weeks without a high-severity conflict.
     */
    public List<DeloadWeekConfiguration> applicableDeloadWeeks() {
        return deloadWeeks.stream()
                .filter(week -> phaseConflicts.stream().noneMatch(
                        c -> c.getWeekNumber() == week.getWeekNumber() && c.getSeverity() == Severity.HIGH))
                .toList();
    }
}
