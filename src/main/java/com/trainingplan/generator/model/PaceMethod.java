package com.trainingplan.generator.model;

import lombok.Getter;

/**
 * How the runner's training paces were established.
 * Only affects the pace-guidance wording of workouts.
 */
@Getter
public enum PaceMethod {

    RECENT_RACE(1, "highest", "Recent Race Time"),
    TIME_TRIAL(2, "high", "Time Trial"),
    CURRENT_PACE(3, "moderate", "Current Training Pace"),
    GOAL(4, "low", "Goal Race Time"),
    FITNESS_LEVEL(5, "estimate", "Fitness Level Assessment");

    private final int priority;
    private final String accuracy;
    private final String label;

    PaceMethod(int priority, String accuracy, String label) {
        this.priority = priority;
        this.accuracy = accuracy;
        this.label = label;
    }

    /**
     * Suffix appended to pace guidance so the runner knows how reliable the paces are.
     */
    public String guidanceNote() {
        return "(paces from " + label + ", " + accuracy + " accuracy)";
    }
}
