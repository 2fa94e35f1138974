package com.trainingplan.generator.regeneration;

/**
 * How a plan is rebuilt after a configuration change.
 */
public enum RegenerationStrategy {
    /** Generate the plan again from scratch. */
    FULL,
    /** Moderate changes; currently carried out as a full generation. */
    INCREMENTAL,
    /** Copy the existing plan and rewrite pace guidance only. */
    MINIMAL
}
