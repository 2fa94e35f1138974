package com.trainingplan.generator.model;

/**
 * Advisory severity attached to warnings and phase conflicts.
 * Used for emphasis only, never for flow control.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH
}
