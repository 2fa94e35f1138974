package com.trainingplan.generator.model;

import java.util.Locale;

/**
 * Sequential training phases of a program, in program order.
 */
public enum TrainingPhase {
    BASE,
    BUILD,
    PEAK,
    TAPER;

    public String displayName() {
        return name().charAt(0) + name().substring(1).toLowerCase(Locale.ROOT);
    }
}
