package com.trainingplan.generator.deload;

public enum ModificationType {
    VOLUME,
    INTENSITY,
    DURATION,
    SKIP
}
