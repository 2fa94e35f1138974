package com.trainingplan.generator.model;

/**
 * Runner experience; selects starting and maximum weekly volume.
 */
public enum ExperienceLevel {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED
}
