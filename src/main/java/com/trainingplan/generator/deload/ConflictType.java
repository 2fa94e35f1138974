package com.trainingplan.generator.deload;

/**
 * Why a deload week collides with phase goals.
 */
public enum ConflictType {
    CRITICAL_BUILD,
    PEAK_PREPARATION,
    TAPER_DISRUPTION
}
