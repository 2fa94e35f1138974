package com.trainingplan.generator.plan;

import lombok.Value;

/**
 * Weeks per training phase.
 */
@Value
public class PhaseDistribution {
    int base;
    int build;
    int peak;
    int taper;
}
