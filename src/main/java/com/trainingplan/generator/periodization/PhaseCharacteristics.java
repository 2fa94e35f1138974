package com.trainingplan.generator.periodization;

import java.util.List;

import lombok.Value;

/**
 * Static training guidance for a phase.
 */
@Value
public class PhaseCharacteristics {
    String volumeEmphasis;
    String intensityEmphasis;
    String recoveryEmphasis;
    List<String> workoutTypes;
    List<String> primaryAdaptations;
    List<String> keyMetrics;
}
