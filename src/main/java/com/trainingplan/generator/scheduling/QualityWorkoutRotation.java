package com.trainingplan.generator.scheduling;

import com.trainingplan.generator.model.QualityWorkoutType;

import lombok.Value;

/**
 * The quality-workout sub-type active in a given week and the one that follows it.
 */
@Value
public class QualityWorkoutRotation {
    int weekNumber;
    QualityWorkoutType qualityType;
    String description;
    QualityWorkoutType nextRotation;
}
