package com.trainingplan.generator.deload;

import com.trainingplan.generator.model.Severity;
import com.trainingplan.generator.model.TrainingPhase;

import lombok.Value;

@Value
public class PhaseConflict {
    int weekNumber;
    TrainingPhase phase;
    ConflictType conflictType;
    Severity severity;
    String recommendation;
}
