package com.trainingplan.generator.periodization;

import java.util.List;

import com.trainingplan.generator.model.TrainingPhase;

import lombok.Value;

/**
 * Guidance for the week where one phase hands over to the next. Display only.
 */
@Value
public class PhaseTransition {
    TrainingPhase fromPhase;
    TrainingPhase toPhase;
    int transitionWeek;
    List<String> adjustments;
    List<String> warnings;
}
