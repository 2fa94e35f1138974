package com.trainingplan.generator.progression;

import java.util.List;

import lombok.Value;

@Value
public class ProgressionValidation {

    /**
     * False when any non-deload week increases more than the hard safety ceiling.
     */
    boolean valid;

    List<String> warnings;
    List<String> adjustments;
}
