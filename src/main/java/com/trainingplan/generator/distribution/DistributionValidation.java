package com.trainingplan.generator.distribution;

import java.util.List;

import lombok.Value;

@Value
public class DistributionValidation {

    /**
     * False for fewer than three training days or a missing long run.
     */
    boolean valid;

    List<String> warnings;
    List<String> recommendations;
}
