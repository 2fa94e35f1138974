package com.trainingplan.generator.deload;

import java.util.List;

import lombok.Value;

@Value
public class DeloadRecommendations {
    int optimalFrequency;
    List<Integer> expectedDeloadWeeks;
    List<String> phaseConsiderations;
    String volumeReductionGuidance;
}
