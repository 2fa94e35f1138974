package com.trainingplan.generator.regeneration;

import java.util.List;

import com.trainingplan.generator.model.Severity;
import com.trainingplan.generator.plan.TrainingPlan;

import lombok.NonNull;
import lombok.Value;

/**
 * Differences between two plans: configuration changes first, then week and day level changes.
 */
@Value
public class ComparisonReport {

    @NonNull
    TrainingPlan originalPlan;

    @NonNull
    TrainingPlan modifiedPlan;

    @NonNull
    List<PlanChange> changes;

    @NonNull
    List<String> impactAssessment;

    public List<PlanChange> configurationChanges() {
        return changes.stream().filter(c -> c.getCategory() == PlanChange.Category.CONFIGURATION).toList();
    }

    public List<PlanChange> workoutChanges() {
        return changes.stream().filter(c -> c.getCategory() == PlanChange.Category.WORKOUT).toList();
    }

    public long countByImpact(Severity impact) {
        return changes.stream().filter(c -> c.getImpact() == impact).count();
    }
}
