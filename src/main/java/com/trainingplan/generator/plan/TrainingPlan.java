package com.trainingplan.generator.plan;

import java.util.List;

import com.trainingplan.generator.model.PlanConfiguration;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A generated plan. Never changed after it is returned; regeneration builds a new one.
 */
@Value
@Builder(toBuilder = true)
public class TrainingPlan {

    @NonNull
    String id;

    @NonNull
    PlanConfiguration configuration;

    /**
     * Ordered by week number, starting at 1.
     */
    @NonNull
    List<WeeklyPlan> weeks;

    @NonNull
    PlanMetadata metadata;

    public int totalWeeks() {
        return weeks.size();
    }

    /**
     * @throws IllegalArgumentException when the week is not part of the plan
     */
    public WeeklyPlan week(int weekNumber) {
        if (weekNumber < 1 || weekNumber > weeks.size()) {
            throw new IllegalArgumentException(
                    "Week " + weekNumber + " is outside the plan (1-" + weeks.size() + ")");
        }
        return weeks.get(weekNumber - 1);
    }

    public List<WeeklyPlan> deloadWeeks() {
        return weeks.stream().filter(WeeklyPlan::isDeloadWeek).toList();
    }
}
