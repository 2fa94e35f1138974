package com.trainingplan.generator.regeneration;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trainingplan.generator.deload.DeloadWorkoutModification;
import com.trainingplan.generator.distribution.PaceGuidance;
import com.trainingplan.generator.distribution.Workout;
import com.trainingplan.generator.generator.PlanGenerationResult;
import com.trainingplan.generator.generator.PlanGenerator;
import com.trainingplan.generator.generator.PlanWarning;
import com.trainingplan.generator.model.PaceMethod;
import com.trainingplan.generator.model.PlanConfiguration;
import com.trainingplan.generator.model.Severity;
import com.trainingplan.generator.plan.TrainingPlan;
import com.trainingplan.generator.plan.WeeklyPlan;
import com.trainingplan.generator.scheduling.DailyWorkout;
import com.trainingplan.generator.util.DayOfWeekUtil;

/**
 * Rebuilds a plan for a changed configuration and reports what changed.
 */
public class PlanRegenerator {

    private static final Logger log = LoggerFactory.getLogger(PlanRegenerator.class);

    private static final int MAX_MEDIUM_CHANGES_FOR_INCREMENTAL = 2;
    private static final int MAX_CHANGES_FOR_MINIMAL = 3;
    private static final double SIGNIFICANT_DISTANCE_CHANGE_KM = 2.0;

    private final PlanGenerator generator;

    public PlanRegenerator() {
        this(new PlanGenerator());
    }

    public PlanRegenerator(PlanGenerator generator) {
        this.generator = generator;
    }

    public RegenerationResult regeneratePlan(TrainingPlan currentPlan, PlanConfiguration newConfiguration) {
        return regeneratePlan(currentPlan, newConfiguration, RegenerationOptions.defaults());
    }

    public RegenerationResult regeneratePlan(TrainingPlan currentPlan, PlanConfiguration newConfiguration,
                                             RegenerationOptions options) {
        if (currentPlan == null || newConfiguration == null) {
            return RegenerationResult.failure(RegenerationStrategy.FULL,
                    List.of("Invalid plan or configuration provided"), List.of());
        }

        try {
            List<ConfigurationChange> changes = analyzeConfigurationChanges(currentPlan.getConfiguration(),
                    newConfiguration);
            RegenerationStrategy strategy = determineStrategy(changes, options);
            log.info("Regenerating plan {} with {} strategy ({} configuration change(s))", currentPlan.getId(),
                    strategy, changes.size());

            return switch (strategy) {
                case MINIMAL -> minimalUpdate(currentPlan, newConfiguration, changes);
                case INCREMENTAL -> fullRegeneration(currentPlan, newConfiguration, changes, options,
                        RegenerationStrategy.INCREMENTAL, "Incremental changes applied through full regeneration");
                case FULL -> fullRegeneration(currentPlan, newConfiguration, changes, options,
                        RegenerationStrategy.FULL, "Plan fully regenerated due to significant configuration changes");
            };
        } catch (RuntimeException e) {
            log.error("Plan regeneration failed", e);
            return RegenerationResult.failure(RegenerationStrategy.FULL,
                    List.of("Regeneration failed: " + e.getMessage()), List.of());
        }
    }

    public List<ConfigurationChange> analyzeConfigurationChanges(PlanConfiguration oldConfig,
                                                                 PlanConfiguration newConfig) {
        List<ConfigurationChange> changes = new ArrayList<>();
        for (ConfigurationField field : ConfigurationField.values()) {
            Object oldValue = field.valueOf(oldConfig);
            Object newValue = field.valueOf(newConfig);
            if (!Objects.equals(oldValue, newValue)) {
                changes.add(new ConfigurationChange(field, oldValue, newValue, field.impact(oldValue, newValue),
                        describe(field, oldValue, newValue)));
            }
        }
        return List.copyOf(changes);
    }

    /**
     * FULL when forced, on any high-impact change or more than two medium ones; INCREMENTAL for the
     * remaining medium changes or more than three changes in total; MINIMAL otherwise.
     */
    public RegenerationStrategy determineStrategy(List<ConfigurationChange> changes, RegenerationOptions options) {
        if (options.isForceFullRegeneration()) {
            return RegenerationStrategy.FULL;
        }
        if (changes.stream().anyMatch(c -> c.getImpact() == Severity.HIGH)) {
            return RegenerationStrategy.FULL;
        }
        long medium = changes.stream().filter(c -> c.getImpact() == Severity.MEDIUM).count();
        if (medium > MAX_MEDIUM_CHANGES_FOR_INCREMENTAL) {
            return RegenerationStrategy.FULL;
        }
        if (medium > 0 || changes.size() > MAX_CHANGES_FOR_MINIMAL) {
            return RegenerationStrategy.INCREMENTAL;
        }
        return RegenerationStrategy.MINIMAL;
    }

    public ComparisonReport comparePlans(TrainingPlan original, TrainingPlan modified) {
        return comparePlans(original, modified,
                analyzeConfigurationChanges(original.getConfiguration(), modified.getConfiguration()));
    }

    public ComparisonReport comparePlans(TrainingPlan original, TrainingPlan modified,
                                         List<ConfigurationChange> configurationChanges) {
        List<PlanChange> changes = new ArrayList<>();
        for (ConfigurationChange change : configurationChanges) {
            changes.add(PlanChange.builder()
                    .category(PlanChange.Category.CONFIGURATION)
                    .field(change.getField().getFieldName())
                    .impact(change.getImpact())
                    .description(change.getDescription())
                    .build());
        }
        changes.addAll(compareWeeks(original, modified));

        return new ComparisonReport(original, modified, List.copyOf(changes), impactAssessment(changes));
    }

    private RegenerationResult minimalUpdate(TrainingPlan currentPlan, PlanConfiguration newConfiguration,
                                             List<ConfigurationChange> changes) {
        PaceMethod previous = currentPlan.getConfiguration().getPaceMethod();
        PaceMethod current = newConfiguration.getPaceMethod();

        List<WeeklyPlan> weeks = currentPlan.getWeeks();
        if (previous != current) {
            weeks = weeks.stream().map(week -> rewritePaces(week, previous, current)).toList();
        }

        TrainingPlan updated = currentPlan.toBuilder()
                .configuration(newConfiguration)
                .weeks(weeks)
                .build();

        return RegenerationResult.builder()
                .success(true)
                .newPlan(updated)
                .comparison(comparePlans(currentPlan, updated, changes))
                .warnings(List.of("Minimal update applied - only pace guidance updated"))
                .strategyUsed(RegenerationStrategy.MINIMAL)
                .build();
    }

    private RegenerationResult fullRegeneration(TrainingPlan currentPlan, PlanConfiguration newConfiguration,
                                                List<ConfigurationChange> changes, RegenerationOptions options,
                                                RegenerationStrategy strategy, String summary) {
        PlanGenerationResult generation = generator.generatePlan(newConfiguration, options.getGenerationOptions());
        List<String> warnings = new ArrayList<>(generation.warningMessages());

        if (!generation.isSuccess() || generation.getPlan() == null) {
            log.warn("Regeneration could not produce a plan: {}", generation.getErrors());
            return RegenerationResult.failure(strategy, generation.getErrors(), warnings);
        }

        warnings.add(summary);
        return RegenerationResult.builder()
                .success(true)
                .newPlan(generation.getPlan())
                .comparison(comparePlans(currentPlan, generation.getPlan(), changes))
                .errors(generation.getErrors())
                .warnings(List.copyOf(warnings))
                .strategyUsed(strategy)
                .build();
    }

    private static WeeklyPlan rewritePaces(WeeklyPlan week, PaceMethod previous, PaceMethod current) {
        List<DailyWorkout> days = week.getDays().stream()
                .map(day -> day.getWorkout() == null ? day
                        : day.toBuilder().workout(rewritePace(day.getWorkout(), previous, current)).build())
                .toList();
        List<DeloadWorkoutModification> modifications = week.getDeloadModifications().stream()
                .map(mod -> mod.toBuilder()
                        .originalWorkout(rewritePace(mod.getOriginalWorkout(), previous, current))
                        .modifiedWorkout(rewritePace(mod.getModifiedWorkout(), previous, current))
                        .build())
                .toList();
        return week.toBuilder().days(days).deloadModifications(modifications).build();
    }

    private static Workout rewritePace(Workout workout, PaceMethod previous, PaceMethod current) {
        return workout.toBuilder()
                .paceGuidance(PaceGuidance.rewrite(workout.getPaceGuidance(), previous, current))
                .build();
    }

    private static List<PlanChange> compareWeeks(TrainingPlan original, TrainingPlan modified) {
        List<PlanChange> changes = new ArrayList<>();
        int weeks = Math.max(original.totalWeeks(), modified.totalWeeks());
        for (int weekNumber = 1; weekNumber <= weeks; weekNumber++) {
            boolean inOriginal = weekNumber <= original.totalWeeks();
            boolean inModified = weekNumber <= modified.totalWeeks();

            if (!inOriginal) {
                changes.add(weekChange("week_added", weekNumber, "Week " + weekNumber + " added to plan"));
            } else if (!inModified) {
                changes.add(weekChange("week_removed", weekNumber, "Week " + weekNumber + " removed from plan"));
            } else {
                changes.addAll(compareDays(original.week(weekNumber), modified.week(weekNumber)));
            }
        }
        return changes;
    }

    private static PlanChange weekChange(String field, int weekNumber, String description) {
        return PlanChange.builder()
                .category(PlanChange.Category.WORKOUT)
                .field(field)
                .weekNumber(weekNumber)
                .impact(Severity.MEDIUM)
                .description(description)
                .build();
    }

    private static List<PlanChange> compareDays(WeeklyPlan original, WeeklyPlan modified) {
        List<PlanChange> changes = new ArrayList<>();
        for (DayOfWeek day : DayOfWeekUtil.WEEK) {
            DailyWorkout before = original.day(day);
            DailyWorkout after = modified.day(day);
            if (before.equals(after)) {
                continue;
            }
            changes.add(PlanChange.builder()
                    .category(PlanChange.Category.WORKOUT)
                    .field("daily_workout")
                    .weekNumber(original.getWeekNumber())
                    .day(day)
                    .impact(workoutChangeImpact(before.getWorkout(), after.getWorkout()))
                    .description(workoutChangeDescription(before.getWorkout(), after.getWorkout(), day))
                    .build());
        }
        return changes;
    }

    private static Severity workoutChangeImpact(Workout before, Workout after) {
        if (before == null && after == null) {
            return Severity.LOW;
        }
        if (before == null || after == null) {
            return Severity.MEDIUM;
        }
        if (before.getType() != after.getType()) {
            return Severity.HIGH;
        }
        if (Math.abs(before.getDistanceKm() - after.getDistanceKm()) > SIGNIFICANT_DISTANCE_CHANGE_KM) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    private static String workoutChangeDescription(Workout before, Workout after, DayOfWeek day) {
        String dayName = DayOfWeekUtil.displayName(day);
        if (before == null && after != null) {
            return dayName + ": Added " + after.getType().getDisplayName();
        }
        if (before != null && after == null) {
            return dayName + ": Removed " + before.getType().getDisplayName();
        }
        if (before != null && before.getType() != after.getType()) {
            return dayName + ": Changed from " + before.getType().getDisplayName() + " to "
                    + after.getType().getDisplayName();
        }
        return dayName + ": Workout modified";
    }

    private static String describe(ConfigurationField field, Object oldValue, Object newValue) {
        return switch (field) {
            case RACE_DISTANCE -> "Race distance changed from " + oldValue + " to " + newValue;
            case PROGRAM_LENGTH -> "Program length changed from " + oldValue + " to " + newValue + " weeks";
            case TRAINING_DAYS_PER_WEEK -> "Training days per week changed from " + oldValue + " to " + newValue;
            case REST_DAYS -> "Rest days changed";
            case LONG_RUN_DAY -> "Long run day changed from " + oldValue + " to " + newValue;
            case DELOAD_FREQUENCY -> "Deload frequency changed from every " + oldValue + " weeks to every "
                    + newValue + " weeks";
            default -> field.getFieldName() + " changed";
        };
    }

    private static List<String> impactAssessment(List<PlanChange> changes) {
        List<String> assessment = new ArrayList<>();
        long high = changes.stream().filter(c -> c.getImpact() == Severity.HIGH).count();
        long medium = changes.stream().filter(c -> c.getImpact() == Severity.MEDIUM).count();
        long low = changes.stream().filter(c -> c.getImpact() == Severity.LOW).count();

        if (high > 0) {
            assessment.add(high + " high-impact changes detected - significant plan restructuring");
        }
        if (medium > 0) {
            assessment.add(medium + " medium-impact changes - moderate adjustments to plan");
        }
        if (low > 0) {
            assessment.add(low + " low-impact changes - minor adjustments");
        }

        long configuration = changes.stream().filter(c -> c.getCategory() == PlanChange.Category.CONFIGURATION).count();
        long workouts = changes.size() - configuration;
        if (configuration > 0) {
            assessment.add("Configuration changes may affect overall plan structure and progression");
        }
        if (workouts > 0) {
            assessment.add(workouts + " workout changes detected across the plan");
        }
        return List.copyOf(assessment);
    }
}
