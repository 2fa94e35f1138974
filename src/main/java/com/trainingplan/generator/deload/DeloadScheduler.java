package com.trainingplan.generator.deload;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trainingplan.generator.distribution.Workout;
import com.trainingplan.generator.model.PlanConfiguration;
import com.trainingplan.generator.model.RaceDistance;
import com.trainingplan.generator.model.Severity;
import com.trainingplan.generator.model.TrainingPhase;
import com.trainingplan.generator.model.WorkoutType;
import com.trainingplan.generator.periodization.PhaseConfiguration;
import com.trainingplan.generator.periodization.PhasePeriodization;
import com.trainingplan.generator.periodization.PhasePeriodizer;
import com.trainingplan.generator.progression.VolumeProgressor;
import com.trainingplan.generator.scheduling.DailyWorkout;
import com.trainingplan.generator.util.DistanceUtil;

/**
 * Decides which weeks are deload weeks, how much they reduce, and how each workout changes.
 *
 * Works over the whole program independently of day placement. The only randomness in plan
 * generation lives here: quality sessions in a deload week are skipped with a fixed probability,
 * drawn from the {@link Random} the caller supplies.
 */
public class DeloadScheduler {

    private static final Logger log = LoggerFactory.getLogger(DeloadScheduler.class);

    private static final double MIN_DELOAD_RATIO = 0.15;
    private static final double MAX_DELOAD_RATIO = 0.30;

    private static final Map<WorkoutType, ModificationRule> RULES = new EnumMap<>(WorkoutType.class);
    private static final Map<TrainingPhase, PhaseGuideline> GUIDELINES = new EnumMap<>(TrainingPhase.class);

    static {
        RULES.put(WorkoutType.EASY, new ModificationRule(0.25, 0.20, 0.0, false,
                "Maintain easy pace but reduce volume for recovery"));
        RULES.put(WorkoutType.LONG, new ModificationRule(0.30, 0.25, 0.0, false,
                "Significant volume reduction while maintaining aerobic stimulus"));
        RULES.put(WorkoutType.QUALITY, new ModificationRule(0.40, 0.35, 0.30, true,
                "Major reduction in quality work to promote recovery"));
        RULES.put(WorkoutType.REST, new ModificationRule(0.0, 0.0, 0.0, false,
                "Rest days remain unchanged during deload"));

        GUIDELINES.put(TrainingPhase.BASE, new PhaseGuideline(true, 0.20, 0.30, List.of(),
                "Deload weeks are beneficial during base building for adaptation"));
        GUIDELINES.put(TrainingPhase.BUILD, new PhaseGuideline(true, 0.15, 0.25, List.of(1, 2),
                "Careful deload timing to not disrupt lactate threshold development"));
        GUIDELINES.put(TrainingPhase.PEAK, new PhaseGuideline(false, 0.10, 0.15, List.of(1, 2, 3),
                "Avoid deloads during peak phase unless absolutely necessary"));
        GUIDELINES.put(TrainingPhase.TAPER, new PhaseGuideline(false, 0.0, 0.0, List.of(1, 2),
                "Taper phase already provides volume reduction - no additional deload needed"));
    }

    private final PhasePeriodizer periodizer;

    public DeloadScheduler() {
        this(new PhasePeriodizer());
    }

    public DeloadScheduler(PhasePeriodizer periodizer) {
        this.periodizer = periodizer;
    }

    public DeloadSchedulingResult scheduleDeloadWeeks(PlanConfiguration config) {
        return scheduleDeloadWeeks(config,
                periodizer.periodize(config.getProgramLength(), config.getRaceDistance()));
    }

    public DeloadSchedulingResult scheduleDeloadWeeks(PlanConfiguration config, PhasePeriodization periodization) {
        List<DeloadWeekConfiguration> deloadWeeks = new ArrayList<>();
        List<PhaseConflict> conflicts = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        for (int week = 1; week <= config.getProgramLength(); week++) {
            if (!VolumeProgressor.isDeloadWeek(week, config.getDeloadFrequency())) {
                continue;
            }
            TrainingPhase phase = periodization.phaseForWeek(week);
            deloadWeeks.add(deloadConfiguration(week, phase));

            Optional<PhaseConflict> conflict = checkPhaseConflict(week, phase, periodization);
            if (conflict.isPresent()) {
                conflicts.add(conflict.get());
                if (conflict.get().getSeverity() == Severity.HIGH) {
                    warnings.add("Week " + week + ": Deload conflicts with critical "
                            + phase.displayName().toLowerCase(Locale.ROOT) + " phase training");
                }
            }
        }

        validateProgram(deloadWeeks, conflicts, config, warnings, recommendations);

        boolean success = conflicts.stream().noneMatch(c -> c.getSeverity() == Severity.HIGH);
        log.debug("Deload weeks for {}-week program: {} ({} conflict(s))", config.getProgramLength(),
                deloadWeeks.stream().map(DeloadWeekConfiguration::getWeekNumber).toList(), conflicts.size());

        return new DeloadSchedulingResult(success, List.copyOf(deloadWeeks), List.copyOf(conflicts),
                List.copyOf(warnings), List.copyOf(recommendations));
    }

    /**
     * Reduction and notes for a deload week in the given phase. The reduction is the midpoint of the phase range.
     */
    public DeloadWeekConfiguration deloadConfiguration(int weekNumber, TrainingPhase phase) {
        PhaseGuideline guideline = GUIDELINES.get(phase);
        List<String> phaseConflicts = guideline.allowed
                ? List.of()
                : List.of("Deload week conflicts with " + phase.displayName().toLowerCase(Locale.ROOT)
                        + " phase - consider rescheduling");

        return DeloadWeekConfiguration.builder()
                .weekNumber(weekNumber)
                .deloadWeek(true)
                .phase(phase)
                .volumeReduction(guideline.midpoint())
                .phaseConflicts(phaseConflicts)
                .schedulingNotes(List.of(guideline.notes))
                .build();
    }

    public Optional<PhaseConflict> checkPhaseConflict(int weekNumber, TrainingPhase phase,
                                                      PhasePeriodization periodization) {
        PhaseGuideline guideline = GUIDELINES.get(phase);
        Optional<PhaseConfiguration> phaseConfig = periodization.configurationFor(phase);
        if (phaseConfig.isEmpty()) {
            return Optional.empty();
        }

        if (!guideline.allowed) {
            ConflictType type = phase == TrainingPhase.PEAK ? ConflictType.PEAK_PREPARATION
                    : ConflictType.TAPER_DISRUPTION;
            return Optional.of(new PhaseConflict(weekNumber, phase, type, Severity.HIGH,
                    "Consider moving deload to week " + (weekNumber - 1) + " or " + (weekNumber + 1)
                            + " if possible"));
        }

        int weekInPhase = weekNumber - phaseConfig.get().getStartWeek() + 1;
        if (guideline.criticalWeeks.contains(weekInPhase)) {
            return Optional.of(new PhaseConflict(weekNumber, phase, ConflictType.CRITICAL_BUILD, Severity.MEDIUM,
                    "Week " + weekNumber + " is critical for " + phase.displayName().toLowerCase(Locale.ROOT)
                            + " phase development - monitor recovery carefully"));
        }
        return Optional.empty();
    }

    /**
     * Per-workout changes for a scheduled deload week.
     *
     * Distance drops by {@code max(weekReduction, rule)} and duration by {@code max(0.8 * weekReduction, rule)}.
     * Quality sessions drop one intensity zone and are skipped when {@code random.nextDouble()} falls below the
     * skip probability. Easy and long runs are never skipped; rest days are untouched.
     */
    public List<DeloadWorkoutModification> modifyWorkoutsForDeload(List<DailyWorkout> days, double weekReduction,
                                                                   Random random) {
        List<DeloadWorkoutModification> modifications = new ArrayList<>();
        for (DailyWorkout day : days) {
            if (!day.isTraining()) {
                continue;
            }
            Workout workout = day.getWorkout();
            ModificationRule rule = RULES.get(workout.getType());

            if (rule.skipProbability > 0 && random.nextDouble() < rule.skipProbability) {
                modifications.add(DeloadWorkoutModification.builder()
                        .day(day.getDay())
                        .originalWorkout(workout)
                        .modifiedWorkout(skipped(workout))
                        .modificationType(ModificationType.SKIP)
                        .reductionAmount(1.0)
                        .rationale("Quality workout skipped during deload for enhanced recovery")
                        .build());
                continue;
            }

            double distanceReduction = Math.max(weekReduction, rule.distanceReduction);
            double durationReduction = Math.max(weekReduction * 0.8, rule.durationReduction);

            Workout.WorkoutBuilder modified = workout.toBuilder()
                    .distanceKm(DistanceUtil.roundOneDecimal(workout.getDistanceKm() * (1 - distanceReduction)))
                    .durationMinutes((int) Math.round(workout.getDurationMinutes() * (1 - durationReduction)));

            String description = workout.getDescription();
            if (rule.easesIntensity) {
                description = description + " (reduced intensity for deload)";
                modified.intensity(workout.getIntensity().easier())
                        .paceGuidance(workout.getPaceGuidance() + " - aim for easier end of range");
            }
            modified.description("DELOAD: " + description);

            boolean hasDistance = workout.getDistanceKm() > 0;
            modifications.add(DeloadWorkoutModification.builder()
                    .day(day.getDay())
                    .originalWorkout(workout)
                    .modifiedWorkout(modified.build())
                    .modificationType(hasDistance ? ModificationType.VOLUME : ModificationType.DURATION)
                    .reductionAmount(hasDistance ? distanceReduction : durationReduction)
                    .rationale(rule.rationale)
                    .build());
        }
        return List.copyOf(modifications);
    }

    public DeloadRecommendations recommendations(PlanConfiguration config) {
        List<Integer> expected = new ArrayList<>();
        for (int week = 1; week <= config.getProgramLength(); week++) {
            if (VolumeProgressor.isDeloadWeek(week, config.getDeloadFrequency())) {
                expected.add(week);
            }
        }
        int optimal = config.getRaceDistance() == RaceDistance.MARATHON ? 3 : 4;
        return new DeloadRecommendations(optimal, List.copyOf(expected),
                List.of("Base phase: Deload weeks support aerobic adaptation",
                        "Build phase: Time deloads carefully to not disrupt lactate threshold development",
                        "Peak phase: Avoid deloads during race-specific preparation",
                        "Taper phase: No additional deloads needed - taper provides volume reduction"),
                "Reduce volume by 20-30% while maintaining workout variety and intensity zones");
    }

    private static void validateProgram(List<DeloadWeekConfiguration> deloadWeeks, List<PhaseConflict> conflicts,
                                        PlanConfiguration config, List<String> warnings,
                                        List<String> recommendations) {
        double ratio = (double) deloadWeeks.size() / config.getProgramLength();
        if (ratio < MIN_DELOAD_RATIO) {
            warnings.add("Low deload frequency may not provide adequate recovery");
            recommendations.add("Consider more frequent deload weeks for better adaptation");
        }
        if (ratio > MAX_DELOAD_RATIO) {
            warnings.add("High deload frequency may limit training stimulus");
            recommendations.add("Consider reducing deload frequency to maintain training load");
        }

        for (int i = 0; i < deloadWeeks.size() - 1; i++) {
            int current = deloadWeeks.get(i).getWeekNumber();
            int next = deloadWeeks.get(i + 1).getWeekNumber();
            if (next - current == 1) {
                warnings.add("Consecutive deload weeks (" + current + "-" + next + ") detected");
                recommendations.add("Avoid consecutive deload weeks to maintain training rhythm");
            }
        }

        long highConflicts = conflicts.stream().filter(c -> c.getSeverity() == Severity.HIGH).count();
        if (highConflicts > 0) {
            warnings.add(highConflicts + " high-priority phase conflicts detected");
            recommendations.add("Consider adjusting deload frequency or program length to avoid critical phase disruption");
        }

        if (config.getRaceDistance() == RaceDistance.MARATHON && config.getDeloadFrequency() == 4) {
            recommendations.add("Consider 3-week deload frequency for marathon training due to higher volume stress");
        }
        if (config.getRaceDistance() == RaceDistance.FIVE_K && config.getDeloadFrequency() == 3) {
            recommendations.add("4-week deload frequency may be sufficient for 5K training");
        }
    }

    private static Workout skipped(Workout workout) {
        return workout.toBuilder()
                .type(WorkoutType.REST)
                .distanceKm(0)
                .durationMinutes(0)
                .intensity(WorkoutType.REST.getDefaultZone())
                .description("Rest day - quality workout skipped for deload recovery")
                .paceGuidance("Complete rest or very light activity")
                .recoveryHours(0)
                .qualityType(null)
                .build();
    }

    private static final class ModificationRule {
        final double distanceReduction;
        final double durationReduction;
        final double skipProbability;
        final boolean easesIntensity;
        final String rationale;

        ModificationRule(double distanceReduction, double durationReduction, double skipProbability,
                         boolean easesIntensity, String rationale) {
            this.distanceReduction = distanceReduction;
            this.durationReduction = durationReduction;
            this.skipProbability = skipProbability;
            this.easesIntensity = easesIntensity;
            this.rationale = rationale;
        }
    }

    private static final class PhaseGuideline {
        final boolean allowed;
        final double minReduction;
        final double maxReduction;
        final List<Integer> criticalWeeks;
        final String notes;

        PhaseGuideline(boolean allowed, double minReduction, double maxReduction, List<Integer> criticalWeeks,
                       String notes) {
            this.allowed = allowed;
            this.minReduction = minReduction;
            this.maxReduction = maxReduction;
            this.criticalWeeks = criticalWeeks;
            this.notes = notes;
        }

        double midpoint() {
            return minReduction + (maxReduction - minReduction) * 0.5;
        }
    }
}
