package com.trainingplan.generator.generator;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trainingplan.generator.deload.DeloadScheduler;
import com.trainingplan.generator.deload.DeloadSchedulingResult;
import com.trainingplan.generator.deload.DeloadWeekConfiguration;
import com.trainingplan.generator.deload.DeloadWorkoutModification;
import com.trainingplan.generator.distribution.DistributionValidation;
import com.trainingplan.generator.distribution.WeeklyWorkoutDistribution;
import com.trainingplan.generator.distribution.WorkoutDistributor;
import com.trainingplan.generator.model.PlanConfiguration;
import com.trainingplan.generator.model.Severity;
import com.trainingplan.generator.model.TrainingPhase;
import com.trainingplan.generator.model.WorkoutType;
import com.trainingplan.generator.periodization.PeriodizationValidation;
import com.trainingplan.generator.periodization.PhaseConfiguration;
import com.trainingplan.generator.periodization.PhasePeriodization;
import com.trainingplan.generator.periodization.PhasePeriodizer;
import com.trainingplan.generator.plan.PhaseDistribution;
import com.trainingplan.generator.plan.PlanMetadata;
import com.trainingplan.generator.plan.TrainingPlan;
import com.trainingplan.generator.plan.WeeklyPlan;
import com.trainingplan.generator.plan.WorkoutTypeDistribution;
import com.trainingplan.generator.progression.ProgressionValidation;
import com.trainingplan.generator.progression.VolumeProgressor;
import com.trainingplan.generator.progression.WeeklyVolume;
import com.trainingplan.generator.scheduling.DailyWorkout;
import com.trainingplan.generator.scheduling.ScheduledWeek;
import com.trainingplan.generator.scheduling.SchedulingConstraints;
import com.trainingplan.generator.scheduling.SchedulingResult;
import com.trainingplan.generator.scheduling.WeeklyScheduler;
import com.trainingplan.generator.util.DayOfWeekUtil;
import com.trainingplan.generator.util.DistanceUtil;
import com.trainingplan.generator.validation.ConfigurationValidator;
import com.trainingplan.generator.validation.ValidationResult;
import com.trainingplan.generator.validation.ValidationWarning;

/**
 * Runs the generation pipeline for one configuration and assembles the resulting plan.
 */
public class PlanGenerator {

    private static final Logger log = LoggerFactory.getLogger(PlanGenerator.class);

    static final double MAX_PLAN_WEEKLY_INCREASE = 0.12;
    static final double MAX_QUALITY_SHARE = 0.25;
    static final String DELOAD_FOCUS = "Deload Week - Recovery and Adaptation";

    private final ConfigurationValidator validator;
    private final PhasePeriodizer periodizer;
    private final VolumeProgressor progressor;
    private final WorkoutDistributor distributor;
    private final WeeklyScheduler scheduler;
    private final DeloadScheduler deloadScheduler;

    public PlanGenerator() {
        this(new ConfigurationValidator(), new PhasePeriodizer(), new VolumeProgressor(), new WorkoutDistributor(),
                new WeeklyScheduler());
    }

    public PlanGenerator(ConfigurationValidator validator, PhasePeriodizer periodizer, VolumeProgressor progressor,
                         WorkoutDistributor distributor, WeeklyScheduler scheduler) {
        this.validator = validator;
        this.periodizer = periodizer;
        this.progressor = progressor;
        this.distributor = distributor;
        this.scheduler = scheduler;
        this.deloadScheduler = new DeloadScheduler(periodizer);
    }

    public ValidationResult validateConfiguration(PlanConfiguration config) {
        return validator.validate(config);
    }

    public PlanGenerationResult generatePlan(PlanConfiguration config) {
        return generatePlan(config, PlanGenerationOptions.defaults());
    }

    public PlanGenerationResult generatePlan(PlanConfiguration config, PlanGenerationOptions options) {
        Warnings warnings = new Warnings();
        ValidationResult validation = null;

        try {
            log.info("Starting plan generation: {} over {} weeks, {} training days", config.getRaceDistance(),
                    config.getProgramLength(), config.getTrainingDaysPerWeek());

            // Step 1: Validate configuration
            log.info("Step 1: Validating configuration...");
            validation = validator.validate(config);
            for (ValidationWarning warning : validation.getWarnings()) {
                warnings.add(GenerationStep.VALIDATION, warning.getSeverity(), warning.getMessage());
            }
            if (!validation.isValid()) {
                log.warn("Configuration rejected with {} error(s)", validation.getErrors().size());
                return PlanGenerationResult.failure(validation.errorMessages(), warnings.list(), validation);
            }
            if (options.isValidateOnly()) {
                log.info("Validate-only run, skipping generation");
                return PlanGenerationResult.builder()
                        .success(true)
                        .warnings(warnings.list())
                        .validationResult(validation)
                        .build();
            }

            // Step 2: Periodize
            log.info("Step 2: Determining training phases...");
            PhasePeriodization periodization = periodizer.periodize(config.getProgramLength(),
                    config.getRaceDistance());
            PeriodizationValidation periodizationCheck = periodizer.validate(periodization);
            warnings.addAll(GenerationStep.PERIODIZATION, Severity.LOW, periodizationCheck.getWarnings());

            // Step 3: Volume progression
            log.info("Step 3: Calculating volume progression...");
            List<WeeklyVolume> volumes = progressor.calculateWeeklyVolumes(config.getRaceDistance(),
                    config.getProgramLength(), config.getDeloadFrequency(), config.effectiveExperience());
            ProgressionValidation progression = progressor.validate(volumes);
            if (!progression.isValid()) {
                log.warn("Volume progression rejected: {}", progression.getWarnings());
                return PlanGenerationResult.failure(progression.getWarnings(), warnings.list(), validation);
            }
            warnings.addAll(GenerationStep.PROGRESSION, Severity.MEDIUM, progression.getWarnings());
            warnings.addAll(GenerationStep.PROGRESSION, Severity.LOW, progression.getAdjustments());

            // Step 4: Distribute and schedule each week
            log.info("Step 4: Distributing and scheduling {} weeks...", config.getProgramLength());
            SchedulingConstraints constraints = SchedulingConstraints.from(config);
            List<WeeklyPlan> weeks = new ArrayList<>();
            for (WeeklyVolume volume : volumes) {
                int weekNumber = volume.getWeekNumber();
                TrainingPhase phase = periodization.phaseForWeek(weekNumber);

                WeeklyWorkoutDistribution distribution = distributor.distribute(config,
                        volume.getAdjustedVolume(), phase);
                DistributionValidation distributionCheck = distributor.validate(distribution);
                if (!distributionCheck.getWarnings().isEmpty()) {
                    warnings.add(GenerationStep.DISTRIBUTION, Severity.LOW,
                            "Week " + weekNumber + ": " + String.join(", ", distributionCheck.getWarnings()));
                }
                warnings.addAll(GenerationStep.DISTRIBUTION, Severity.LOW, distributionCheck.getRecommendations());

                SchedulingResult scheduling = scheduler.scheduleWeek(weekNumber, constraints,
                        distribution.getWorkouts(), phase, config.getPaceMethod());
                if (scheduling.isInfeasible()) {
                    log.warn("Week {} could not be scheduled: {}", weekNumber, scheduling.getErrors());
                    return PlanGenerationResult.failure(scheduling.getErrors(), warnings.list(), validation);
                }
                if (!scheduling.isSuccess()) {
                    warnings.add(GenerationStep.SCHEDULING, Severity.MEDIUM,
                            "Week " + weekNumber + ": " + String.join(", ", scheduling.getErrors()));
                }
                warnings.addAll(GenerationStep.SCHEDULING, Severity.MEDIUM, scheduling.getWarnings());

                weeks.add(weeklyPlan(scheduling.getScheduledWeek(), volume, phase, periodization,
                        distribution.getCounts().getQuality()));
            }

            // Step 5: Deload weeks
            if (options.isSkipDeload()) {
                log.info("Step 5: Deload weeks skipped by request");
            } else {
                log.info("Step 5: Applying deload weeks...");
                weeks = applyDeloadWeeks(config, periodization, weeks, randomFor(options), warnings);
            }

            // Step 6: Assemble plan
            log.info("Step 6: Assembling training plan...");
            TrainingPlan plan = TrainingPlan.builder()
                    .id(newPlanId())
                    .configuration(config)
                    .weeks(List.copyOf(weeks))
                    .metadata(metadata(weeks, periodization))
                    .build();

            // Step 7: Whole-plan validation
            log.info("Step 7: Validating complete plan...");
            List<String> planErrors = validatePlan(plan, volumes, warnings);
            if (!planErrors.isEmpty()) {
                log.warn("Generated plan failed validation: {}", planErrors);
                return PlanGenerationResult.failure(planErrors, warnings.list(), validation);
            }

            log.info("Plan {} generated: {} weeks, {} km total, {} warning(s)", plan.getId(), plan.totalWeeks(),
                    DistanceUtil.roundOneDecimal(plan.getMetadata().getTotalDistanceKm()), warnings.size());
            return PlanGenerationResult.builder()
                    .success(true)
                    .plan(plan)
                    .warnings(warnings.list())
                    .validationResult(validation)
                    .build();

        } catch (RuntimeException e) {
            log.error("Plan generation failed", e);
            return PlanGenerationResult.failure(List.of("Plan generation failed: " + e.getMessage()),
                    warnings.list(), validation);
        }
    }

    private static WeeklyPlan weeklyPlan(ScheduledWeek scheduled, WeeklyVolume volume, TrainingPhase phase,
                                         PhasePeriodization periodization, int qualityCount) {
        double distance = 0;
        int duration = 0;
        for (DailyWorkout day : scheduled.getDays()) {
            if (day.isTraining()) {
                distance += day.getWorkout().getDistanceKm();
                duration += day.getWorkout().getDurationMinutes();
            }
        }
        distance = DistanceUtil.roundOneDecimal(distance);

        List<String> notes = new ArrayList<>(volume.getNotes());
        notes.addAll(scheduled.getSchedulingNotes());

        String focus = periodization.configurationFor(phase)
                .map(PhaseConfiguration::getFocus)
                .orElse(phase.displayName() + " phase training");

        return WeeklyPlan.builder()
                .weekNumber(scheduled.getWeekNumber())
                .phase(phase)
                .deloadWeek(false)
                .volume(volume)
                .days(scheduled.getDays())
                .distanceKm(distance)
                .distanceMiles(DistanceUtil.roundOneDecimal(DistanceUtil.toMiles(distance)))
                .durationMinutes(duration)
                .workoutCount(scheduled.trainingDayCount())
                .qualityWorkoutCount(qualityCount)
                .rotation(scheduled.getRotation())
                .focus(focus)
                .notes(List.copyOf(notes))
                .build();
    }

    private List<WeeklyPlan> applyDeloadWeeks(PlanConfiguration config, PhasePeriodization periodization,
                                              List<WeeklyPlan> weeks, Random random, Warnings warnings) {
        DeloadSchedulingResult deloads = deloadScheduler.scheduleDeloadWeeks(config, periodization);
        warnings.addAll(GenerationStep.DELOAD, Severity.MEDIUM, deloads.getWarnings());
        warnings.addAll(GenerationStep.DELOAD, Severity.LOW, deloads.getRecommendations());

        Map<Integer, DeloadWeekConfiguration> applicable = deloads.applicableDeloadWeeks().stream()
                .collect(Collectors.toMap(DeloadWeekConfiguration::getWeekNumber, Function.identity()));
        log.debug("Deload weeks scheduled: {}, applied: {}", deloads.totalDeloadWeeks(), applicable.keySet());

        List<WeeklyPlan> result = new ArrayList<>();
        for (WeeklyPlan week : weeks) {
            DeloadWeekConfiguration deload = applicable.get(week.getWeekNumber());
            result.add(deload == null ? week : applyDeload(week, deload, random));
        }
        return result;
    }

    private WeeklyPlan applyDeload(WeeklyPlan week, DeloadWeekConfiguration deload, Random random) {
        double reduction = deload.getVolumeReduction();
        List<DeloadWorkoutModification> modifications =
                deloadScheduler.modifyWorkoutsForDeload(week.getDays(), reduction, random);

        double distance = DistanceUtil.roundOneDecimal(week.getDistanceKm() * (1 - reduction));
        List<String> notes = new ArrayList<>();
        notes.add(("Volume reduced by " + Math.round(reduction * 100) + "% for recovery. "
                + String.join(" ", deload.getSchedulingNotes())).trim());
        notes.addAll(week.getNotes());

        return week.toBuilder()
                .deloadWeek(true)
                .distanceKm(distance)
                .distanceMiles(DistanceUtil.roundOneDecimal(DistanceUtil.toMiles(distance)))
                .durationMinutes((int) Math.round(week.getDurationMinutes() * (1 - reduction * 0.8)))
                .focus(DELOAD_FOCUS)
                .notes(List.copyOf(notes))
                .deloadModifications(modifications)
                .build();
    }

    private static PlanMetadata metadata(List<WeeklyPlan> weeks, PhasePeriodization periodization) {
        double totalKm = 0;
        int totalWorkouts = 0;
        int trainingDays = 0;
        int totalMinutes = 0;
        int easy = 0;
        int longRuns = 0;
        int quality = 0;
        int rest = 0;

        for (WeeklyPlan week : weeks) {
            totalKm += week.getDistanceKm();
            totalWorkouts += week.getWorkoutCount();
            totalMinutes += week.getDurationMinutes();
            for (DailyWorkout day : week.getDays()) {
                if (!day.isTraining()) {
                    rest++;
                    continue;
                }
                trainingDays++;
                switch (day.getWorkout().getType()) {
                    case EASY -> easy++;
                    case LONG -> longRuns++;
                    case QUALITY -> quality++;
                    default -> rest++;
                }
            }
        }
        totalKm = DistanceUtil.roundOneDecimal(totalKm);

        return PlanMetadata.builder()
                .totalDistanceKm(totalKm)
                .totalDistanceMiles(DistanceUtil.roundOneDecimal(DistanceUtil.toMiles(totalKm)))
                .totalWorkouts(totalWorkouts)
                .totalTrainingDays(trainingDays)
                .totalRestDays(weeks.size() * 7 - trainingDays)
                .createdAt(Instant.now())
                .estimatedWeeklyMinutes(weeks.isEmpty() ? 0 : Math.round((float) totalMinutes / weeks.size()))
                .workoutTypeDistribution(new WorkoutTypeDistribution(easy, longRuns, quality, rest))
                .phaseDistribution(new PhaseDistribution(
                        periodization.durationOf(TrainingPhase.BASE),
                        periodization.durationOf(TrainingPhase.BUILD),
                        periodization.durationOf(TrainingPhase.PEAK),
                        periodization.durationOf(TrainingPhase.TAPER)))
                .build();
    }

    /**
     * Whole-plan checks. Returns blocking errors; advisory findings go to {@code warnings}.
     */
    private static List<String> validatePlan(TrainingPlan plan, List<WeeklyVolume> volumes, Warnings warnings) {
        List<String> errors = new ArrayList<>();
        PlanConfiguration config = plan.getConfiguration();

        if (plan.totalWeeks() != config.getProgramLength()) {
            errors.add("Plan has " + plan.totalWeeks() + " weeks but configuration specifies "
                    + config.getProgramLength());
        }

        for (WeeklyPlan week : plan.getWeeks()) {
            if (week.getDays().size() != 7) {
                errors.add("Week " + week.getWeekNumber() + " does not have 7 days");
            }
            int trainingDays = week.trainingDayCount();
            if (trainingDays != config.getTrainingDaysPerWeek()) {
                warnings.add(GenerationStep.PLAN_VALIDATION, Severity.MEDIUM, "Week " + week.getWeekNumber()
                        + " has " + trainingDays + " training days, expected " + config.getTrainingDaysPerWeek());
            }
        }

        Set<Integer> deloadVolumeWeeks = new HashSet<>();
        for (WeeklyVolume volume : volumes) {
            if (volume.isDeloadWeek()) {
                deloadVolumeWeeks.add(volume.getWeekNumber());
            }
        }
        List<WeeklyPlan> weeks = plan.getWeeks();
        for (int i = 1; i < weeks.size(); i++) {
            WeeklyPlan previous = weeks.get(i - 1);
            WeeklyPlan current = weeks.get(i);
            if (previous.isDeloadWeek() || current.isDeloadWeek()
                    || deloadVolumeWeeks.contains(previous.getWeekNumber())
                    || deloadVolumeWeeks.contains(current.getWeekNumber())
                    || previous.getDistanceKm() <= 0) {
                continue;
            }
            double increase = (current.getDistanceKm() - previous.getDistanceKm()) / previous.getDistanceKm();
            if (increase > MAX_PLAN_WEEKLY_INCREASE) {
                warnings.add(GenerationStep.PLAN_VALIDATION, Severity.HIGH, "Week " + current.getWeekNumber()
                        + ": " + Math.round(increase * 100) + "% volume increase exceeds 12% limit");
            }
        }

        PlanMetadata metadata = plan.getMetadata();
        if (metadata.getTotalWorkouts() > 0) {
            double qualityShare = (double) metadata.getWorkoutTypeDistribution().getQuality()
                    / metadata.getTotalWorkouts();
            if (qualityShare > MAX_QUALITY_SHARE) {
                warnings.add(GenerationStep.PLAN_VALIDATION, Severity.MEDIUM, "Quality workouts represent "
                        + Math.round(qualityShare * 100) + "% of total workouts, exceeding recommended 20%");
            }
        }

        warnings.addAll(GenerationStep.PLAN_VALIDATION, Severity.MEDIUM, qualitySpacingIssues(weeks));
        return errors;
    }

    /**
     * Flags a quality session late in one week followed by another early in the next with less than two days between.
     */
    static List<String> qualitySpacingIssues(List<WeeklyPlan> weeks) {
        List<String> issues = new ArrayList<>();
        for (int i = 1; i < weeks.size(); i++) {
            List<DayOfWeek> previous = weeks.get(i - 1).daysWith(WorkoutType.QUALITY);
            List<DayOfWeek> current = weeks.get(i).daysWith(WorkoutType.QUALITY);
            if (previous.isEmpty() || current.isEmpty()) {
                continue;
            }
            DayOfWeek last = previous.get(previous.size() - 1);
            DayOfWeek first = current.get(0);
            int gap = 7 - last.ordinal() + first.ordinal();
            if (gap < 2) {
                issues.add("Weeks " + weeks.get(i - 1).getWeekNumber() + "-" + weeks.get(i).getWeekNumber()
                        + ": quality workouts on " + DayOfWeekUtil.displayName(last) + " and "
                        + DayOfWeekUtil.displayName(first) + " are less than 48 hours apart");
            }
        }
        return issues;
    }

    private static Random randomFor(PlanGenerationOptions options) {
        return options.getRandomSeed() != null ? new Random(options.getRandomSeed()) : new Random();
    }

    static String newPlanId() {
        return "plan_" + Instant.now().toEpochMilli() + "_"
                + Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
    }

    /**
     * Ordered warning list that drops repeats of the same message from the same step.
     */
    private static final class Warnings {
        private final List<PlanWarning> warnings = new ArrayList<>();
        private final Set<String> seen = new HashSet<>();

        void add(GenerationStep step, Severity severity, String message) {
            if (seen.add(step + "|" + message)) {
                warnings.add(new PlanWarning(step, severity, message));
            }
        }

        void addAll(GenerationStep step, Severity severity, List<String> messages) {
            for (String message : messages) {
                add(step, severity, message);
            }
        }

        int size() {
            return warnings.size();
        }

        List<PlanWarning> list() {
            return List.copyOf(warnings);
        }
    }
}
