package com.trainingplan.generator.scheduling;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trainingplan.generator.distribution.PaceGuidance;
import com.trainingplan.generator.distribution.Workout;
import com.trainingplan.generator.model.PaceMethod;
import com.trainingplan.generator.model.QualityWorkoutType;
import com.trainingplan.generator.model.TrainingPhase;
import com.trainingplan.generator.model.WorkoutType;
import com.trainingplan.generator.util.DayOfWeekUtil;

/**
 * Places a week's workouts onto days.
 *
 * Order of placement: long run on its configured day, the quality session on the first open day at
 * least two days from the long run (else the first open day), then easy runs on the remaining open
 * days in calendar order.
 */
public class WeeklyScheduler {

    private static final Logger log = LoggerFactory.getLogger(WeeklyScheduler.class);

    private static final QualityWorkoutType[] ROTATION = QualityWorkoutType.values();

    public SchedulingResult scheduleWeek(int weekNumber, SchedulingConstraints constraints, List<Workout> workouts,
                                         TrainingPhase phase) {
        return scheduleWeek(weekNumber, constraints, workouts, phase, null);
    }

    public SchedulingResult scheduleWeek(int weekNumber, SchedulingConstraints constraints, List<Workout> workouts,
                                         TrainingPhase phase, PaceMethod paceMethod) {
        ConstraintValidation feasibility = validateConstraints(constraints);
        if (!feasibility.isValid()) {
            log.debug("Week {}: constraints infeasible: {}", weekNumber, feasibility.getErrors());
            return new SchedulingResult(false, null, feasibility.getErrors(), feasibility.getWarnings());
        }

        List<String> warnings = new ArrayList<>(feasibility.getWarnings());
        List<String> notes = new ArrayList<>();
        DailyWorkout[] days = new DailyWorkout[7];
        for (DayOfWeek day : DayOfWeekUtil.WEEK) {
            days[day.ordinal()] = DailyWorkout.empty(day, constraints.isRestDay(day));
        }

        QualityWorkoutRotation rotation = rotation(weekNumber);
        DayOfWeek longRunDay = constraints.getLongRunDay();

        firstOfType(workouts, WorkoutType.LONG).ifPresent(longRun -> {
            days[longRunDay.ordinal()] = DailyWorkout.builder().day(longRunDay).restDay(false).workout(longRun).build();
            notes.add("Long run scheduled on " + DayOfWeekUtil.displayName(longRunDay));
        });

        Optional<Workout> quality = firstOfType(workouts, WorkoutType.QUALITY);
        if (quality.isPresent()) {
            Optional<DayOfWeek> qualityDay = findQualityDay(constraints, days);
            if (qualityDay.isPresent()) {
                DayOfWeek day = qualityDay.get();
                Workout enhanced = enhanceQualityWorkout(quality.get(), rotation.getQualityType(), phase, paceMethod);
                days[day.ordinal()] = DailyWorkout.builder().day(day).restDay(false).workout(enhanced).build();
                notes.add(rotation.getQualityType().key() + " workout scheduled on " + DayOfWeekUtil.displayName(day));
            } else {
                warnings.add("Could not find optimal day for quality workout with adequate recovery");
            }
        }

        placeEasyRuns(days, workouts, constraints, notes);

        List<DailyWorkout> schedule = List.of(days);
        List<String> violations = validateSchedule(schedule, constraints);

        ScheduledWeek week = ScheduledWeek.builder()
                .weekNumber(weekNumber)
                .days(schedule)
                .rotation(rotation)
                .schedulingNotes(List.copyOf(notes))
                .constraintViolations(violations)
                .build();

        return new SchedulingResult(violations.isEmpty(), week, violations, List.copyOf(warnings));
    }

    /**
     * Checks that the constraints can be satisfied at all.
     */
    public ConstraintValidation validateConstraints(SchedulingConstraints constraints) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        int available = 7 - new HashSet<>(constraints.getRestDays()).size();
        if (available < constraints.getTrainingDaysPerWeek()) {
            errors.add("Not enough available days: " + available + " available, "
                    + constraints.getTrainingDaysPerWeek() + " required");
        }
        if (constraints.isRestDay(constraints.getLongRunDay())) {
            errors.add("Long run day (" + DayOfWeekUtil.displayName(constraints.getLongRunDay())
                    + ") conflicts with rest day preference");
        }
        if (DayOfWeekUtil.hasConsecutiveDays(constraints.getRestDays())) {
            warnings.add("Consecutive rest days may disrupt training rhythm");
        }
        if (constraints.getTrainingDaysPerWeek() > 6) {
            warnings.add("Training 7 days per week increases injury risk - consider at least one rest day");
        }
        return new ConstraintValidation(errors.isEmpty(), List.copyOf(errors), List.copyOf(warnings));
    }

    /**
     * Rotation for a week: tempo, threshold, intervals, hills, fartlek, repeating from week 1.
     */
    public static QualityWorkoutRotation rotation(int weekNumber) {
        int index = Math.floorMod(weekNumber - 1, ROTATION.length);
        QualityWorkoutType current = ROTATION[index];
        QualityWorkoutType next = ROTATION[(index + 1) % ROTATION.length];
        String description = current.getWorkoutName() + ": " + current.getDescription() + " (" + current.getPurpose() + ")";
        return new QualityWorkoutRotation(weekNumber, current, description, next);
    }

    public static QualityWorkoutType nextQualityType(int weekNumber) {
        return rotation(weekNumber + 1).getQualityType();
    }

    public static List<QualityWorkoutRotation> rotationSchedule(int startWeek, int numberOfWeeks) {
        List<QualityWorkoutRotation> schedule = new ArrayList<>();
        for (int week = startWeek; week < startWeek + numberOfWeeks; week++) {
            schedule.add(rotation(week));
        }
        return schedule;
    }

    /**
     * Rewrites a distributed quality workout for the rotation sub-type and phase. Distance and duration are kept.
     */
    public static Workout enhanceQualityWorkout(Workout workout, QualityWorkoutType type, TrainingPhase phase,
                                                PaceMethod paceMethod) {
        return workout.toBuilder()
                .type(WorkoutType.QUALITY)
                .qualityType(type)
                .intensity(type.getZone())
                .description(type.getWorkoutName() + " - " + QualityWorkoutGuide.description(type, phase))
                .paceGuidance(PaceGuidance.withMethod(QualityWorkoutGuide.paceGuidance(type, phase), paceMethod))
                .recoveryHours(type.getRecoveryHours())
                .build();
    }

    private static Optional<DayOfWeek> findQualityDay(SchedulingConstraints constraints, DailyWorkout[] days) {
        List<DayOfWeek> open = openDays(constraints, days);
        if (open.isEmpty()) {
            return Optional.empty();
        }
        int minimumGap = constraints.minimumRecoveryDays();
        return open.stream()
                .filter(day -> DayOfWeekUtil.daysBetween(day, constraints.getLongRunDay()) >= minimumGap)
                .findFirst()
                .or(() -> Optional.of(open.get(0)));
    }

    private static void placeEasyRuns(DailyWorkout[] days, List<Workout> workouts, SchedulingConstraints constraints,
                                      List<String> notes) {
        List<Workout> easyRuns = workouts.stream().filter(w -> w.getType() == WorkoutType.EASY).toList();
        List<DayOfWeek> open = openDays(constraints, days);

        int scheduled = 0;
        for (DailyWorkout day : days) {
            if (day.isTraining()) {
                scheduled++;
            }
        }
        int needed = Math.max(0, constraints.getTrainingDaysPerWeek() - scheduled);
        int toPlace = Math.min(easyRuns.size(), Math.min(open.size(), needed));

        for (int i = 0; i < toPlace; i++) {
            DayOfWeek day = open.get(i);
            days[day.ordinal()] = DailyWorkout.builder().day(day).restDay(false).workout(easyRuns.get(i)).build();
            notes.add("Easy run scheduled on " + DayOfWeekUtil.displayName(day));
        }
        if (easyRuns.size() > toPlace) {
            notes.add("Note: " + (easyRuns.size() - toPlace)
                    + " easy workouts not scheduled due to training day limits");
        }
    }

    private static List<DayOfWeek> openDays(SchedulingConstraints constraints, DailyWorkout[] days) {
        List<DayOfWeek> open = new ArrayList<>();
        for (DayOfWeek day : DayOfWeekUtil.WEEK) {
            if (!constraints.isRestDay(day) && days[day.ordinal()].getWorkout() == null) {
                open.add(day);
            }
        }
        return open;
    }

    /**
     * Rule violations of a finished week: training-day count, worked rest days, quality sessions closer than the recovery window.
     */
    public List<String> validateSchedule(List<DailyWorkout> days, SchedulingConstraints constraints) {
        List<String> violations = new ArrayList<>();

        long scheduled = days.stream().filter(DailyWorkout::isTraining).count();
        if (scheduled != constraints.getTrainingDaysPerWeek()) {
            violations.add("Scheduled " + scheduled + " training days, expected " + constraints.getTrainingDaysPerWeek());
        }

        for (DayOfWeek restDay : new HashSet<>(constraints.getRestDays())) {
            DailyWorkout day = days.get(restDay.ordinal());
            if (!day.isRestDay() || day.getWorkout() != null) {
                violations.add("Rest day violation: " + DayOfWeekUtil.displayName(restDay) + " has a scheduled workout");
            }
        }

        List<DayOfWeek> qualityDays = days.stream()
                .filter(d -> d.isTraining() && d.getWorkout().getType() == WorkoutType.QUALITY)
                .map(DailyWorkout::getDay)
                .toList();
        for (int i = 0; i < qualityDays.size(); i++) {
            for (int j = i + 1; j < qualityDays.size(); j++) {
                if (DayOfWeekUtil.daysBetween(qualityDays.get(i), qualityDays.get(j)) < constraints.minimumRecoveryDays()) {
                    violations.add("Insufficient recovery between quality workouts (less than "
                            + constraints.getMinimumRecoveryHours() + " hours)");
                }
            }
        }
        return List.copyOf(violations);
    }

    private static Optional<Workout> firstOfType(List<Workout> workouts, WorkoutType type) {
        return workouts.stream().filter(w -> w.getType() == type).findFirst();
    }
}
