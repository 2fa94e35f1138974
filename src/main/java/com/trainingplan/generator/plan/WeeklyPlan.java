package com.trainingplan.generator.plan;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Optional;

import com.trainingplan.generator.deload.DeloadWorkoutModification;
import com.trainingplan.generator.model.TrainingPhase;
import com.trainingplan.generator.model.WorkoutType;
import com.trainingplan.generator.progression.WeeklyVolume;
import com.trainingplan.generator.scheduling.DailyWorkout;
import com.trainingplan.generator.scheduling.QualityWorkoutRotation;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One week of a finished plan.
 *
 * {@code days} holds the workouts as scheduled. In a deload week the reductions are kept separately in
 * {@code deloadModifications}; {@link #effectiveDays()} gives the days with those reductions applied.
 */
@Value
@Builder(toBuilder = true)
public class WeeklyPlan {

    int weekNumber;

    @NonNull
    TrainingPhase phase;

    /**
     * True only when a deload was applied to this week.
     */
    boolean deloadWeek;

    @NonNull
    WeeklyVolume volume;

    @NonNull
    List<DailyWorkout> days;

    double distanceKm;

    double distanceMiles;

    int durationMinutes;

    int workoutCount;

    int qualityWorkoutCount;

    @NonNull
    QualityWorkoutRotation rotation;

    @NonNull
    String focus;

    @NonNull
    @Builder.Default
    List<String> notes = List.of();

    @NonNull
    @Builder.Default
    List<DeloadWorkoutModification> deloadModifications = List.of();

    public DailyWorkout day(DayOfWeek day) {
        return days.get(day.ordinal());
    }

    /**
     * Scheduled days with deload modifications overlaid. A skipped session becomes a rest day.
     */
    public List<DailyWorkout> effectiveDays() {
        if (deloadModifications.isEmpty()) {
            return days;
        }
        return days.stream()
                .map(day -> modificationFor(day.getDay())
                        .map(mod -> mod.isSkip()
                                ? DailyWorkout.empty(day.getDay(), true)
                                : day.toBuilder().workout(mod.getModifiedWorkout()).build())
                        .orElse(day))
                .toList();
    }

    public List<DayOfWeek> daysWith(WorkoutType type) {
        return days.stream()
                .filter(d -> d.isTraining() && d.getWorkout().getType() == type)
                .map(DailyWorkout::getDay)
                .toList();
    }

    public int trainingDayCount() {
        return (int) days.stream().filter(DailyWorkout::isTraining).count();
    }

    private Optional<DeloadWorkoutModification> modificationFor(DayOfWeek day) {
        return deloadModifications.stream().filter(m -> m.getDay() == day).findFirst();
    }
}
