package com.trainingplan.generator.scheduling;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Optional;

import com.trainingplan.generator.model.WorkoutType;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A week's workouts placed on Monday through Sunday.
 */
@Value
@Builder
public class ScheduledWeek {

    int weekNumber;

    /**
     * Always seven entries, Monday first.
     */
    @NonNull
    List<DailyWorkout> days;

    @NonNull
    QualityWorkoutRotation rotation;

    @NonNull
    List<String> schedulingNotes;

    @NonNull
    List<String> constraintViolations;

    public DailyWorkout day(DayOfWeek day) {
        return days.get(day.ordinal());
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

    public Optional<DayOfWeek> longRunDay() {
        return daysWith(WorkoutType.LONG).stream().findFirst();
    }
}
