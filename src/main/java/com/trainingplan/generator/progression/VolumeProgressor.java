package com.trainingplan.generator.progression;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trainingplan.generator.model.ExperienceLevel;
import com.trainingplan.generator.model.RaceDistance;

/**
 * Computes the weekly distance sequence of a program using bounded progressive overload.
 */
public class VolumeProgressor {

    private static final Logger log = LoggerFactory.getLogger(VolumeProgressor.class);

    public static final double MAX_WEEKLY_INCREASE = 0.10;
    public static final double SAFE_WEEKLY_INCREASE = 0.08;
    public static final double AGGRESSIVE_THRESHOLD = 0.12;
    public static final double DELOAD_REDUCTION_MIN = 0.20;
    public static final double DELOAD_REDUCTION_MAX = 0.30;
    public static final int PLATEAU_WEEKS = 2;

    private static final double MIN_DELOAD_RATIO = 0.15;
    private static final double MAX_PLATEAU_RATIO = 0.30;

    /** Beginner, intermediate, advanced starting volume in km. */
    private static final Map<RaceDistance, int[]> STARTING_VOLUME = new EnumMap<>(RaceDistance.class);

    /** Beginner, intermediate, advanced weekly cap in km. */
    private static final Map<RaceDistance, int[]> MAXIMUM_VOLUME = new EnumMap<>(RaceDistance.class);

    static {
        STARTING_VOLUME.put(RaceDistance.FIVE_K, new int[] {24, 32, 40});
        STARTING_VOLUME.put(RaceDistance.TEN_K, new int[] {32, 40, 48});
        STARTING_VOLUME.put(RaceDistance.HALF_MARATHON, new int[] {40, 48, 64});
        STARTING_VOLUME.put(RaceDistance.MARATHON, new int[] {48, 64, 80});

        MAXIMUM_VOLUME.put(RaceDistance.FIVE_K, new int[] {56, 72, 88});
        MAXIMUM_VOLUME.put(RaceDistance.TEN_K, new int[] {72, 88, 104});
        MAXIMUM_VOLUME.put(RaceDistance.HALF_MARATHON, new int[] {88, 104, 128});
        MAXIMUM_VOLUME.put(RaceDistance.MARATHON, new int[] {104, 128, 160});
    }

    /**
     * Week 1 is never a deload week; afterwards every {@code cadence}-th week is.
     */
    public static boolean isDeloadWeek(int week, int cadence) {
        if (cadence <= 0) {
            throw new IllegalArgumentException("Deload cadence must be positive, got " + cadence);
        }
        return week > 1 && week % cadence == 0;
    }

    public int startingVolume(RaceDistance race, ExperienceLevel experience) {
        return STARTING_VOLUME.get(race)[experience.ordinal()];
    }

    public int maximumVolume(RaceDistance race, ExperienceLevel experience) {
        return MAXIMUM_VOLUME.get(race)[experience.ordinal()];
    }

    /**
     * Midpoint of the deload reduction range.
     */
    public static double defaultDeloadReduction() {
        return (DELOAD_REDUCTION_MIN + DELOAD_REDUCTION_MAX) / 2;
    }

    public int deloadVolume(double baseVolume, Double reduction) {
        double applied = reduction != null ? reduction : defaultDeloadReduction();
        return (int) Math.round(baseVolume * (1 - applied));
    }

    /**
     * One entry per week, 1..programLength.
     *
     * Non-deload weeks grow by 8%, or 9.6% once two consecutive increases have happened since the
     * last deload, capped at the race/experience maximum. The rounded result never exceeds
     * {@code floor(previous * 1.10)}. Deload weeks drop the carried volume by the range midpoint; the
     * week after a deload returns to the carried volume without an increase.
     */
    public List<WeeklyVolume> calculateWeeklyVolumes(RaceDistance race, int programLength, int deloadCadence,
                                                     ExperienceLevel experience) {
        int maximum = maximumVolume(race, experience);
        double currentVolume = startingVolume(race, experience);
        int consecutiveIncreases = 0;

        List<WeeklyVolume> volumes = new ArrayList<>();
        for (int week = 1; week <= programLength; week++) {
            if (isDeloadWeek(week, deloadCadence)) {
                double reduction = defaultDeloadReduction();
                volumes.add(WeeklyVolume.builder()
                        .weekNumber(week)
                        .baseVolume(currentVolume)
                        .adjustedVolume(deloadVolume(currentVolume, reduction))
                        .deloadWeek(true)
                        .progressionRate(-reduction)
                        .notes(List.of("Deload week: " + Math.round(reduction * 100) + "% volume reduction for recovery"))
                        .build());
                consecutiveIncreases = 0;
                continue;
            }

            WeeklyVolume previous = volumes.isEmpty() ? null : volumes.get(volumes.size() - 1);
            List<String> notes = new ArrayList<>();
            double rate = 0;
            int adjusted;

            if (previous == null || previous.isDeloadWeek()) {
                adjusted = (int) Math.round(currentVolume);
                if (previous != null) {
                    notes.add("Returning to pre-deload volume of " + adjusted + " km");
                }
            } else {
                int previousVolume = previous.getAdjustedVolume();
                rate = consecutiveIncreases >= PLATEAU_WEEKS
                        ? Math.min(MAX_WEEKLY_INCREASE, SAFE_WEEKLY_INCREASE * 1.2)
                        : SAFE_WEEKLY_INCREASE;
                double target = previousVolume * (1 + rate);

                if (target > maximum) {
                    target = maximum;
                    rate = (maximum - previousVolume) / (double) previousVolume;
                    notes.add("Volume capped at " + maximum + " km for safety");
                }

                adjusted = (int) Math.round(target);
                int ceiling = (int) Math.floor(previousVolume * (1 + MAX_WEEKLY_INCREASE));
                if (adjusted > ceiling) {
                    adjusted = ceiling;
                    notes.add("Rounded volume held at " + ceiling + " km to stay within the 10% limit");
                }
                consecutiveIncreases++;
            }

            volumes.add(WeeklyVolume.builder()
                    .weekNumber(week)
                    .baseVolume(currentVolume)
                    .adjustedVolume(adjusted)
                    .deloadWeek(false)
                    .progressionRate(rate)
                    .notes(List.copyOf(notes))
                    .build());
            currentVolume = adjusted;
        }

        log.debug("Calculated {} weekly volumes for {} ({}), peak {} km", volumes.size(), race, experience,
                volumes.stream().mapToInt(WeeklyVolume::getAdjustedVolume).max().orElse(0));
        return List.copyOf(volumes);
    }

    public ProgressionValidation validate(List<WeeklyVolume> volumes) {
        List<String> warnings = new ArrayList<>();
        List<String> adjustments = new ArrayList<>();
        boolean valid = true;
        int plateauWeeks = 0;

        for (int i = 1; i < volumes.size(); i++) {
            WeeklyVolume current = volumes.get(i);
            WeeklyVolume previous = volumes.get(i - 1);
            if (current.isDeloadWeek() || previous.isDeloadWeek()) {
                continue;
            }

            double increase = (current.getAdjustedVolume() - previous.getAdjustedVolume())
                    / (double) previous.getAdjustedVolume();
            if (increase > MAX_WEEKLY_INCREASE) {
                warnings.add("Week " + current.getWeekNumber() + ": " + Math.round(increase * 100)
                        + "% increase exceeds 10% safety limit");
                valid = false;
            }
            if (increase > AGGRESSIVE_THRESHOLD) {
                warnings.add("Week " + current.getWeekNumber() + ": " + Math.round(increase * 100)
                        + "% increase is aggressive - monitor recovery");
            }
            if (Math.abs(current.getAdjustedVolume() - previous.getAdjustedVolume()) < 1) {
                plateauWeeks++;
            }
        }

        long deloadWeeks = volumes.stream().filter(WeeklyVolume::isDeloadWeek).count();
        if (!volumes.isEmpty() && (double) deloadWeeks / volumes.size() < MIN_DELOAD_RATIO) {
            warnings.add("Consider more frequent deload weeks for better recovery");
        }
        if (plateauWeeks > volumes.size() * MAX_PLATEAU_RATIO) {
            adjustments.add("Consider more progressive volume increases for continued adaptation");
        }

        return new ProgressionValidation(valid, warnings, adjustments);
    }

    public ProgressionRecommendations recommendations(RaceDistance race) {
        Map<ExperienceLevel, Integer> starting = new EnumMap<>(ExperienceLevel.class);
        Map<ExperienceLevel, Integer> maximum = new EnumMap<>(ExperienceLevel.class);
        for (ExperienceLevel level : ExperienceLevel.values()) {
            starting.put(level, startingVolume(race, level));
            maximum.put(level, maximumVolume(race, level));
        }
        return new ProgressionRecommendations(
                race.getRecommendedMinimumWeeks(),
                race.getOptimalWeeks(),
                race.getMaximumWeeks(),
                Map.copyOf(starting),
                Map.copyOf(maximum),
                race == RaceDistance.MARATHON ? 3 : 4,
                SAFE_WEEKLY_INCREASE,
                MAX_WEEKLY_INCREASE);
    }
}
