package com.trainingplan.generator.distribution;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trainingplan.generator.model.PaceMethod;
import com.trainingplan.generator.model.PlanConfiguration;
import com.trainingplan.generator.model.RaceDistance;
import com.trainingplan.generator.model.TrainingPhase;
import com.trainingplan.generator.model.WorkoutType;
import com.trainingplan.generator.periodization.PhaseCharacteristics;
import com.trainingplan.generator.periodization.PhasePeriodizer;
import com.trainingplan.generator.util.DistanceUtil;

/**
 * Turns a weekly distance target into a bag of easy, long and quality workouts.
 *
 * Distance math is phase-independent; the phase only changes quality-workout wording.
 */
public class WorkoutDistributor {

    private static final Logger log = LoggerFactory.getLogger(WorkoutDistributor.class);

    private static final Map<Integer, List<WorkoutType>> TEMPLATES = Map.of(
            3, List.of(WorkoutType.EASY, WorkoutType.QUALITY, WorkoutType.LONG),
            4, List.of(WorkoutType.EASY, WorkoutType.QUALITY, WorkoutType.EASY, WorkoutType.LONG),
            5, List.of(WorkoutType.EASY, WorkoutType.QUALITY, WorkoutType.EASY, WorkoutType.EASY,
                    WorkoutType.LONG),
            6, List.of(WorkoutType.EASY, WorkoutType.QUALITY, WorkoutType.EASY, WorkoutType.EASY,
                    WorkoutType.EASY, WorkoutType.LONG),
            7, List.of(WorkoutType.EASY, WorkoutType.QUALITY, WorkoutType.EASY, WorkoutType.EASY,
                    WorkoutType.EASY, WorkoutType.EASY, WorkoutType.LONG));

    /** Easy, long, quality distance multipliers. */
    private static final Map<RaceDistance, double[]> SCALING = new EnumMap<>(RaceDistance.class);

    static {
        SCALING.put(RaceDistance.FIVE_K, new double[] {1.0, 2.0, 0.8});
        SCALING.put(RaceDistance.TEN_K, new double[] {1.2, 2.2, 1.0});
        SCALING.put(RaceDistance.HALF_MARATHON, new double[] {1.5, 2.5, 1.2});
        SCALING.put(RaceDistance.MARATHON, new double[] {2.0, 3.0, 1.5});
    }

    private static final double MIN_EASY_KM = 3.0;
    private static final double MIN_LONG_KM = 8.0;
    private static final double MIN_QUALITY_KM = 4.0;

    private static final double EASY_PACE = 6.0;
    private static final double LONG_PACE = 6.5;
    private static final double QUALITY_PACE = 5.0;

    private static final double MIN_EASY_SHARE = 0.6;
    private static final int MAX_QUALITY_PER_WEEK = 2;

    /**
     * Workout categories for the given training-day count, in template order.
     *
     * @throws IllegalArgumentException for counts outside 3..7
     */
    public static List<WorkoutType> template(int trainingDays) {
        List<WorkoutType> template = TEMPLATES.get(trainingDays);
        if (template == null) {
            throw new IllegalArgumentException(
                    "Invalid training days per week: " + trainingDays + ". Must be between 3-7.");
        }
        return template;
    }

    public WeeklyWorkoutDistribution distribute(PlanConfiguration config, double weeklyDistanceKm,
                                                TrainingPhase phase) {
        int days = config.getTrainingDaysPerWeek();
        List<WorkoutType> template = template(days);
        Map<WorkoutType, Double> distances = workoutDistances(config.getRaceDistance(), weeklyDistanceKm, days);

        List<Workout> workouts = new ArrayList<>();
        for (WorkoutType type : template) {
            workouts.add(createWorkout(type, distances.get(type), phase, config.getPaceMethod()));
        }

        WorkoutCounts counts = new WorkoutCounts(
                count(template, WorkoutType.EASY),
                count(template, WorkoutType.LONG),
                count(template, WorkoutType.QUALITY),
                7 - days);

        log.debug("Distributed {} km over {} days ({} phase): easy={} long={} quality={}", weeklyDistanceKm,
                days, phase, distances.get(WorkoutType.EASY), distances.get(WorkoutType.LONG),
                distances.get(WorkoutType.QUALITY));

        return WeeklyWorkoutDistribution.builder()
                .trainingDays(days)
                .weeklyDistanceKm(weeklyDistanceKm)
                .phase(phase)
                .counts(counts)
                .workouts(List.copyOf(workouts))
                .build();
    }

    /**
     * Per-workout distance by category: {@code round1((weekly / days) * multiplier)}, raised to the category minimum.
     */
    public Map<WorkoutType, Double> workoutDistances(RaceDistance race, double weeklyDistanceKm, int trainingDays) {
        double[] scaling = SCALING.get(race);
        double perSession = weeklyDistanceKm / trainingDays;

        Map<WorkoutType, Double> distances = new EnumMap<>(WorkoutType.class);
        distances.put(WorkoutType.EASY, Math.max(DistanceUtil.roundOneDecimal(perSession * scaling[0]), MIN_EASY_KM));
        distances.put(WorkoutType.LONG, Math.max(DistanceUtil.roundOneDecimal(perSession * scaling[1]), MIN_LONG_KM));
        distances.put(WorkoutType.QUALITY,
                Math.max(DistanceUtil.roundOneDecimal(perSession * scaling[2]), MIN_QUALITY_KM));
        distances.put(WorkoutType.REST, 0.0);
        return distances;
    }

    public DistributionValidation validate(WeeklyWorkoutDistribution distribution) {
        List<String> warnings = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        boolean valid = true;
        WorkoutCounts counts = distribution.getCounts();
        int total = distribution.getTrainingDays();

        if (total < 3) {
            warnings.add("Less than 3 training days per week may limit training effectiveness");
            valid = false;
        }
        if (total > 0 && (double) counts.getEasy() / total < MIN_EASY_SHARE) {
            warnings.add("Consider more easy runs to follow the 80/20 training principle");
        }
        if (counts.getQuality() > MAX_QUALITY_PER_WEEK) {
            warnings.add("More than 2 quality workouts per week may increase injury risk");
            recommendations.add("Limit quality workouts to 1-2 per week for optimal recovery");
        }
        if (counts.getLongRuns() == 0) {
            warnings.add("No long run scheduled - important for endurance development");
            valid = false;
        }
        if (counts.getRest() == 0) {
            warnings.add("No rest days scheduled - recovery is essential for adaptation");
            recommendations.add("Include at least 1 rest day per week");
        }
        return new DistributionValidation(valid, warnings, recommendations);
    }

    private static Workout createWorkout(WorkoutType type, double distanceKm, TrainingPhase phase,
                                         PaceMethod paceMethod) {
        return Workout.builder()
                .type(type)
                .distanceKm(distanceKm)
                .durationMinutes(duration(type, distanceKm))
                .intensity(type.getDefaultZone())
                .description(description(type, distanceKm, phase))
                .paceGuidance(PaceGuidance.withMethod(paceGuidance(type, phase), paceMethod))
                .recoveryHours(type.getRecoveryHours())
                .build();
    }

    static int duration(WorkoutType type, double distanceKm) {
        double pace = switch (type) {
            case EASY -> EASY_PACE;
            case LONG -> LONG_PACE;
            case QUALITY -> QUALITY_PACE;
            case REST -> 0;
        };
        return (int) Math.round(distanceKm * pace);
    }

    private static String description(WorkoutType type, double distanceKm, TrainingPhase phase) {
        String distance = DistanceUtil.formatKm(distanceKm);
        return switch (type) {
            case EASY -> "Easy run - " + distance + " at conversational pace";
            case LONG -> "Long run - " + distance + " at steady, comfortable effort";
            case QUALITY -> qualityDescription(distance, phase);
            case REST -> "Rest day - complete rest or light cross-training";
        };
    }

    private static String qualityDescription(String distance, TrainingPhase phase) {
        String adaptation = PhasePeriodizer.characteristics(phase).getPrimaryAdaptations().get(0);
        return switch (phase) {
            case BASE -> "Tempo run - " + distance + " at comfortably hard pace (" + adaptation + ")";
            case BUILD -> "Interval workout - " + distance + " total with speed intervals (" + adaptation + ")";
            case PEAK -> "Race pace workout - " + distance + " at goal race pace (" + adaptation + ")";
            case TAPER -> "Sharpening workout - " + distance + " with short, fast intervals (" + adaptation + ")";
        };
    }

    private static String paceGuidance(WorkoutType type, TrainingPhase phase) {
        return switch (type) {
            case EASY -> "Conversational pace - you should be able to speak in full sentences";
            case LONG -> "Steady effort - start easy and can build to moderate effort in later miles";
            case QUALITY -> qualityPaceGuidance(phase);
            case REST -> "Complete rest or very light activity";
        };
    }

    private static String qualityPaceGuidance(TrainingPhase phase) {
        PhaseCharacteristics characteristics = PhasePeriodizer.characteristics(phase);
        String focus = " (Focus: " + characteristics.getKeyMetrics().get(0) + ")";
        return switch (phase) {
            case BASE -> "Comfortably hard - sustainable for 20-40 minutes" + focus;
            case BUILD -> "Hard effort - 5K to 10K race pace with recovery intervals" + focus;
            case PEAK -> "Goal race pace - practice your target race effort" + focus;
            case TAPER -> "Short, sharp efforts - faster than race pace but brief" + focus;
        };
    }

    private static int count(List<WorkoutType> template, WorkoutType type) {
        return (int) template.stream().filter(t -> t == type).count();
    }
}
