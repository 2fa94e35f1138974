package com.trainingplan.generator.periodization;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trainingplan.generator.model.RaceDistance;
import com.trainingplan.generator.model.TrainingPhase;

/**
 * Splits a program into base, build, peak and taper phases.
 *
 * Each phase gets {@code floor(totalWeeks * share)} weeks, raised to the phase minimum
 * (or to one week when the program is shorter than the sum of minimums). The remaining
 * difference is reconciled on base/build: a shortfall grows the larger of the two (ties go
 * to build); a surplus shrinks the larger one still above its floor (ties go to build),
 * then peak, then taper. No phase ever drops below its floor.
 */
public class PhasePeriodizer {

    private static final Logger log = LoggerFactory.getLogger(PhasePeriodizer.class);

    /** Base, build, peak, taper shares per race. */
    private static final Map<RaceDistance, double[]> PHASE_SHARES = new EnumMap<>(RaceDistance.class);

    private static final Map<TrainingPhase, Integer> MINIMUM_WEEKS = new EnumMap<>(TrainingPhase.class);

    private static final Map<TrainingPhase, PhaseCharacteristics> CHARACTERISTICS = new EnumMap<>(TrainingPhase.class);

    static {
        PHASE_SHARES.put(RaceDistance.FIVE_K, new double[] {0.30, 0.40, 0.20, 0.10});
        PHASE_SHARES.put(RaceDistance.TEN_K, new double[] {0.35, 0.35, 0.20, 0.10});
        PHASE_SHARES.put(RaceDistance.HALF_MARATHON, new double[] {0.40, 0.30, 0.20, 0.10});
        PHASE_SHARES.put(RaceDistance.MARATHON, new double[] {0.45, 0.25, 0.20, 0.10});

        MINIMUM_WEEKS.put(TrainingPhase.BASE, 3);
        MINIMUM_WEEKS.put(TrainingPhase.BUILD, 3);
        MINIMUM_WEEKS.put(TrainingPhase.PEAK, 2);
        MINIMUM_WEEKS.put(TrainingPhase.TAPER, 1);

        CHARACTERISTICS.put(TrainingPhase.BASE, new PhaseCharacteristics("high", "low", "high",
                List.of("easy", "long", "tempo (limited)"),
                List.of("Aerobic enzyme development", "Capillary density increase", "Mitochondrial adaptation",
                        "Injury prevention", "Movement efficiency"),
                List.of("Weekly volume progression", "Aerobic pace improvement", "Injury prevention",
                        "Consistency")));
        CHARACTERISTICS.put(TrainingPhase.BUILD, new PhaseCharacteristics("moderate", "high", "moderate",
                List.of("tempo", "intervals", "hills", "long runs"),
                List.of("Lactate threshold improvement", "VO2 max development", "Neuromuscular power",
                        "Running economy", "Metabolic flexibility"),
                List.of("Threshold pace improvement", "VO2 max intervals", "Hill running strength",
                        "Recovery between sessions")));
        CHARACTERISTICS.put(TrainingPhase.PEAK, new PhaseCharacteristics("moderate", "high", "moderate",
                List.of("race pace", "tune-up races", "specific intervals"),
                List.of("Race-specific fitness", "Neuromuscular sharpening", "Pacing practice",
                        "Mental preparation", "Peak performance"),
                List.of("Race pace sustainability", "Tune-up race performance", "Confidence building",
                        "Technical refinement")));
        CHARACTERISTICS.put(TrainingPhase.TAPER, new PhaseCharacteristics("low", "moderate", "high",
                List.of("short intervals", "strides", "easy runs"),
                List.of("Fatigue dissipation", "Glycogen supercompensation", "Neuromuscular freshness",
                        "Mental readiness", "Peak race form"),
                List.of("Feeling of freshness", "Maintained speed", "Reduced fatigue", "Race readiness")));
    }

    public static int minimumWeeks(TrainingPhase phase) {
        return MINIMUM_WEEKS.get(phase);
    }

    public static int totalMinimumWeeks() {
        return MINIMUM_WEEKS.values().stream().mapToInt(Integer::intValue).sum();
    }

    public static PhaseCharacteristics characteristics(TrainingPhase phase) {
        return CHARACTERISTICS.get(phase);
    }

    public PhasePeriodization periodize(int totalWeeks, RaceDistance race) {
        if (race == null) {
            throw new IllegalArgumentException("Race distance is required");
        }
        if (totalWeeks < TrainingPhase.values().length) {
            throw new IllegalArgumentException(
                    "Program of " + totalWeeks + " weeks cannot hold " + TrainingPhase.values().length + " phases");
        }

        int[] durations = phaseDurations(totalWeeks, race);

        List<PhaseConfiguration> phases = new ArrayList<>();
        int week = 1;
        for (TrainingPhase phase : TrainingPhase.values()) {
            int duration = durations[phase.ordinal()];
            phases.add(describe(phase)
                    .phase(phase)
                    .startWeek(week)
                    .endWeek(week + duration - 1)
                    .durationWeeks(duration)
                    .percentage(duration * 100.0 / totalWeeks)
                    .build());
            week += duration;
        }

        log.debug("Periodized {} weeks for {}: base={} build={} peak={} taper={}", totalWeeks, race,
                durations[0], durations[1], durations[2], durations[3]);

        return new PhasePeriodization(totalWeeks, race, List.copyOf(phases), transitions(phases));
    }

    /**
     * Phase lookup by week number.
     *
     * @throws IllegalArgumentException when the week is outside the program
     */
    public TrainingPhase phaseForWeek(int week, PhasePeriodization periodization) {
        return periodization.phaseForWeek(week);
    }

    public PeriodizationValidation validate(PhasePeriodization periodization) {
        List<String> warnings = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        boolean valid = true;

        for (PhaseConfiguration phase : periodization.getPhases()) {
            int minimum = minimumWeeks(phase.getPhase());
            if (phase.getDurationWeeks() < minimum) {
                warnings.add(phase.getPhase().displayName() + " phase (" + phase.getDurationWeeks()
                        + " weeks) is shorter than recommended minimum (" + minimum + " weeks)");
                valid = false;
            }
        }

        periodization.configurationFor(TrainingPhase.BASE)
                .filter(base -> base.getPercentage() < 25)
                .ifPresent(base -> {
                    warnings.add("Base phase may be too short for adequate aerobic development");
                    recommendations.add("Consider extending base phase for better injury prevention");
                });

        if (periodization.getTotalWeeks() < 8) {
            warnings.add("Program may be too short for optimal adaptation");
            recommendations.add("Consider extending program length for better results");
        }

        return new PeriodizationValidation(valid, warnings, recommendations);
    }

    /**
     * Race-specific advice on phase balance for a given program length.
     */
    public List<String> recommendations(RaceDistance race, int totalWeeks) {
        List<String> advice = new ArrayList<>();
        switch (race) {
            case FIVE_K -> {
                advice.add("5K training benefits from more speed work in build phase");
                if (totalWeeks < 6) {
                    advice.add("Consider minimal base phase and focus on speed development");
                }
            }
            case TEN_K -> {
                advice.add("10K requires balanced aerobic and anaerobic development");
                if (totalWeeks < 8) {
                    advice.add("Compress base phase but maintain build phase duration");
                }
            }
            case HALF_MARATHON -> {
                advice.add("Half marathon needs substantial aerobic base");
                if (totalWeeks < 10) {
                    advice.add("Prioritize base building over peak phase");
                }
            }
            case MARATHON -> {
                advice.add("Marathon requires extensive base building phase");
                if (totalWeeks < 12) {
                    advice.add("Extend base phase at expense of peak phase");
                    advice.add("Consider longer program for optimal marathon preparation");
                }
            }
        }
        return advice;
    }

    private static int[] phaseDurations(int totalWeeks, RaceDistance race) {
        double[] shares = PHASE_SHARES.get(race);
        boolean roomForMinimums = totalWeeks >= totalMinimumWeeks();

        int[] floors = new int[4];
        int[] durations = new int[4];
        for (TrainingPhase phase : TrainingPhase.values()) {
            int i = phase.ordinal();
            floors[i] = roomForMinimums ? minimumWeeks(phase) : 1;
            durations[i] = Math.max((int) Math.floor(totalWeeks * shares[i]), floors[i]);
        }

        int base = TrainingPhase.BASE.ordinal();
        int build = TrainingPhase.BUILD.ordinal();

        while (sum(durations) < totalWeeks) {
            durations[durations[base] > durations[build] ? base : build]++;
        }

        while (sum(durations) > totalWeeks) {
            boolean baseShrinkable = durations[base] > floors[base];
            boolean buildShrinkable = durations[build] > floors[build];
            int target;
            if (buildShrinkable && (!baseShrinkable || durations[build] >= durations[base])) {
                target = build;
            } else if (baseShrinkable) {
                target = base;
            } else if (durations[TrainingPhase.PEAK.ordinal()] > floors[TrainingPhase.PEAK.ordinal()]) {
                target = TrainingPhase.PEAK.ordinal();
            } else if (durations[TrainingPhase.TAPER.ordinal()] > floors[TrainingPhase.TAPER.ordinal()]) {
                target = TrainingPhase.TAPER.ordinal();
            } else {
                throw new IllegalStateException("Cannot fit phases into " + totalWeeks + " weeks");
            }
            durations[target]--;
        }
        return durations;
    }

    private static int sum(int[] values) {
        int total = 0;
        for (int v : values) {
            total += v;
        }
        return total;
    }

    private static PhaseConfiguration.PhaseConfigurationBuilder describe(TrainingPhase phase) {
        return switch (phase) {
            case BASE -> PhaseConfiguration.builder()
                    .focus("Aerobic Development & Base Building")
                    .characteristics(List.of("High volume, low intensity training",
                            "Focus on aerobic enzyme development", "Injury prevention and movement efficiency",
                            "Gradual volume progression", "Limited quality work (tempo runs)"))
                    .workoutEmphasis(List.of("easy runs", "long runs", "occasional tempo"));
            case BUILD -> PhaseConfiguration.builder()
                    .focus("Lactate Threshold & VO2 Max Development")
                    .characteristics(List.of("Moderate volume with increased intensity",
                            "Lactate threshold development", "VO2 max improvement through intervals",
                            "Hill training for strength and power", "Progressive long run development"))
                    .workoutEmphasis(List.of("tempo runs", "intervals", "hill repeats", "long runs"));
            case PEAK -> PhaseConfiguration.builder()
                    .focus("Race-Specific Fitness & Sharpening")
                    .characteristics(List.of("Race-specific pace training", "Neuromuscular sharpening",
                            "Tune-up races and time trials", "Mental preparation and confidence building",
                            "Peak fitness development"))
                    .workoutEmphasis(List.of("race pace intervals", "tune-up races", "specific workouts"));
            case TAPER -> PhaseConfiguration.builder()
                    .focus("Recovery & Race Preparation")
                    .characteristics(List.of("Significant volume reduction (20-30%)",
                            "Maintained intensity with reduced duration", "Enhanced recovery and freshness",
                            "Mental preparation and race strategy", "Peak race readiness"))
                    .workoutEmphasis(List.of("short intervals", "strides", "easy runs", "race prep"));
        };
    }

    private static List<PhaseTransition> transitions(List<PhaseConfiguration> phases) {
        List<PhaseTransition> transitions = new ArrayList<>();
        for (int i = 0; i < phases.size() - 1; i++) {
            TrainingPhase from = phases.get(i).getPhase();
            PhaseConfiguration next = phases.get(i + 1);
            transitions.add(new PhaseTransition(from, next.getPhase(), next.getStartWeek(),
                    transitionAdjustments(from), transitionWarnings(from)));
        }
        return List.copyOf(transitions);
    }

    private static List<String> transitionAdjustments(TrainingPhase from) {
        return switch (from) {
            case BASE -> List.of("Introduce tempo runs and intervals gradually",
                    "Maintain easy run volume while adding quality",
                    "Ensure adequate recovery between hard sessions",
                    "Monitor for signs of overreaching");
            case BUILD -> List.of("Shift focus to race-specific paces",
                    "Reduce overall volume slightly",
                    "Increase workout specificity",
                    "Add tune-up races or time trials");
            case PEAK -> List.of("Reduce training volume by 20-30%",
                    "Maintain intensity but reduce duration",
                    "Increase recovery emphasis",
                    "Focus on race preparation and strategy");
            case TAPER -> List.of();
        };
    }

    private static List<String> transitionWarnings(TrainingPhase from) {
        return switch (from) {
            case BASE -> List.of("Avoid sudden intensity increases",
                    "Watch for overuse injuries as intensity increases",
                    "Maintain consistency in easy running");
            case BUILD -> List.of("Don't sacrifice recovery for extra intensity",
                    "Avoid trying new workouts close to race",
                    "Monitor fatigue levels carefully");
            case PEAK -> List.of("Resist urge to maintain high volume",
                    "Trust the taper process",
                    "Avoid new activities or changes");
            case TAPER -> List.of();
        };
    }
}
