package com.trainingplan.generator.scheduling;

import com.trainingplan.generator.model.QualityWorkoutType;
import com.trainingplan.generator.model.TrainingPhase;

import lombok.experimental.UtilityClass;

/**
 * Phase-specific wording for each quality workout sub-type.
 */
@UtilityClass
class QualityWorkoutGuide {

    static String description(QualityWorkoutType type, TrainingPhase phase) {
        return switch (type) {
            case TEMPO -> switch (phase) {
                case BASE -> "Steady tempo effort to build lactate threshold";
                case BUILD -> "Progressive tempo run with race pace segments";
                case PEAK -> "Race pace tempo with goal pace practice";
                case TAPER -> "Short tempo segments to maintain sharpness";
            };
            case THRESHOLD -> switch (phase) {
                case BASE -> "Broken threshold efforts to develop lactate buffering";
                case BUILD -> "Progressive threshold intervals with race pace focus";
                case PEAK -> "Race-specific threshold intervals for power";
                case TAPER -> "Short threshold segments for neuromuscular activation";
            };
            case INTERVALS -> switch (phase) {
                case BASE -> "Short intervals to introduce speed work";
                case BUILD -> "VO2 max intervals at 5K-10K pace";
                case PEAK -> "Race-specific interval training";
                case TAPER -> "Short, sharp intervals for race preparation";
            };
            case HILLS -> switch (phase) {
                case BASE -> "Hill repeats for strength and form development";
                case BUILD -> "Progressive hill intervals for power";
                case PEAK -> "Hill training for race-specific strength";
                case TAPER -> "Short hill strides for activation";
            };
            case FARTLEK -> switch (phase) {
                case BASE -> "Playful speed changes to develop pace variety";
                case BUILD -> "Structured fartlek with race pace surges";
                case PEAK -> "Race simulation fartlek with tactical surges";
                case TAPER -> "Short, fun pickups to maintain leg speed";
            };
        };
    }

    static String paceGuidance(QualityWorkoutType type, TrainingPhase phase) {
        return switch (type) {
            case TEMPO -> switch (phase) {
                case BASE -> "Comfortably hard - sustainable for 20-30 minutes";
                case BUILD -> "Lactate threshold pace - hard but controlled";
                case PEAK -> "Goal race pace for race-specific adaptation";
                case TAPER -> "Moderate effort - focus on feel rather than pace";
            };
            case THRESHOLD -> switch (phase) {
                case BASE -> "Threshold pace with short recoveries - comfortably hard";
                case BUILD -> "Lactate threshold pace - maintain across all intervals";
                case PEAK -> "Goal race pace with race-specific recovery periods";
                case TAPER -> "Threshold effort but shorter duration - feel-based";
            };
            case INTERVALS -> switch (phase) {
                case BASE -> "10K pace with full recovery between repeats";
                case BUILD -> "5K pace with moderate recovery intervals";
                case PEAK -> "Goal race pace with race-specific recovery";
                case TAPER -> "Slightly faster than race pace, short duration";
            };
            case HILLS -> switch (phase) {
                case BASE -> "Moderate effort uphill - focus on form";
                case BUILD -> "Hard effort uphill - 5K effort level";
                case PEAK -> "Strong uphill effort with quick turnover";
                case TAPER -> "Controlled effort - activation rather than stress";
            };
            case FARTLEK -> switch (phase) {
                case BASE -> "Vary effort by feel - mix easy with moderate surges";
                case BUILD -> "Include 5K-10K pace surges with easy recovery";
                case PEAK -> "Practice race tactics with goal pace pickups";
                case TAPER -> "Light, playful surges - focus on leg turnover";
            };
        };
    }
}
