package com.trainingplan.generator.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

import lombok.experimental.UtilityClass;

@UtilityClass
public class DistanceUtil {

    public static final double KM_TO_MILES = 0.621371;

    /**
     * Half-up rounding to one decimal place.
     */
    public static double roundOneDecimal(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    public static double toMiles(double kilometres) {
        return kilometres * KM_TO_MILES;
    }

    /**
     * "12 km" for whole values, "12.5 km" otherwise.
     */
    public static String formatKm(double kilometres) {
        double rounded = roundOneDecimal(kilometres);
        if (rounded == Math.rint(rounded)) {
            return (long) rounded + " km";
        }
        return rounded + " km";
    }
}
