package com.trainingplan.generator.util;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import lombok.experimental.UtilityClass;

/**
 * Day-of-week arithmetic on a Monday-first week.
 */
@UtilityClass
public class DayOfWeekUtil {

    /**
     * Monday through Sunday.
     */
    public static final List<DayOfWeek> WEEK = List.of(DayOfWeek.values());

    /**
     * Circular distance in days between two weekdays, wrapping at the week boundary.
     * Symmetric, zero for equal days, at most 3.
     */
    public static int daysBetween(DayOfWeek first, DayOfWeek second) {
        int a = first.ordinal();
        int b = second.ordinal();
        int forward = Math.floorMod(b - a, 7);
        int backward = Math.floorMod(a - b, 7);
        return Math.min(forward, backward);
    }

    public static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    /**
     * "MONDAY" -> "Monday".
     */
    public static String displayName(DayOfWeek day) {
        return day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    /**
     * Parses a full or three-letter English day name, case-insensitive.
     */
    public static Optional<DayOfWeek> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (DayOfWeek day : DayOfWeek.values()) {
            if (day.name().equals(normalized) || (normalized.length() >= 3 && day.name().startsWith(normalized))) {
                return Optional.of(day);
            }
        }
        return Optional.empty();
    }

    /**
     * True when any two of the given days are adjacent, including Sunday followed by Monday.
     */
    public static boolean hasConsecutiveDays(Collection<DayOfWeek> days) {
        List<DayOfWeek> distinct = days.stream().filter(d -> d != null).distinct().sorted().toList();
        if (distinct.size() < 2) {
            return false;
        }
        for (DayOfWeek day : distinct) {
            if (distinct.contains(day.plus(1))) {
                return true;
            }
        }
        return false;
    }
}
