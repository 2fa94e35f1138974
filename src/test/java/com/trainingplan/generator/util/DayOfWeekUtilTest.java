package com.trainingplan.generator.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.DayOfWeek;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DayOfWeekUtil.
 */
class DayOfWeekUtilTest {

    @ParameterizedTest
    @CsvSource({
            "MONDAY, MONDAY, 0",
            "MONDAY, TUESDAY, 1",
            "MONDAY, THURSDAY, 3",
            "MONDAY, FRIDAY, 3",
            "MONDAY, SUNDAY, 1",
            "TUESDAY, SUNDAY, 2",
            "SATURDAY, TUESDAY, 3"
    })
    void testDaysBetween(DayOfWeek first, DayOfWeek second, int expected) {
        assertThat(DayOfWeekUtil.daysBetween(first, second)).isEqualTo(expected);
        assertThat(DayOfWeekUtil.daysBetween(second, first)).isEqualTo(expected);
    }

    @Test
    void testDaysBetweenNeverExceedsThree() {
        for (DayOfWeek a : DayOfWeek.values()) {
            for (DayOfWeek b : DayOfWeek.values()) {
                assertThat(DayOfWeekUtil.daysBetween(a, b)).isBetween(0, 3);
            }
        }
    }

    @Test
    void testHasConsecutiveDays() {
        assertThat(DayOfWeekUtil.hasConsecutiveDays(
                List.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY, DayOfWeek.FRIDAY))).isFalse();
        assertThat(DayOfWeekUtil.hasConsecutiveDays(
                List.of(DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY))).isTrue();
        assertThat(DayOfWeekUtil.hasConsecutiveDays(List.of(DayOfWeek.MONDAY))).isFalse();
        assertThat(DayOfWeekUtil.hasConsecutiveDays(List.of())).isFalse();
    }

    @Test
    void testHasConsecutiveDaysAcrossWeekBoundary() {
        assertThat(DayOfWeekUtil.hasConsecutiveDays(List.of(DayOfWeek.SUNDAY, DayOfWeek.MONDAY))).isTrue();
    }

    @ParameterizedTest
    @CsvSource({
            "Monday, MONDAY",
            "monday, MONDAY",
            "' SUNDAY ', SUNDAY",
            "Wed, WEDNESDAY",
            "thu, THURSDAY"
    })
    void testParse(String value, DayOfWeek expected) {
        assertThat(DayOfWeekUtil.parse(value)).contains(expected);
    }

    @Test
    void testParseRejectsUnknownNames() {
        assertThat(DayOfWeekUtil.parse("Funday")).isEmpty();
        assertThat(DayOfWeekUtil.parse("Mo")).isEmpty();
        assertThat(DayOfWeekUtil.parse("")).isEmpty();
        assertThat(DayOfWeekUtil.parse(null)).isEmpty();
    }

    @Test
    void testDisplayNameAndWeekend() {
        assertThat(DayOfWeekUtil.displayName(DayOfWeek.SATURDAY)).isEqualTo("Saturday");
        assertThat(DayOfWeekUtil.isWeekend(DayOfWeek.SATURDAY)).isTrue();
        assertThat(DayOfWeekUtil.isWeekend(DayOfWeek.SUNDAY)).isTrue();
        assertThat(DayOfWeekUtil.isWeekend(DayOfWeek.FRIDAY)).isFalse();
    }
}
