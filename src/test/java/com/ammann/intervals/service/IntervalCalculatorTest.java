/* (C)2026 */
package com.ammann.intervals.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.intervals.model.TimeRange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Unit tests for {@link IntervalCalculator}, including the midnight wraparound and the
 * zero-length policy.
 */
class IntervalCalculatorTest
{

    @ParameterizedTest
    @CsvSource({
            "09:00,10:30,6",
            "23:30,00:15,3",
            "23:00,01:30,10",
            "12:00,12:10,0",
            "12:00,12:15,1",
            "18:00,00:00,24",
            "00:00,23:45,95",
            "00:15,00:00,95",
            "10:00,09:00,92",
            "12:00,12:29,1"
    })
    void countsCompleteQuarterHours(String start, String end, int expected)
    {
        assertThat(IntervalCalculator.count(TimeRange.parse(start, end))).isEqualTo(expected);
    }

    @Test
    void equalStartAndEndCountsZeroEverywhere()
    {
        for (int minute = 0; minute < TimeRange.MINUTES_PER_DAY; minute++) {
            assertThat(IntervalCalculator.count(TimeRange.ofMinutes(minute, minute))).isZero();
        }
    }

    @Test
    void fullDaySlotIsTreatedAsZeroLength()
    {
        assertThat(IntervalCalculator.count(TimeRange.parse("00:00", "00:00"))).isZero();
    }

    @Test
    void slotsShorterThanFifteenMinutesCountZero()
    {
        for (int start = 0; start < TimeRange.MINUTES_PER_DAY - 15; start += 7) {
            for (int length = 1; length < 15; length++) {
                TimeRange range = TimeRange.ofMinutes(start, start + length);
                assertThat(IntervalCalculator.count(range)).as("%s", range).isZero();
            }
        }
    }

    @Test
    void wraparoundDurationAddsBothSidesOfMidnight()
    {
        assertThat(IntervalCalculator.durationMinutes(TimeRange.parse("23:30", "00:15"))).isEqualTo(45);
        assertThat(IntervalCalculator.durationMinutes(TimeRange.parse("22:00", "06:00"))).isEqualTo(480);
    }

    @Test
    void countNeverExceedsBucketsInADay()
    {
        for (int start = 0; start < TimeRange.MINUTES_PER_DAY; start += 13) {
            for (int end = 0; end < TimeRange.MINUTES_PER_DAY; end += 11) {
                int count = IntervalCalculator.count(TimeRange.ofMinutes(start, end));
                assertThat(count).isBetween(0, 95);
            }
        }
    }
}
