/* (C)2026 */
package com.ammann.intervals.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.intervals.exception.ValidationException;
import java.time.LocalTime;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class TimeRangeTest {

    @ParameterizedTest
    @CsvSource({"00:00,0", "00:15,15", "09:00,540", "12:45,765", "23:59,1439"})
    void textAndMinutesRoundTrip(String text, int minutes) {
        TimeRange fromText = TimeRange.parse(text, text);
        TimeRange fromMinutes = TimeRange.ofMinutes(minutes, minutes);

        assertThat(fromText).isEqualTo(fromMinutes);
        assertThat(fromText.startMinute()).isEqualTo(minutes);
        assertThat(fromMinutes.startText()).isEqualTo(text);
    }

    @Test
    void everyMinuteOfTheDayRoundTrips() {
        for (int minute = 0; minute < TimeRange.MINUTES_PER_DAY; minute++) {
            TimeRange range = TimeRange.ofMinutes(minute, minute);
            assertThat(TimeRange.parse(range.startText(), range.endText())).isEqualTo(range);
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"9:00", "24:00", "12:60", "12:00:30", "noon", "", "  "})
    void rejectsMalformedTimes(String value) {
        assertThatThrownBy(() -> TimeRange.parse(value, "10:00"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("start");
    }

    @Test
    void rejectsMissingTime() {
        assertThatThrownBy(() -> TimeRange.parse("10:00", null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("end");
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 1440, 10_000})
    void rejectsMinutesOutsideTheDay(int minute) {
        assertThatThrownBy(() -> TimeRange.ofMinutes(0, minute))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("0..1439");
    }

    @Test
    void truncatesSecondsToTheMinute() {
        TimeRange range = new TimeRange(LocalTime.of(9, 0, 45), LocalTime.of(10, 30, 59));

        assertThat(range).isEqualTo(TimeRange.parse("09:00", "10:30"));
    }

    @Test
    void detectsMidnightWraparound() {
        assertThat(TimeRange.parse("23:30", "00:15").wrapsMidnight()).isTrue();
        assertThat(TimeRange.parse("09:00", "10:00").wrapsMidnight()).isFalse();
        assertThat(TimeRange.parse("12:00", "12:00").wrapsMidnight()).isFalse();
    }

    @Test
    void rendersAsStartDashEnd() {
        assertThat(TimeRange.parse("23:00", "01:30")).hasToString("23:00-01:30");
    }
}
