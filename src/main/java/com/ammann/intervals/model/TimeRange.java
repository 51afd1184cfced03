/* (C)2026 */
package com.ammann.intervals.model;

import com.ammann.intervals.exception.ValidationException;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Daily time-of-day slot of a program, at minute precision.
 *
 * <p>There is no ordering constraint between {@code start} and {@code end}: an end
 * earlier than the start denotes a slot that runs past midnight (e.g. 23:30 to 00:15).
 * Instances are immutable; an update replaces the whole range.
 *
 * <p>Times are exchanged either as zero-padded 24-hour {@code HH:MM} strings or as
 * minutes since midnight (0 to 1439). Both forms round-trip without loss.
 *
 * @param start first minute of the slot
 * @param end minute at which the slot ends
 */
public record TimeRange(LocalTime start, LocalTime end) {

    public static final int MINUTES_PER_DAY = 24 * 60;

    private static final DateTimeFormatter HH_MM =
            DateTimeFormatter.ofPattern("HH:mm").withResolverStyle(ResolverStyle.STRICT);

    public TimeRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        start = start.truncatedTo(ChronoUnit.MINUTES);
        end = end.truncatedTo(ChronoUnit.MINUTES);
    }

    /**
     * Parses a range from two {@code HH:MM} strings.
     *
     * @throws ValidationException if either value is not a zero-padded 24-hour time
     */
    public static TimeRange parse(String start, String end) {
        return new TimeRange(parseTime("start", start), parseTime("end", end));
    }

    /**
     * Builds a range from minutes since midnight.
     *
     * @throws ValidationException if either value is outside 0..1439
     */
    public static TimeRange ofMinutes(int startMinute, int endMinute) {
        return new TimeRange(fromMinute("start", startMinute), fromMinute("end", endMinute));
    }

    public int startMinute() {
        return toMinute(start);
    }

    public int endMinute() {
        return toMinute(end);
    }

    /** {@code true} when the slot crosses midnight. */
    public boolean wrapsMidnight() {
        return end.isBefore(start);
    }

    public String startText() {
        return start.format(HH_MM);
    }

    public String endText() {
        return end.format(HH_MM);
    }

    /**
     * Parses a single {@code HH:MM} value.
     *
     * @param field name reported in the error message
     * @param value text to parse
     * @return the parsed time
     */
    public static LocalTime parseTime(String field, String value) {
        if (value == null || value.isBlank()) {
            throw ValidationException.invalidParameter(field, value, "a time in HH:MM format");
        }
        try {
            return LocalTime.parse(value.trim(), HH_MM);
        } catch (DateTimeParseException e) {
            throw new ValidationException(
                    String.format(
                            "Invalid parameter '%s': got '%s', expected a time in HH:MM format",
                            field, value),
                    e);
        }
    }

    private static LocalTime fromMinute(String field, int minute) {
        if (minute < 0 || minute >= MINUTES_PER_DAY) {
            throw ValidationException.invalidParameter(field, minute, "minutes in 0..1439");
        }
        return LocalTime.of(minute / 60, minute % 60);
    }

    private static int toMinute(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }

    @Override
    public String toString() {
        return startText() + "-" + endText();
    }
}
