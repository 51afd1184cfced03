/* (C)2026 */
package com.ammann.intervals.service;

import com.ammann.intervals.model.TimeRange;

/**
 * Counts complete 15-minute intervals in a daily time slot.
 *
 * <p>Rules, in order:
 * <ol>
 *   <li>{@code start == end} yields 0. This also covers the literal full-day slot
 *       {@code 00:00-00:00}.</li>
 *   <li>{@code end > start}: the duration is {@code end - start}.</li>
 *   <li>{@code end < start}: the slot crosses midnight and the duration is the minutes left
 *       before midnight plus the minutes after it.</li>
 *   <li>The count is the duration divided by 15, truncated.</li>
 * </ol>
 *
 * <p>Total over all inputs and free of side effects. Shared by the synchronizer, which
 * writes the counts, and the integrity validator, which re-derives them.
 */
public final class IntervalCalculator {

    public static final int INTERVAL_MINUTES = 15;

    private IntervalCalculator() {}

    /**
     * Returns the number of complete 15-minute intervals in {@code range}.
     *
     * @param range daily time slot
     * @return interval count, never negative
     */
    public static int count(TimeRange range) {
        return durationMinutes(range) / INTERVAL_MINUTES;
    }

    /**
     * Returns the wraparound-aware length of {@code range} in minutes.
     *
     * @param range daily time slot
     * @return minutes in 0..1439
     */
    public static int durationMinutes(TimeRange range) {
        int start = range.startMinute();
        int end = range.endMinute();
        if (start == end) {
            return 0;
        }
        if (end > start) {
            return end - start;
        }
        return (TimeRange.MINUTES_PER_DAY - start) + end;
    }
}
