/* (C)2026 */
package com.ammann.intervals.model;

/**
 * Derived row holding the number of complete 15-minute intervals of a program.
 *
 * @param programName name of the program the count belongs to
 * @param intervalCount number of complete 15-minute buckets, never negative
 */
public record IntervalRecord(String programName, int intervalCount) {

    public IntervalRecord {
        if (intervalCount < 0) {
            throw new IllegalArgumentException(
                    "intervalCount must be >= 0, got: " + intervalCount);
        }
    }
}
