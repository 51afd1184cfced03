/* (C)2026 */
package com.ammann.intervals.model;

import java.util.Objects;

/**
 * A scheduled program: its name and daily time slot.
 *
 * <p>The name is the natural key joined against {@link IntervalRecord}. Only the
 * {@code (name, range)} pair is unique within the program store; two programs may share
 * a name, which the integrity validator reports as a data-quality error.
 *
 * @param name program name as supplied by the caller
 * @param range daily time slot
 */
public record Program(String name, TimeRange range) {

    public Program {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(range, "range");
    }
}
