/* (C)2026 */
package com.ammann.intervals.exception;

import com.ammann.intervals.model.TimeRange;

/**
 * Raised when a mutation would store a {@code (name, range)} pair that already exists.
 *
 * <p>Mapped to HTTP 409 (Conflict) by {@link GlobalExceptionHandler}.
 */
public class DuplicateProgramException extends ApiException {

    public DuplicateProgramException(String programName, TimeRange range) {
        super(String.format("Program '%s' already scheduled at %s", programName, range));
    }
}
