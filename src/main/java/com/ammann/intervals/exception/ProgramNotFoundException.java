/* (C)2026 */
package com.ammann.intervals.exception;

/**
 * Raised when an update targets a program name that is not in the schedule.
 *
 * <p>Mapped to HTTP 404 (Not Found) by {@link GlobalExceptionHandler}.
 */
public class ProgramNotFoundException extends ApiException {

    public ProgramNotFoundException(String programName) {
        super(String.format("Program '%s' not found", programName));
    }
}
