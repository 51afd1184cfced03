/* (C)2026 */
package com.ammann.intervals.exception;

/**
 * Base unchecked exception for all application-level errors raised by the program
 * schedule and its interval bookkeeping.
 *
 * <p>Subclasses represent specific error categories (invalid input, duplicate or unknown
 * programs, storage failures) and are mapped to HTTP status codes by
 * {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }
    public ApiException(String message) {
        super(message);
    }
}
