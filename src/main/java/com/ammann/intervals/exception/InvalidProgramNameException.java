/* (C)2026 */
package com.ammann.intervals.exception;

/**
 * Rejects a program name at the mutation boundary: empty, blank, or longer than the
 * configured maximum length.
 */
public class InvalidProgramNameException extends ValidationException {

    public InvalidProgramNameException(String message) {
        super(message);
    }

    public static InvalidProgramNameException blank() {
        return new InvalidProgramNameException("Program name must not be empty or blank");
    }

    public static InvalidProgramNameException tooLong(int length, int maxLength) {
        return new InvalidProgramNameException(
                String.format("Program name exceeds maximum length (%d characters): got %d",
                        maxLength, length));
    }
}
