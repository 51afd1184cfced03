/* (C)2026 */
package com.ammann.intervals.exception;

/**
 * Failure of the underlying program or interval store.
 *
 * <p>For mutations, both stores have been restored to their state before the call when
 * this is thrown. For validation, no partial report is produced.
 * Mapped to HTTP 503 (Service Unavailable) by {@link GlobalExceptionHandler}.
 */
public class StorageFailureException extends ApiException
{
    public StorageFailureException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
