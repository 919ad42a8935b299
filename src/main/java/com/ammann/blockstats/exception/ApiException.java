package com.ammann.blockstats.exception;

/**
 * Base unchecked exception for all application-level errors in the block stats service.
 *
 * <p>Subclasses represent specific error categories (validation, unknown blocks, store
 * outages) and are mapped to HTTP status codes by {@link GlobalExceptionHandler} or to
 * {@code error} messages by the subscription hub.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }
    public ApiException(String message) {
        super(message);
    }

    public ApiException(Throwable cause) {
        super(cause);
    }
}
