package com.ammann.blockstats.exception;

/**
 * Exception indicating that the block store could not be reached.
 *
 * <p>Fatal when raised during startup; the bootstrap rethrows it so that the process exits
 * with a non-zero status.
 */
public class StoreUnavailableException extends ApiException
{
    public StoreUnavailableException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
