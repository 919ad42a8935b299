package com.ammann.blockstats.exception;

/**
 * Exception indicating that no block has been aggregated yet, so no statistics exist.
 *
 * <p>Mapped to HTTP 404 (Not Found) by {@link GlobalExceptionHandler}.
 */
public class StatsUnavailableException extends ApiException
{
    public StatsUnavailableException()
    {
        super("No blocks found to calculate statistics");
    }
}
