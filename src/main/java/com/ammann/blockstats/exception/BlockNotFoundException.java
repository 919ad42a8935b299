package com.ammann.blockstats.exception;

/**
 * Exception indicating that a requested block number is not present in the store.
 *
 * <p>Mapped to HTTP 404 (Not Found) by {@link GlobalExceptionHandler}.
 */
public class BlockNotFoundException extends ApiException
{
    private final long blockNumber;

    public BlockNotFoundException(long blockNumber)
    {
        super("Block " + blockNumber + " not found");
        this.blockNumber = blockNumber;
    }

    public long getBlockNumber()
    {
        return blockNumber;
    }
}
