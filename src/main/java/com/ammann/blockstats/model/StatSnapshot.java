/* (C)2026 */
package com.ammann.blockstats.model;

import java.time.Instant;

/**
 * Immutable throughput figures computed over the current block window.
 *
 * <p>Shared read-only between the REST read path and every WebSocket subscriber.
 *
 * @param tps transactions per second over the window span
 * @param gasPerSecond gas consumed per second over the window span
 * @param shredInterval average seconds between two transactions
 * @param windowSize configured window capacity
 * @param blockCount number of blocks the figures were computed over
 * @param spanSeconds time span used as the divisor, in seconds
 * @param estimated whether the assumed block interval replaced a measured span
 * @param computedAt when the snapshot was produced
 */
public record StatSnapshot(
        double tps,
        double gasPerSecond,
        double shredInterval,
        int windowSize,
        int blockCount,
        double spanSeconds,
        boolean estimated,
        Instant computedAt) {

    /**
     * Compares only the derived metrics, ignoring {@link #computedAt()}.
     */
    public boolean sameMetricsAs(StatSnapshot other) {
        return other != null
                && Double.compare(tps, other.tps) == 0
                && Double.compare(gasPerSecond, other.gasPerSecond) == 0
                && Double.compare(shredInterval, other.shredInterval) == 0
                && Double.compare(spanSeconds, other.spanSeconds) == 0
                && windowSize == other.windowSize
                && blockCount == other.blockCount
                && estimated == other.estimated;
    }
}
