/* (C)2026 */
package com.ammann.blockstats.model;

/**
 * The per-block figures the sliding window aggregates.
 *
 * <p>Construction does not validate: summaries come from the ingestion side and may be
 * malformed. Use {@link #problem()} before counting one.
 *
 * @param number block number
 * @param timestamp block timestamp in seconds since Unix epoch
 * @param txCount number of transactions in the block
 * @param gasUsed gas consumed by the block
 */
public record BlockSummary(long number, long timestamp, long txCount, long gasUsed) {

    /**
     * Describes why this summary cannot be aggregated.
     *
     * @return a human-readable reason, or {@code null} if the summary is well formed
     */
    public String problem() {
        if (number < 0) {
            return "negative block number " + number;
        }
        if (timestamp < 0) {
            return "negative timestamp " + timestamp;
        }
        if (txCount < 0) {
            return "negative transaction count " + txCount;
        }
        if (gasUsed < 0) {
            return "negative gas used " + gasUsed;
        }
        return null;
    }
}
