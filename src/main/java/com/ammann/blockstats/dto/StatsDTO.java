/* (C)2026 */
package com.ammann.blockstats.dto;

import com.ammann.blockstats.model.StatSnapshot;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Throughput statistics over the sliding block window.
 */
@Schema(description = "Live throughput statistics")
public record StatsDTO(
        @Schema(description = "Transactions per second") double tps,
        @Schema(description = "Gas consumed per second") double gasPerSecond,
        @Schema(description = "Average seconds between transactions") double shredInterval,
        @Schema(description = "Configured window size in blocks") int windowSize,
        @Schema(description = "Blocks the statistics were computed over") int blockCount,
        @Schema(description = "True if the assumed block interval was used (single block or non-advancing timestamps)")
                boolean estimated,
        @Schema(description = "When the statistics were computed") Instant computedAt) {

    public static StatsDTO from(StatSnapshot snapshot) {
        return new StatsDTO(
                snapshot.tps(),
                snapshot.gasPerSecond(),
                snapshot.shredInterval(),
                snapshot.windowSize(),
                snapshot.blockCount(),
                snapshot.estimated(),
                snapshot.computedAt());
    }
}
