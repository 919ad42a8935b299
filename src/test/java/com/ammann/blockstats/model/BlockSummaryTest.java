/* (C)2026 */
package com.ammann.blockstats.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.blockstats.support.TestDataFactory;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class BlockSummaryTest {

    @Test
    void wellFormedSummaryHasNoProblem() {
        assertThat(new BlockSummary(1, 1_700_000_000L, 0, 0).problem()).isNull();
    }

    @Test
    void negativeFieldsAreReported() {
        assertThat(new BlockSummary(-1, 10, 1, 1).problem()).contains("block number");
        assertThat(new BlockSummary(1, -10, 1, 1).problem()).contains("timestamp");
        assertThat(new BlockSummary(1, 10, -1, 1).problem()).contains("transaction count");
        assertThat(new BlockSummary(1, 10, 1, -1).problem()).contains("gas used");
    }

    @Test
    void blockRowProjectsToSummary() {
        Block block = TestDataFactory.createBlock(42, 1_700_000_000L, 150, 12_000_000);

        assertThat(block.toSummary())
                .isEqualTo(new BlockSummary(42, 1_700_000_000L, 150, 12_000_000));
    }

    @Test
    void missingColumnsProduceRejectedSummary() {
        Block block = new Block(7L, 1_700_000_000L, null, 5L);

        assertThat(block.toSummary().problem()).contains("transaction count");
    }

    @Test
    void snapshotsCompareMetricsIgnoringComputationTime() {
        StatSnapshot first = new StatSnapshot(1.5, 10, 0.6, 10, 3, 4, false, Instant.EPOCH);
        StatSnapshot later =
                new StatSnapshot(1.5, 10, 0.6, 10, 3, 4, false, Instant.EPOCH.plusSeconds(5));
        StatSnapshot different = new StatSnapshot(2.0, 10, 0.6, 10, 3, 4, false, Instant.EPOCH);

        assertThat(first.sameMetricsAs(later)).isTrue();
        assertThat(first.sameMetricsAs(different)).isFalse();
        assertThat(first.sameMetricsAs(null)).isFalse();
    }
}
