/* (C)2026 */
package com.ammann.blockstats.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.blockstats.model.Block;
import com.ammann.blockstats.model.BlockSummary;
import com.ammann.blockstats.support.TestDataFactory;
import io.quarkus.test.TestTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import java.util.List;
import org.junit.jupiter.api.Test;

@QuarkusTest
class BlockRepositoryTest {

    private static final long T0 = 1_700_000_000L;

    @Inject
    BlockRepository repository;

    private void persistOutOfOrder() {
        Block.deleteAll();
        Block.persist(
                TestDataFactory.createBlock(3, T0 + 6, 30, 3_000),
                TestDataFactory.createBlock(1, T0, 10, 1_000),
                TestDataFactory.createBlock(5, T0 + 12, 50, 5_000),
                TestDataFactory.createBlock(2, T0 + 3, 20, 2_000),
                TestDataFactory.createBlock(4, T0 + 9, 40, 4_000));
    }

    @Test
    @TestTransaction
    void findLatestReturnsNewestFirst() {
        persistOutOfOrder();

        List<Block> latest = repository.findLatest(3, 0);

        assertThat(latest).extracting(block -> block.number).containsExactly(5L, 4L, 3L);
    }

    @Test
    @TestTransaction
    void findLatestHonoursOffset() {
        persistOutOfOrder();

        List<Block> page = repository.findLatest(2, 2);

        assertThat(page).extracting(block -> block.number).containsExactly(3L, 2L);
        assertThat(repository.findLatest(10, 5)).isEmpty();
    }

    @Test
    @TestTransaction
    void findLatestSummariesProjectsTheNewestRows() {
        persistOutOfOrder();

        List<BlockSummary> summaries = repository.findLatestSummaries(2);

        assertThat(summaries)
                .containsExactly(
                        new BlockSummary(5, T0 + 12, 50, 5_000),
                        new BlockSummary(4, T0 + 9, 40, 4_000));
    }

    @Test
    @TestTransaction
    void findLatestBlockNumberReturnsTheHighestNumber() {
        persistOutOfOrder();

        assertThat(repository.findLatestBlockNumber()).hasValue(5L);
        assertThat(repository.countBlocks()).isEqualTo(5L);
    }

    @Test
    @TestTransaction
    void emptyStoreHasNoLatestBlock() {
        Block.deleteAll();

        assertThat(repository.findLatestBlockNumber()).isEmpty();
        assertThat(repository.findLatest(10, 0)).isEmpty();
        assertThat(repository.countBlocks()).isZero();
    }

    @Test
    @TestTransaction
    void findByNumberLoadsAllColumns() {
        persistOutOfOrder();

        Block block = repository.findByNumber(4).orElseThrow();

        assertThat(block.hash).isEqualTo("0x4");
        assertThat(block.parentHash).isEqualTo("0x3");
        assertThat(block.transactionCount).isEqualTo(40L);
        assertThat(block.miner).isEqualTo("0xminer");
        assertThat(repository.findByNumber(99)).isEmpty();
    }
}
