/* (C)2026 */
package com.ammann.blockstats.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Read-only mapping of a committed block row.
 *
 * <p>The {@code blocks} table is owned by the ingestion pipeline; this service never writes
 * to it. Only the columns needed for summaries and block detail responses are mapped.
 */
@Entity
@Table(name = Block.TABLE_NAME)
public class Block extends PanacheEntityBase {

    public static final String TABLE_NAME = "blocks";

    @Id
    @Column(name = "number", nullable = false)
    public Long number;

    @Column(name = "hash", nullable = false)
    public String hash;

    @Column(name = "parent_hash", nullable = false)
    public String parentHash;

    /**
     * Block timestamp in seconds since Unix epoch.
     */
    @Column(name = "timestamp", nullable = false)
    public Long timestamp;

    @Column(name = "transaction_count", nullable = false)
    public Long transactionCount;

    @Column(name = "gas_used", nullable = false)
    public Long gasUsed;

    @Column(name = "gas_limit")
    public Long gasLimit;

    @Column(name = "base_fee_per_gas")
    public Long baseFeePerGas;

    @Column(name = "miner")
    public String miner;

    @Column(name = "size")
    public Long size;

    public Block() {}

    public Block(Long number, Long timestamp, Long transactionCount, Long gasUsed) {
        this.number = number;
        this.timestamp = timestamp;
        this.transactionCount = transactionCount;
        this.gasUsed = gasUsed;
    }

    /**
     * Projects this row onto the fields the aggregator works with.
     *
     * <p>Missing columns are mapped to {@code -1} so that the aggregator rejects the summary
     * instead of silently counting zero.
     */
    public BlockSummary toSummary() {
        return new BlockSummary(
                valueOrInvalid(number),
                valueOrInvalid(timestamp),
                valueOrInvalid(transactionCount),
                valueOrInvalid(gasUsed));
    }

    private static long valueOrInvalid(Long value) {
        return value == null ? -1L : value;
    }

    @Override
    public String toString() {
        return "Block{number=" + number + ", timestamp=" + timestamp
                + ", transactionCount=" + transactionCount + ", gasUsed=" + gasUsed + '}';
    }
}
