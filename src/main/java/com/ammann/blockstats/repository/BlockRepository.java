/* (C)2026 */
package com.ammann.blockstats.repository;

import com.ammann.blockstats.model.Block;
import com.ammann.blockstats.model.BlockSummary;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.control.ActivateRequestContext;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Read-only queries against the {@code blocks} table.
 *
 * <p>Called from request threads, the notifier's listen loop and scheduler threads alike, so
 * every query activates a request context if none is active.
 */
@ApplicationScoped
@ActivateRequestContext
public class BlockRepository implements PanacheRepositoryBase<Block, Long> {

    /**
     * Latest blocks by number, newest first.
     *
     * @param limit maximum number of blocks
     * @param offset number of blocks to skip from the newest
     */
    public List<Block> findLatest(int limit, int offset) {
        if (limit <= 0) {
            return List.of();
        }
        return find("ORDER BY number DESC").range(offset, offset + limit - 1).list();
    }

    public Optional<Block> findByNumber(long number) {
        return findByIdOptional(number);
    }

    /**
     * Summaries of the {@code limit} highest-numbered blocks, newest first.
     */
    public List<BlockSummary> findLatestSummaries(int limit) {
        return findLatest(limit, 0).stream().map(Block::toSummary).toList();
    }

    /**
     * Highest committed block number.
     *
     * @return the number, or empty if the table has no rows
     */
    public OptionalLong findLatestBlockNumber() {
        Long latest =
                getEntityManager()
                        .createQuery("SELECT MAX(b.number) FROM Block b", Long.class)
                        .getSingleResult();
        return latest == null ? OptionalLong.empty() : OptionalLong.of(latest);
    }

    public long countBlocks() {
        return count();
    }
}
