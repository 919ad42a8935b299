/* (C)2026 */
package com.ammann.blockstats.service;

import com.ammann.blockstats.model.BlockSummary;
import com.ammann.blockstats.model.StatSnapshot;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import org.jboss.logging.Logger;

/**
 * Incremental throughput statistics over the most recent N blocks.
 *
 * <p>The window is keyed by block number, so it is always in ascending order no matter in
 * which order blocks arrive (reorgs, push and poll delivering the same block, network jitter).
 * Transaction and gas totals are maintained by delta on insert, replace and evict.
 *
 * <p>All mutation goes through this instance's monitor; the lock only covers the in-memory
 * update and is never held while callers do I/O. Nothing in here throws into the caller:
 * malformed input is logged and skipped, and the previous snapshot stays in place. A window
 * whose timestamps do not advance is measured with the assumed block interval instead.
 *
 * <p>One instance is created per process by {@code AggregatorProducer} and injected where
 * needed.
 */
public class SlidingWindowAggregator {

    private static final Logger LOG = Logger.getLogger(SlidingWindowAggregator.class);

    /** Block interval assumed when the window holds a single block or its span is degenerate. */
    public static final Duration DEFAULT_ASSUMED_BLOCK_INTERVAL = Duration.ofSeconds(12);

    public static final int DEFAULT_WINDOW_SIZE = 10;

    /** Lower bound for the span divisor. */
    static final double MIN_SPAN_SECONDS = 1e-9;

    private final int windowSize;
    private final double assumedBlockIntervalSeconds;
    private final Clock clock;

    private final TreeMap<Long, BlockSummary> window = new TreeMap<>();
    private long totalTx;
    private long totalGas;
    private StatSnapshot snapshot;

    public SlidingWindowAggregator(int windowSize, Duration assumedBlockInterval, Clock clock) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("Window size must be positive, got " + windowSize);
        }
        if (assumedBlockInterval == null
                || assumedBlockInterval.isNegative()
                || assumedBlockInterval.isZero()) {
            throw new IllegalArgumentException(
                    "Assumed block interval must be positive, got " + assumedBlockInterval);
        }
        this.windowSize = windowSize;
        this.assumedBlockIntervalSeconds = assumedBlockInterval.toMillis() / 1000.0;
        this.clock = clock;
        LOG.infof(
                "Sliding window aggregator initialized (windowSize=%d, assumedBlockInterval=%s)",
                windowSize, assumedBlockInterval);
    }

    public SlidingWindowAggregator(int windowSize) {
        this(windowSize, DEFAULT_ASSUMED_BLOCK_INTERVAL, Clock.systemUTC());
    }

    /**
     * Adds a block to the window and recomputes the snapshot.
     *
     * <p>A block whose number is already in the window replaces the stored entry. A block
     * older than every entry of a full window is ignored, since it would be evicted at once.
     *
     * @param summary the block to add
     * @return {@code true} if the window changed
     */
    public synchronized boolean addBlock(BlockSummary summary) {
        if (summary == null) {
            LOG.warn("Skipping null block summary");
            return false;
        }
        String problem = summary.problem();
        if (problem != null) {
            LOG.warnf("Skipping malformed block summary %s: %s", summary, problem);
            return false;
        }

        if (window.size() >= windowSize
                && !window.containsKey(summary.number())
                && summary.number() < window.firstKey()) {
            LOG.debugf(
                    "Ignoring block %d, older than window start %d",
                    summary.number(), window.firstKey());
            return false;
        }

        insert(summary);
        evictOverflow();

        LOG.debugf(
                "Added block %d to stats window, now tracking %d blocks",
                summary.number(), window.size());

        recompute();
        return true;
    }

    /**
     * Replaces the window content with the given blocks and recomputes once.
     *
     * <p>Used for the cold start from the store. Blocks may be given in any order; if more
     * than the window size are supplied, only the highest-numbered ones are kept.
     *
     * @param blocks the most recent persisted blocks
     */
    public synchronized void initialize(Collection<BlockSummary> blocks) {
        window.clear();
        totalTx = 0;
        totalGas = 0;
        snapshot = null;

        int skipped = 0;
        for (BlockSummary block : blocks) {
            if (block == null || block.problem() != null) {
                skipped++;
                continue;
            }
            insert(block);
        }
        evictOverflow();

        if (skipped > 0) {
            LOG.warnf("Skipped %d malformed blocks during window initialization", skipped);
        }

        if (window.isEmpty()) {
            LOG.warn("No blocks available to initialize the stats window");
            return;
        }

        recompute();
        LOG.infof("Stats window initialized with %d blocks", window.size());
    }

    /**
     * Returns the latest snapshot.
     *
     * @return the cached snapshot, or {@code null} if no block was ever accepted
     */
    public synchronized StatSnapshot getSnapshot() {
        return snapshot;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public synchronized int getBlockCount() {
        return window.size();
    }

    synchronized long totalTx() {
        return totalTx;
    }

    synchronized long totalGas() {
        return totalGas;
    }

    private void insert(BlockSummary summary) {
        BlockSummary previous = window.put(summary.number(), summary);
        if (previous != null) {
            totalTx -= previous.txCount();
            totalGas -= previous.gasUsed();
        }
        totalTx += summary.txCount();
        totalGas += summary.gasUsed();
    }

    private void evictOverflow() {
        while (window.size() > windowSize) {
            Map.Entry<Long, BlockSummary> evicted = window.pollFirstEntry();
            totalTx -= evicted.getValue().txCount();
            totalGas -= evicted.getValue().gasUsed();
            LOG.debugf("Evicted block %d from stats window", evicted.getKey());
        }
    }

    private void recompute() {
        BlockSummary oldest = window.firstEntry().getValue();
        BlockSummary newest = window.lastEntry().getValue();

        double span;
        boolean estimated;
        if (window.size() == 1) {
            // Single block: no measurable span, fall back to the assumed interval.
            span = assumedBlockIntervalSeconds;
            estimated = true;
        } else {
            span = newest.timestamp() - oldest.timestamp();
            estimated = false;
            if (span <= 0) {
                // Timestamps did not advance; measure the window with the assumed interval.
                LOG.warnf(
                        "Degenerate time span %.0fs between blocks %d and %d, estimating from"
                                + " assumed block interval",
                        span, oldest.number(), newest.number());
                span = (window.size() - 1) * assumedBlockIntervalSeconds;
                estimated = true;
            }
        }

        double divisor = Math.max(span, MIN_SPAN_SECONDS);
        snapshot =
                new StatSnapshot(
                        totalTx / divisor,
                        totalGas / divisor,
                        span / Math.max(totalTx, 1),
                        windowSize,
                        window.size(),
                        span,
                        estimated,
                        clock.instant());

        LOG.debugf(
                "Calculated stats over %d blocks spanning %.0f seconds: tps=%.2f, gas/s=%.2f",
                window.size(), span, snapshot.tps(), snapshot.gasPerSecond());
    }
}
