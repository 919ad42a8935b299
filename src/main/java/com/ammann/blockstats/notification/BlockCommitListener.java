/* (C)2026 */
package com.ammann.blockstats.notification;

/**
 * Callback for newly committed (or updated) blocks.
 *
 * <p>Delivery is at-least-once and unordered across the push and poll paths; implementations
 * must tolerate duplicates and out-of-order numbers.
 */
@FunctionalInterface
public interface BlockCommitListener {

    void onBlockCommitted(long blockNumber);
}
