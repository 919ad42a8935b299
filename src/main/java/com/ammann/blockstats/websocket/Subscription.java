/* (C)2026 */
package com.ammann.blockstats.websocket;

import com.ammann.blockstats.enumeration.SubscriptionChannel;
import java.util.Objects;

/**
 * What a connection wants to receive.
 *
 * @param channel subscribed channel
 * @param blockNumber block number for {@link SubscriptionChannel#BLOCK}, {@code null} otherwise
 */
public record Subscription(SubscriptionChannel channel, Long blockNumber) {

    public Subscription {
        Objects.requireNonNull(channel, "channel");
        if (channel == SubscriptionChannel.BLOCK && blockNumber == null) {
            throw new IllegalArgumentException("Block subscription needs a block number");
        }
        if (channel != SubscriptionChannel.BLOCK) {
            blockNumber = null;
        }
    }

    public static Subscription blocks() {
        return new Subscription(SubscriptionChannel.BLOCKS, null);
    }

    public static Subscription stats() {
        return new Subscription(SubscriptionChannel.STATS, null);
    }

    public static Subscription block(long blockNumber) {
        return new Subscription(SubscriptionChannel.BLOCK, blockNumber);
    }

    /**
     * Whether an update of {@code number} is of interest to this subscription.
     */
    public boolean wantsBlock(long number) {
        return channel == SubscriptionChannel.BLOCKS
                || (channel == SubscriptionChannel.BLOCK && blockNumber == number);
    }
}
