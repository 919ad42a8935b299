/* (C)2026 */
package com.ammann.blockstats.enumeration;

import java.util.Arrays;
import java.util.Optional;

/**
 * Channels a WebSocket client can subscribe to.
 */
public enum SubscriptionChannel {
    /** Every committed block. */
    BLOCKS("blocks"),
    /** Refreshed statistics after every committed block. */
    STATS("stats"),
    /** Updates for one specific block number. */
    BLOCK("block");

    private final String wireName;

    SubscriptionChannel(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<SubscriptionChannel> fromWireName(String value) {
        return Arrays.stream(values()).filter(c -> c.wireName.equals(value)).findFirst();
    }
}
