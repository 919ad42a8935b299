/* (C)2026 */
package com.ammann.blockstats.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outbound WebSocket message types, serialized by their wire name.
 */
public enum ServerMessageType {
    LATEST_BLOCKS("latestBlocks"),
    BLOCK_UPDATE("blockUpdate"),
    BLOCK_DETAILS("blockDetails"),
    STATS_UPDATE("statsUpdate"),
    SUBSCRIBED("subscribed"),
    UNSUBSCRIBED("unsubscribed"),
    ERROR("error");

    private final String wireName;

    ServerMessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
