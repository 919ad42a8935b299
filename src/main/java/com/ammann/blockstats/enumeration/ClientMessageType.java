/* (C)2026 */
package com.ammann.blockstats.enumeration;

/**
 * Closed set of inbound WebSocket message kinds after parsing.
 */
public enum ClientMessageType {
    SUBSCRIBE_BLOCKS,
    SUBSCRIBE_STATS,
    SUBSCRIBE_BLOCK,
    UNSUBSCRIBE,
    GET_LATEST_BLOCKS,
    GET_STATS
}
