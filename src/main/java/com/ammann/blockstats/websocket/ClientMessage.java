/* (C)2026 */
package com.ammann.blockstats.websocket;

import com.ammann.blockstats.enumeration.ClientMessageType;
import com.ammann.blockstats.enumeration.SubscriptionChannel;

/**
 * A validated inbound WebSocket message. Produced only by {@link ClientMessageParser}.
 */
public sealed interface ClientMessage
        permits ClientMessage.SubscribeBlocks,
                ClientMessage.SubscribeStats,
                ClientMessage.SubscribeBlock,
                ClientMessage.Unsubscribe,
                ClientMessage.GetLatestBlocks,
                ClientMessage.GetStats {

    ClientMessageType type();

    record SubscribeBlocks() implements ClientMessage {
        @Override
        public ClientMessageType type() {
            return ClientMessageType.SUBSCRIBE_BLOCKS;
        }
    }

    record SubscribeStats() implements ClientMessage {
        @Override
        public ClientMessageType type() {
            return ClientMessageType.SUBSCRIBE_STATS;
        }
    }

    record SubscribeBlock(long blockNumber) implements ClientMessage {
        @Override
        public ClientMessageType type() {
            return ClientMessageType.SUBSCRIBE_BLOCK;
        }
    }

    /**
     * @param blockNumber set only when {@code channel} is {@link SubscriptionChannel#BLOCK}
     */
    record Unsubscribe(SubscriptionChannel channel, Long blockNumber) implements ClientMessage {
        @Override
        public ClientMessageType type() {
            return ClientMessageType.UNSUBSCRIBE;
        }

        public Subscription toSubscription() {
            return new Subscription(channel, blockNumber);
        }
    }

    record GetLatestBlocks(int limit) implements ClientMessage {
        @Override
        public ClientMessageType type() {
            return ClientMessageType.GET_LATEST_BLOCKS;
        }
    }

    record GetStats() implements ClientMessage {
        @Override
        public ClientMessageType type() {
            return ClientMessageType.GET_STATS;
        }
    }
}
