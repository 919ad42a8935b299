/* (C)2026 */
package com.ammann.blockstats.websocket;

/**
 * A connected WebSocket client as seen by the {@link SubscriptionHub}.
 */
public interface ClientConnection {

    /**
     * Stable identifier, unique among open connections.
     */
    String id();

    boolean isOpen();

    /**
     * Sends one text frame and waits until it is written.
     *
     * @throws RuntimeException if the frame could not be sent
     */
    void send(String text);
}
