/* (C)2026 */
package com.ammann.blockstats.websocket;

import io.quarkus.websockets.next.WebSocketConnection;

/**
 * {@link ClientConnection} backed by a WebSockets Next connection.
 */
final class WebSocketClientConnection implements ClientConnection {

    private final WebSocketConnection connection;

    WebSocketClientConnection(WebSocketConnection connection) {
        this.connection = connection;
    }

    @Override
    public String id() {
        return connection.id();
    }

    @Override
    public boolean isOpen() {
        return connection.isOpen();
    }

    @Override
    public void send(String text) {
        connection.sendTextAndAwait(text);
    }

    @Override
    public String toString() {
        return "WebSocketClientConnection{id=" + connection.id() + "}";
    }
}
