/* (C)2026 */
package com.ammann.blockstats.websocket;

import com.ammann.blockstats.properties.ApiProperties;
import io.quarkus.websockets.next.OnClose;
import io.quarkus.websockets.next.OnError;
import io.quarkus.websockets.next.OnOpen;
import io.quarkus.websockets.next.OnTextMessage;
import io.quarkus.websockets.next.WebSocket;
import io.quarkus.websockets.next.WebSocketConnection;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * WebSocket endpoint for live updates. All callbacks run on worker threads and delegate to
 * the {@link SubscriptionHub}.
 */
@WebSocket(path = ApiProperties.WEBSOCKET_PATH)
public class BlockStatsSocket {

    private static final Logger LOG = Logger.getLogger(BlockStatsSocket.class);

    @Inject SubscriptionHub hub;

    @OnOpen
    public void onOpen(WebSocketConnection connection) {
        hub.connect(new WebSocketClientConnection(connection));
    }

    @OnTextMessage
    public void onMessage(String message, WebSocketConnection connection) {
        hub.handleMessage(new WebSocketClientConnection(connection), message);
    }

    @OnClose
    public void onClose(WebSocketConnection connection) {
        hub.disconnect(new WebSocketClientConnection(connection));
    }

    @OnError
    public void onError(Throwable error, WebSocketConnection connection) {
        LOG.warnf(error, "WebSocket error on connection %s", connection.id());
    }
}
