/* (C)2026 */
package com.ammann.blockstats.websocket;

import com.ammann.blockstats.enumeration.ServerMessageType;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Clock;

/**
 * Outbound WebSocket frame: {@code {type, status, data, timestamp, message?}}.
 *
 * @param type message type, serialized by its wire name
 * @param status {@code success} or {@code error}
 * @param data payload, {@code null} for plain errors
 * @param timestamp epoch milliseconds when the message was built
 * @param message human-readable note, omitted when absent
 */
public record ServerMessage(
        ServerMessageType type,
        String status,
        Object data,
        long timestamp,
        @JsonInclude(JsonInclude.Include.NON_NULL) String message) {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    public static ServerMessage success(ServerMessageType type, Object data, Clock clock) {
        return new ServerMessage(type, SUCCESS, data, clock.millis(), null);
    }

    public static ServerMessage success(
            ServerMessageType type, Object data, String message, Clock clock) {
        return new ServerMessage(type, SUCCESS, data, clock.millis(), message);
    }

    public static ServerMessage error(String message, Object details, Clock clock) {
        return new ServerMessage(ServerMessageType.ERROR, ERROR, details, clock.millis(), message);
    }
}
