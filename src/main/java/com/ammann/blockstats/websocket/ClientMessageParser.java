/* (C)2026 */
package com.ammann.blockstats.websocket;

import com.ammann.blockstats.enumeration.SubscriptionChannel;
import com.ammann.blockstats.exception.ValidationException;
import com.ammann.blockstats.exception.ValidationException.FieldError;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw WebSocket text frames into {@link ClientMessage}s.
 *
 * <p>Accepted shapes:
 * <ul>
 *   <li>{@code {"type":"subscribe","channel":"blocks"|"stats"|"block","slot":n}}</li>
 *   <li>{@code {"type":"unsubscribe","channel":...,"slot":n}}</li>
 *   <li>{@code {"type":"subscribeBlock","blockNumber":n}} ({@code slot} is accepted too)</li>
 *   <li>{@code {"type":"getLatestBlocks","limit":n}}</li>
 *   <li>{@code {"type":"getStats"}}</li>
 * </ul>
 *
 * Unknown fields are ignored. Anything else fails with a {@link ValidationException} listing
 * every offending field.
 */
@ApplicationScoped
public class ClientMessageParser {

    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    private static final String VALIDATION_FAILED = "Validation failed";
    private static final String KNOWN_TYPES =
            "one of subscribe, unsubscribe, subscribeBlock, getLatestBlocks, getStats";
    private static final String KNOWN_CHANNELS = "one of blocks, stats, block";

    private final ObjectMapper objectMapper;

    @Inject
    public ClientMessageParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses and validates one inbound frame.
     *
     * @throws ValidationException if the frame is not a valid message
     */
    public ClientMessage parse(String text) {
        JsonNode root;
        try {
            root = text == null ? null : objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid JSON message", e);
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException(
                    VALIDATION_FAILED, List.of(new FieldError("", "expected a JSON object")));
        }

        JsonNode type = root.get("type");
        if (type == null || !type.isTextual()) {
            throw new ValidationException(
                    VALIDATION_FAILED, List.of(new FieldError("type", "expected " + KNOWN_TYPES)));
        }

        return switch (type.textValue()) {
            case "subscribe" -> parseSubscribe(root);
            case "unsubscribe" -> parseUnsubscribe(root);
            case "subscribeBlock" -> parseSubscribeBlock(root);
            case "getLatestBlocks" -> parseGetLatestBlocks(root);
            case "getStats" -> new ClientMessage.GetStats();
            default -> throw new ValidationException(
                    VALIDATION_FAILED, List.of(new FieldError("type", "expected " + KNOWN_TYPES)));
        };
    }

    private ClientMessage parseSubscribe(JsonNode root) {
        List<FieldError> errors = new ArrayList<>();
        SubscriptionChannel channel = channel(root, errors);
        Long slot = optionalPositive(root, "slot", errors);
        if (channel == SubscriptionChannel.BLOCK && slot == null && errors.isEmpty()) {
            errors.add(new FieldError("slot", "required when channel is 'block'"));
        }
        failIfAny(errors);

        return switch (channel) {
            case BLOCKS -> new ClientMessage.SubscribeBlocks();
            case STATS -> new ClientMessage.SubscribeStats();
            case BLOCK -> new ClientMessage.SubscribeBlock(slot);
        };
    }

    private ClientMessage parseUnsubscribe(JsonNode root) {
        List<FieldError> errors = new ArrayList<>();
        SubscriptionChannel channel = channel(root, errors);
        Long slot = optionalPositive(root, "slot", errors);
        if (channel == SubscriptionChannel.BLOCK && slot == null && errors.isEmpty()) {
            errors.add(new FieldError("slot", "required when channel is 'block'"));
        }
        failIfAny(errors);

        return new ClientMessage.Unsubscribe(
                channel, channel == SubscriptionChannel.BLOCK ? slot : null);
    }

    private ClientMessage parseSubscribeBlock(JsonNode root) {
        List<FieldError> errors = new ArrayList<>();
        Long blockNumber = optionalPositive(root, "blockNumber", errors);
        Long slot = optionalPositive(root, "slot", errors);
        if (blockNumber == null && slot == null && errors.isEmpty()) {
            errors.add(new FieldError("blockNumber", "required (or slot)"));
        }
        failIfAny(errors);

        return new ClientMessage.SubscribeBlock(blockNumber != null ? blockNumber : slot);
    }

    private ClientMessage parseGetLatestBlocks(JsonNode root) {
        List<FieldError> errors = new ArrayList<>();
        Long limit = optionalPositive(root, "limit", errors);
        if (limit != null && limit > MAX_LIMIT) {
            errors.add(new FieldError("limit", "expected an integer between 1 and " + MAX_LIMIT));
        }
        failIfAny(errors);

        return new ClientMessage.GetLatestBlocks(limit == null ? DEFAULT_LIMIT : limit.intValue());
    }

    private static SubscriptionChannel channel(JsonNode root, List<FieldError> errors) {
        JsonNode node = root.get("channel");
        if (node == null || !node.isTextual()) {
            errors.add(new FieldError("channel", "expected " + KNOWN_CHANNELS));
            return null;
        }
        return SubscriptionChannel.fromWireName(node.textValue())
                .orElseGet(
                        () -> {
                            errors.add(new FieldError("channel", "expected " + KNOWN_CHANNELS));
                            return null;
                        });
    }

    private static Long optionalPositive(JsonNode root, String field, List<FieldError> errors) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isIntegralNumber() || !node.canConvertToLong() || node.longValue() <= 0) {
            errors.add(new FieldError(field, "expected a positive integer"));
            return null;
        }
        return node.longValue();
    }

    private static void failIfAny(List<FieldError> errors) {
        if (!errors.isEmpty()) {
            throw new ValidationException(VALIDATION_FAILED, errors);
        }
    }
}
