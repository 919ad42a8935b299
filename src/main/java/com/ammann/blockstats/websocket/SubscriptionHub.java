/* (C)2026 */
package com.ammann.blockstats.websocket;

import com.ammann.blockstats.dto.BlockDTO;
import com.ammann.blockstats.dto.StatsDTO;
import com.ammann.blockstats.enumeration.ServerMessageType;
import com.ammann.blockstats.enumeration.SubscriptionChannel;
import com.ammann.blockstats.exception.BlockNotFoundException;
import com.ammann.blockstats.exception.StatsUnavailableException;
import com.ammann.blockstats.exception.ValidationException;
import com.ammann.blockstats.model.Block;
import com.ammann.blockstats.model.StatSnapshot;
import com.ammann.blockstats.notification.BlockCommitListener;
import com.ammann.blockstats.repository.BlockRepository;
import com.ammann.blockstats.service.SlidingWindowAggregator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Keeps track of connected WebSocket clients and their subscriptions, and fans block and
 * statistics updates out to them.
 *
 * <p>Every new connection is subscribed to {@code blocks} and {@code stats} and receives the
 * latest blocks plus the current statistics right away. On each committed block the hub loads
 * the block, feeds it to the {@link SlidingWindowAggregator} and sends {@code blockUpdate}
 * followed by {@code statsUpdate} to each interested connection. A connection whose send fails
 * is dropped without affecting the others.
 */
@ApplicationScoped
public class SubscriptionHub implements BlockCommitListener {

    private static final Logger LOG = Logger.getLogger(SubscriptionHub.class);

    private final BlockRepository repository;
    private final SlidingWindowAggregator aggregator;
    private final ClientMessageParser parser;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @ConfigProperty(name = "blockstats.hub.initial-blocks", defaultValue = "10")
    int initialBlocks = 10;

    Clock clock = Clock.systemUTC();

    private final Map<String, ClientSession> sessions = new ConcurrentHashMap<>();

    private Counter broadcastsCounter;
    private Counter droppedConnectionsCounter;
    private Counter rejectedMessagesCounter;

    @Inject
    public SubscriptionHub(
            BlockRepository repository,
            SlidingWindowAggregator aggregator,
            ClientMessageParser parser,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry) {
        this.repository = repository;
        this.aggregator = aggregator;
        this.parser = parser;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        initMetrics();
    }

    private void initMetrics() {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - hub metrics disabled");
            return;
        }

        Gauge.builder("blockstats_ws_connected_clients", sessions, Map::size)
                .description("Currently connected WebSocket clients")
                .register(meterRegistry);

        broadcastsCounter =
                Counter.builder("blockstats_ws_broadcasts_total")
                        .description("Committed blocks broadcast to subscribers")
                        .register(meterRegistry);

        droppedConnectionsCounter =
                Counter.builder("blockstats_ws_dropped_connections_total")
                        .description("Connections dropped after a failed send")
                        .register(meterRegistry);

        rejectedMessagesCounter =
                Counter.builder("blockstats_ws_rejected_messages_total")
                        .description("Inbound messages rejected by validation")
                        .register(meterRegistry);
    }

    /**
     * Registers a new connection and sends it the initial state.
     */
    public void connect(ClientConnection connection) {
        ClientSession session = new ClientSession(connection);
        session.subscriptions.add(Subscription.blocks());
        session.subscriptions.add(Subscription.stats());
        sessions.put(connection.id(), session);
        LOG.infof("Client %s connected (total connections: %d)", connection.id(), sessions.size());

        try {
            sendLatestBlocks(session, initialBlocks);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to load initial blocks for client %s", connection.id());
            deliver(session, ServerMessage.error("Error fetching initial blocks", null, clock));
        }

        StatSnapshot snapshot = aggregator.getSnapshot();
        if (snapshot != null) {
            deliver(session, statsMessage(snapshot));
        }
    }

    /**
     * Removes a connection together with all its subscriptions.
     */
    public void disconnect(ClientConnection connection) {
        if (sessions.remove(connection.id()) != null) {
            LOG.infof(
                    "Client %s disconnected (total connections: %d)",
                    connection.id(), sessions.size());
        }
    }

    /**
     * Handles one inbound text frame. Never closes the connection.
     */
    public void handleMessage(ClientConnection connection, String text) {
        ClientSession session = sessions.get(connection.id());
        if (session == null) {
            LOG.debugf("Ignoring message from unregistered client %s", connection.id());
            return;
        }

        ClientMessage message;
        try {
            message = parser.parse(text);
        } catch (ValidationException e) {
            LOG.debugf("Rejected message from client %s: %s", connection.id(), e.getMessage());
            if (rejectedMessagesCounter != null) {
                rejectedMessagesCounter.increment();
            }
            deliver(session, validationError(e));
            return;
        }

        try {
            dispatch(session, message);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to process %s from client %s", message.type(), connection.id());
            deliver(session, ServerMessage.error("Error processing message", null, clock));
        }
    }

    private void dispatch(ClientSession session, ClientMessage message) {
        switch (message.type()) {
            case SUBSCRIBE_BLOCKS -> {
                session.subscriptions.add(Subscription.blocks());
                deliver(
                        session,
                        ServerMessage.success(
                                ServerMessageType.SUBSCRIBED,
                                channelData(Subscription.blocks()),
                                "Subscribed to block updates",
                                clock));
            }
            case SUBSCRIBE_STATS -> {
                session.subscriptions.add(Subscription.stats());
                Map<String, Object> data = channelData(Subscription.stats());
                data.put("windowSize", aggregator.getWindowSize());
                deliver(
                        session,
                        ServerMessage.success(
                                ServerMessageType.SUBSCRIBED,
                                data,
                                "Subscribed to stats updates",
                                clock));
                StatSnapshot snapshot = aggregator.getSnapshot();
                if (snapshot != null) {
                    deliver(session, statsMessage(snapshot));
                }
            }
            case SUBSCRIBE_BLOCK -> subscribeBlock(
                    session, ((ClientMessage.SubscribeBlock) message).blockNumber());
            case UNSUBSCRIBE -> unsubscribe(session, (ClientMessage.Unsubscribe) message);
            case GET_LATEST_BLOCKS -> sendLatestBlocks(
                    session, ((ClientMessage.GetLatestBlocks) message).limit());
            case GET_STATS -> {
                StatSnapshot snapshot = aggregator.getSnapshot();
                if (snapshot != null) {
                    deliver(session, statsMessage(snapshot));
                } else {
                    deliver(
                            session,
                            ServerMessage.error(
                                    new StatsUnavailableException().getMessage(), null, clock));
                }
            }
        }
    }

    private void subscribeBlock(ClientSession session, long blockNumber) {
        Optional<Block> block = repository.findByNumber(blockNumber);
        if (block.isPresent()) {
            deliver(
                    session,
                    ServerMessage.success(
                            ServerMessageType.BLOCK_DETAILS, BlockDTO.from(block.get()), clock));
        } else {
            deliver(
                    session,
                    ServerMessage.error(
                            new BlockNotFoundException(blockNumber).getMessage(), null, clock));
        }

        Subscription subscription = Subscription.block(blockNumber);
        session.subscriptions.add(subscription);
        deliver(
                session,
                ServerMessage.success(
                        ServerMessageType.SUBSCRIBED,
                        channelData(subscription),
                        "Subscribed to block " + blockNumber + " updates",
                        clock));
    }

    private void unsubscribe(ClientSession session, ClientMessage.Unsubscribe message) {
        Subscription subscription = message.toSubscription();
        boolean removed = session.subscriptions.remove(subscription);
        String target =
                subscription.channel() == SubscriptionChannel.BLOCK
                        ? "block " + subscription.blockNumber()
                        : subscription.channel().getWireName();
        deliver(
                session,
                ServerMessage.success(
                        ServerMessageType.UNSUBSCRIBED,
                        channelData(subscription),
                        removed
                                ? "Unsubscribed from " + target + " updates"
                                : "Not subscribed to " + target + " updates",
                        clock));
    }

    private void sendLatestBlocks(ClientSession session, int limit) {
        List<BlockDTO> blocks =
                repository.findLatest(limit, 0).stream().map(BlockDTO::from).toList();
        deliver(session, ServerMessage.success(ServerMessageType.LATEST_BLOCKS, blocks, clock));
    }

    /**
     * Pushes a committed block through the aggregator and out to every interested connection.
     *
     * <p>Per connection the order is {@code blockUpdate} then {@code statsUpdate}.
     */
    @Override
    public void onBlockCommitted(long blockNumber) {
        Optional<Block> loaded = repository.findByNumber(blockNumber);
        if (loaded.isEmpty()) {
            LOG.warnf("Committed block %d not found in store, skipping broadcast", blockNumber);
            return;
        }
        Block block = loaded.get();

        aggregator.addBlock(block.toSummary());
        StatSnapshot snapshot = aggregator.getSnapshot();

        if (broadcastsCounter != null) {
            broadcastsCounter.increment();
        }
        if (sessions.isEmpty()) {
            return;
        }

        String blockFrame =
                serialize(
                        ServerMessage.success(
                                ServerMessageType.BLOCK_UPDATE, BlockDTO.from(block), clock));
        String statsFrame = snapshot == null ? null : serialize(statsMessage(snapshot));

        int recipients = 0;
        for (ClientSession session : sessions.values()) {
            boolean sent = false;
            if (session.wantsBlock(blockNumber)) {
                if (!deliverFrame(session, blockFrame)) {
                    continue;
                }
                sent = true;
            }
            if (statsFrame != null && session.wantsStats()) {
                if (!deliverFrame(session, statsFrame)) {
                    continue;
                }
                sent = true;
            }
            if (sent) {
                recipients++;
            }
        }
        LOG.debugf("Broadcast block %d to %d client(s)", blockNumber, recipients);
    }

    private ServerMessage statsMessage(StatSnapshot snapshot) {
        return ServerMessage.success(
                ServerMessageType.STATS_UPDATE, StatsDTO.from(snapshot), clock);
    }

    private ServerMessage validationError(ValidationException e) {
        Map<String, Object> details = null;
        if (!e.getErrors().isEmpty()) {
            details = new LinkedHashMap<>();
            details.put("errors", e.getErrors());
        }
        return ServerMessage.error(e.getMessage(), details, clock);
    }

    private static Map<String, Object> channelData(Subscription subscription) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("channel", subscription.channel().getWireName());
        if (subscription.blockNumber() != null) {
            data.put("slot", subscription.blockNumber());
        }
        return data;
    }

    private boolean deliver(ClientSession session, ServerMessage message) {
        return deliverFrame(session, serialize(message));
    }

    private boolean deliverFrame(ClientSession session, String frame) {
        ClientConnection connection = session.connection;
        if (!connection.isOpen()) {
            drop(session, null);
            return false;
        }
        try {
            connection.send(frame);
            return true;
        } catch (RuntimeException e) {
            drop(session, e);
            return false;
        }
    }

    private void drop(ClientSession session, RuntimeException cause) {
        String id = session.connection.id();
        if (!sessions.remove(id, session)) {
            return;
        }
        if (cause != null) {
            LOG.warnf("Failed to send to client %s, dropping connection: %s", id, cause.getMessage());
        } else {
            LOG.infof("Client %s is no longer open, dropping connection", id);
        }
        if (droppedConnectionsCounter != null) {
            droppedConnectionsCounter.increment();
        }
    }

    private String serialize(ServerMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(
                    "Failed to serialize " + message.type().getWireName() + " message", e);
        }
    }

    public int connectionCount() {
        return sessions.size();
    }

    /**
     * Current subscriptions of a connection.
     *
     * @return a snapshot copy, empty if the connection is unknown
     */
    public Set<Subscription> subscriptionsOf(String connectionId) {
        ClientSession session = sessions.get(connectionId);
        return session == null ? Set.of() : Set.copyOf(session.subscriptions);
    }

    /**
     * Registry entry for one connection.
     */
    private static final class ClientSession {

        private final ClientConnection connection;
        private final Set<Subscription> subscriptions = ConcurrentHashMap.newKeySet();

        private ClientSession(ClientConnection connection) {
            this.connection = connection;
        }

        private boolean wantsBlock(long blockNumber) {
            for (Subscription subscription : subscriptions) {
                if (subscription.wantsBlock(blockNumber)) {
                    return true;
                }
            }
            return false;
        }

        private boolean wantsStats() {
            return subscriptions.contains(Subscription.stats());
        }
    }
}
