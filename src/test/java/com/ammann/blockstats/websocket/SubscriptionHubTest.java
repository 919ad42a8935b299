/* (C)2026 */
package com.ammann.blockstats.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ammann.blockstats.model.Block;
import com.ammann.blockstats.repository.BlockRepository;
import com.ammann.blockstats.service.SlidingWindowAggregator;
import com.ammann.blockstats.support.TestDataFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SubscriptionHubTest {

    private static final long T0 = 1_700_000_000L;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private BlockRepository repository;
    private SlidingWindowAggregator aggregator;
    private SimpleMeterRegistry meterRegistry;
    private SubscriptionHub hub;

    @BeforeEach
    void setUp() {
        repository = mock(BlockRepository.class);
        when(repository.findLatest(anyInt(), eq(0))).thenReturn(List.of());
        when(repository.findByNumber(anyLong())).thenReturn(Optional.empty());
        aggregator = new SlidingWindowAggregator(10);
        meterRegistry = new SimpleMeterRegistry();
        hub =
                new SubscriptionHub(
                        repository,
                        aggregator,
                        new ClientMessageParser(objectMapper),
                        objectMapper,
                        meterRegistry);
        hub.clock = Clock.fixed(Instant.ofEpochMilli(1_234), ZoneOffset.UTC);
    }

    private void storeBlock(long number, long timestamp, long txCount) {
        Block block = TestDataFactory.createBlock(number, timestamp, txCount, 1_000);
        when(repository.findByNumber(number)).thenReturn(Optional.of(block));
    }

    private FakeConnection connect(String id) {
        FakeConnection connection = new FakeConnection(id);
        hub.connect(connection);
        return connection;
    }

    @Nested
    @DisplayName("Connecting")
    class Connecting {

        @Test
        void newClientGetsLatestBlocksAndNoStatsBeforeFirstBlock() throws Exception {
            List<Block> latest = List.of(TestDataFactory.createBlock(3, T0 + 4, 10, 10));
            when(repository.findLatest(10, 0)).thenReturn(latest);

            FakeConnection client = connect("c1");

            assertThat(client.types()).containsExactly("latestBlocks");
            JsonNode frame = client.frame(0);
            assertThat(frame.get("status").asText()).isEqualTo("success");
            assertThat(frame.get("timestamp").asLong()).isEqualTo(1_234);
            assertThat(frame.get("data").get(0).get("number").asLong()).isEqualTo(3);
            assertThat(frame.has("message")).isFalse();
        }

        @Test
        void clientConnectingAfterABlockGetsStats() throws Exception {
            storeBlock(1, T0, 120);
            hub.onBlockCommitted(1);

            FakeConnection client = connect("c1");

            assertThat(client.types()).containsExactly("latestBlocks", "statsUpdate");
            JsonNode stats = client.frame(1).get("data");
            assertThat(stats.get("tps").asDouble()).isEqualTo(10.0);
            assertThat(stats.get("windowSize").asInt()).isEqualTo(10);
            assertThat(stats.get("estimated").asBoolean()).isTrue();
        }

        @Test
        void storeFailureOnConnectSendsError() throws Exception {
            when(repository.findLatest(10, 0)).thenThrow(new IllegalStateException("store down"));

            FakeConnection client = connect("c1");

            assertThat(client.types()).containsExactly("error");
            assertThat(client.frame(0).get("message").asText())
                    .isEqualTo("Error fetching initial blocks");
            assertThat(hub.connectionCount()).isEqualTo(1);
        }

        @Test
        void defaultSubscriptionsAndDisconnect() {
            FakeConnection client = connect("c1");

            assertThat(hub.subscriptionsOf("c1"))
                    .containsExactlyInAnyOrder(Subscription.blocks(), Subscription.stats());

            hub.disconnect(client);

            assertThat(hub.connectionCount()).isZero();
            assertThat(hub.subscriptionsOf("c1")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Broadcasting")
    class Broadcasting {

        @Test
        void blockUpdateThenStatsUpdatePerConnection() throws Exception {
            FakeConnection first = connect("c1");
            FakeConnection second = connect("c2");
            first.clear();
            second.clear();
            storeBlock(1, T0, 100);
            storeBlock(2, T0 + 2, 100);

            hub.onBlockCommitted(1);
            hub.onBlockCommitted(2);

            assertThat(first.types())
                    .containsExactly("blockUpdate", "statsUpdate", "blockUpdate", "statsUpdate");
            assertThat(second.types()).isEqualTo(first.types());
            assertThat(first.frame(2).get("data").get("number").asLong()).isEqualTo(2);
            assertThat(first.frame(3).get("data").get("tps").asDouble()).isEqualTo(100.0);
            assertThat(aggregator.getBlockCount()).isEqualTo(2);
        }

        @Test
        void unknownBlockIsSkipped() {
            FakeConnection client = connect("c1");
            client.clear();

            hub.onBlockCommitted(404);

            assertThat(client.frames).isEmpty();
            assertThat(aggregator.getSnapshot()).isNull();
        }

        @Test
        void failedSendDropsOnlyThatConnection() throws Exception {
            FakeConnection healthy = connect("healthy");
            FakeConnection broken = connect("broken");
            healthy.clear();
            broken.failSends = true;
            storeBlock(1, T0, 100);

            hub.onBlockCommitted(1);

            assertThat(healthy.types()).containsExactly("blockUpdate", "statsUpdate");
            assertThat(hub.connectionCount()).isEqualTo(1);
            assertThat(hub.subscriptionsOf("broken")).isEmpty();
            assertThat(meterRegistry.get("blockstats_ws_dropped_connections_total").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        void closedConnectionIsDropped() {
            FakeConnection closed = connect("closed");
            closed.open = false;
            storeBlock(1, T0, 100);

            hub.onBlockCommitted(1);

            assertThat(hub.connectionCount()).isZero();
        }

        @Test
        void broadcastsAreCountedAndClientsGauged() {
            connect("c1");
            storeBlock(1, T0, 100);

            hub.onBlockCommitted(1);

            assertThat(meterRegistry.get("blockstats_ws_broadcasts_total").counter().count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.get("blockstats_ws_connected_clients").gauge().value())
                    .isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Client requests")
    class ClientRequests {

        @Test
        void invalidMessageGetsErrorAndConnectionStaysOpen() throws Exception {
            FakeConnection client = connect("c1");
            client.clear();

            hub.handleMessage(client, "{\"type\":\"subscribe\",\"channel\":\"block\"}");

            assertThat(client.types()).containsExactly("error");
            JsonNode error = client.frame(0);
            assertThat(error.get("status").asText()).isEqualTo("error");
            assertThat(error.get("message").asText()).isEqualTo("Validation failed");
            assertThat(error.get("data").get("errors").get(0).get("path").asText()).isEqualTo("slot");
            assertThat(hub.connectionCount()).isEqualTo(1);
        }

        @Test
        void subscribeBlockSendsDetailsThenAcknowledges() throws Exception {
            storeBlock(5, T0, 10);
            FakeConnection client = connect("c1");
            client.clear();

            hub.handleMessage(client, "{\"type\":\"subscribeBlock\",\"blockNumber\":5}");

            assertThat(client.types()).containsExactly("blockDetails", "subscribed");
            assertThat(client.frame(0).get("data").get("hash").asText()).isEqualTo("0x5");
            assertThat(client.frame(1).get("data").get("slot").asLong()).isEqualTo(5);
            assertThat(hub.subscriptionsOf("c1")).contains(Subscription.block(5));
        }

        @Test
        void subscribeToUnknownBlockReportsNotFound() throws Exception {
            FakeConnection client = connect("c1");
            client.clear();

            hub.handleMessage(client, "{\"type\":\"subscribeBlock\",\"slot\":77}");

            assertThat(client.types()).containsExactly("error", "subscribed");
            assertThat(client.frame(0).get("message").asText()).isEqualTo("Block 77 not found");
        }

        @Test
        void blockSubscriptionOnlyReceivesItsBlock() throws Exception {
            FakeConnection client = connect("c1");
            hub.handleMessage(client, "{\"type\":\"unsubscribe\",\"channel\":\"blocks\"}");
            hub.handleMessage(client, "{\"type\":\"unsubscribe\",\"channel\":\"stats\"}");
            hub.handleMessage(client, "{\"type\":\"subscribe\",\"channel\":\"block\",\"slot\":2}");
            client.clear();
            storeBlock(1, T0, 10);
            storeBlock(2, T0 + 2, 10);

            hub.onBlockCommitted(1);
            hub.onBlockCommitted(2);

            assertThat(client.types()).containsExactly("blockUpdate");
            assertThat(client.frame(0).get("data").get("number").asLong()).isEqualTo(2);
        }

        @Test
        void unsubscribeFromStatsStopsStatsUpdates() throws Exception {
            FakeConnection client = connect("c1");
            hub.handleMessage(client, "{\"type\":\"unsubscribe\",\"channel\":\"stats\"}");
            assertThat(client.types()).endsWith("unsubscribed");
            client.clear();
            storeBlock(1, T0, 10);

            hub.onBlockCommitted(1);

            assertThat(client.types()).containsExactly("blockUpdate");
        }

        @Test
        void subscribeToStatsAcknowledgesWithWindowSize() throws Exception {
            storeBlock(1, T0, 10);
            hub.onBlockCommitted(1);
            FakeConnection client = connect("c1");
            client.clear();

            hub.handleMessage(client, "{\"type\":\"subscribe\",\"channel\":\"stats\",\"windowSize\":15}");

            assertThat(client.types()).containsExactly("subscribed", "statsUpdate");
            assertThat(client.frame(0).get("data").get("windowSize").asInt()).isEqualTo(10);
        }

        @Test
        void getStatsWithoutBlocksIsAnError() throws Exception {
            FakeConnection client = connect("c1");
            client.clear();

            hub.handleMessage(client, "{\"type\":\"getStats\"}");

            assertThat(client.types()).containsExactly("error");
            assertThat(client.frame(0).get("message").asText())
                    .isEqualTo("No blocks found to calculate statistics");
        }

        @Test
        void getLatestBlocksUsesRequestedLimit() throws Exception {
            FakeConnection client = connect("c1");
            client.clear();
            when(repository.findLatest(3, 0))
                    .thenReturn(
                            List.of(
                                    TestDataFactory.createBlock(9, T0, 1, 1),
                                    TestDataFactory.createBlock(8, T0, 1, 1)));

            hub.handleMessage(client, "{\"type\":\"getLatestBlocks\",\"limit\":3}");

            verify(repository).findLatest(3, 0);
            assertThat(client.types()).containsExactly("latestBlocks");
            assertThat(client.frame(0).get("data")).hasSize(2);
        }

        @Test
        void messagesFromUnknownConnectionsAreIgnored() {
            FakeConnection stranger = new FakeConnection("stranger");

            hub.handleMessage(stranger, "{\"type\":\"getStats\"}");

            assertThat(stranger.frames).isEmpty();
        }
    }

    /** Records every frame sent to it. */
    final class FakeConnection implements ClientConnection {

        final String id;
        final List<String> frames = new ArrayList<>();
        volatile boolean open = true;
        volatile boolean failSends;

        FakeConnection(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void send(String text) {
            if (failSends) {
                throw new IllegalStateException("connection reset by peer");
            }
            frames.add(text);
        }

        void clear() {
            frames.clear();
        }

        JsonNode frame(int index) throws Exception {
            return objectMapper.readTree(frames.get(index));
        }

        List<String> types() {
            List<String> types = new ArrayList<>();
            for (String frame : frames) {
                try {
                    types.add(objectMapper.readTree(frame).get("type").asText());
                } catch (Exception e) {
                    throw new AssertionError("Unreadable frame: " + frame, e);
                }
            }
            return types;
        }
    }
}
