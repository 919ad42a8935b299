/* (C)2026 */
package com.ammann.blockstats.service;

import com.ammann.blockstats.config.ExecutorProducer;
import com.ammann.blockstats.enumeration.NotifierState;
import com.ammann.blockstats.notification.BlockCommitListener;
import com.ammann.blockstats.notification.ChangeChannel;
import com.ammann.blockstats.notification.ChangeChannelFactory;
import com.ammann.blockstats.notification.ChangeEvent;
import com.ammann.blockstats.repository.BlockRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Detects newly committed blocks and hands their numbers to a {@link BlockCommitListener}.
 *
 * <p>Two delivery paths:
 * <ul>
 *   <li><b>Push:</b> PostgreSQL {@code LISTEN} on {@code block_created} and
 *       {@code block_updated}, driven by a dedicated loop on the notifier executor</li>
 *   <li><b>Polling:</b> every poll interval the latest committed block number is queried;
 *       ticks come from {@code BlockPollingScheduler}</li>
 * </ul>
 *
 * <p>Push is attempted first and must come up within the connect timeout. If it cannot, or if
 * the channel breaks later, the notifier logs one warning and switches to polling for the rest
 * of the run. Parse errors, listener failures and failed poll ticks are logged and never stop
 * delivery.
 */
@ApplicationScoped
public class BlockChangeNotifier {

    private static final Logger LOG = Logger.getLogger(BlockChangeNotifier.class);

    public static final String BLOCK_CREATED_CHANNEL = "block_created";
    public static final String BLOCK_UPDATED_CHANNEL = "block_updated";
    static final List<String> CHANNELS = List.of(BLOCK_CREATED_CHANNEL, BLOCK_UPDATED_CHANNEL);

    private final ChangeChannelFactory channelFactory;
    private final BlockRepository repository;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @ConfigProperty(name = "blockstats.notifier.push-enabled", defaultValue = "true")
    boolean pushEnabled = true;

    @ConfigProperty(name = "blockstats.notifier.connect-timeout", defaultValue = "3s")
    Duration connectTimeout = Duration.ofSeconds(3);

    @ConfigProperty(name = "blockstats.notifier.listen-timeout", defaultValue = "1s")
    Duration listenTimeout = Duration.ofSeconds(1);

    @ConfigProperty(name = "blockstats.notifier.poll-interval", defaultValue = "5s")
    Duration pollInterval = Duration.ofSeconds(5);

    @ConfigProperty(name = "blockstats.notifier.poll-catch-up-limit", defaultValue = "10")
    int catchUpLimit = 10;

    private final AtomicReference<NotifierState> state =
            new AtomicReference<>(NotifierState.STARTING);
    private final AtomicLong lastPolledBlock = new AtomicLong(-1);
    private volatile BlockCommitListener listener;
    private volatile ChangeChannel channel;
    private volatile String fallbackReason;

    private Counter pushDeliveries;
    private Counter pollDeliveries;
    private Counter malformedNotifications;

    @Inject
    public BlockChangeNotifier(
            ChangeChannelFactory channelFactory,
            BlockRepository repository,
            @Named(ExecutorProducer.CHANGE_NOTIFIER_EXECUTOR) ExecutorService executor,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry) {
        this.channelFactory = channelFactory;
        this.repository = repository;
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        initMetrics();
    }

    private void initMetrics() {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - notifier metrics disabled");
            return;
        }

        pushDeliveries =
                Counter.builder("blockstats_notifier_deliveries_total")
                        .description("Block numbers delivered to the pipeline")
                        .tag("source", "push")
                        .register(meterRegistry);

        pollDeliveries =
                Counter.builder("blockstats_notifier_deliveries_total")
                        .description("Block numbers delivered to the pipeline")
                        .tag("source", "poll")
                        .register(meterRegistry);

        malformedNotifications =
                Counter.builder("blockstats_notifier_malformed_total")
                        .description("Notifications whose payload could not be parsed")
                        .register(meterRegistry);

        Gauge.builder(
                        "blockstats_notifier_push_active",
                        state,
                        s -> s.get() == NotifierState.PUSH_ACTIVE ? 1.0 : 0.0)
                .description("1 while block changes arrive via LISTEN/NOTIFY, 0 otherwise")
                .register(meterRegistry);
    }

    /**
     * Starts delivery to {@code listener}. Can be called once per run.
     *
     * <p>Blocks for at most the connect timeout while the push channel is set up.
     *
     * @param listener receives block numbers
     * @param pushAvailable {@code false} if the store-side trigger could not be installed, in
     *     which case polling starts right away
     */
    public void start(BlockCommitListener listener, boolean pushAvailable) {
        Objects.requireNonNull(listener, "listener");
        if (this.listener != null) {
            throw new IllegalStateException("Block change notifier already started");
        }
        this.listener = listener;

        if (!pushEnabled) {
            switchToPolling("Push notifications disabled by configuration", null);
            return;
        }
        if (!pushAvailable) {
            switchToPolling("Notification trigger not installed", null);
            return;
        }

        ChangeChannel opened = openWithTimeout();
        if (opened == null) {
            return;
        }

        channel = opened;
        if (!state.compareAndSet(NotifierState.STARTING, NotifierState.PUSH_ACTIVE)) {
            opened.close();
            return;
        }
        LOG.infof("Block change notifier active in push mode on channels %s", CHANNELS);

        try {
            executor.execute(this::listenLoop);
        } catch (RejectedExecutionException e) {
            opened.close();
            switchToPolling("Notifier executor rejected the listen loop", e);
        }
    }

    private ChangeChannel openWithTimeout() {
        PushAttempt pending = new PushAttempt();
        Future<ChangeChannel> attempt;
        try {
            attempt = executor.submit(() -> openAndListen(pending));
        } catch (RejectedExecutionException e) {
            switchToPolling("Notifier executor rejected the push connection attempt", e);
            return null;
        }

        try {
            ChangeChannel opened = attempt.get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            pending.claim(opened);
            return opened;
        } catch (TimeoutException e) {
            pending.abandon();
            attempt.cancel(true);
            switchToPolling("Push channel did not connect within " + connectTimeout, null);
        } catch (ExecutionException e) {
            pending.abandon();
            switchToPolling("Push channel unavailable", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.abandon();
            attempt.cancel(true);
            switchToPolling("Interrupted while connecting the push channel", e);
        }
        return null;
    }

    private ChangeChannel openAndListen(PushAttempt pending) throws SQLException {
        ChangeChannel opened = channelFactory.open();
        try {
            opened.listen(CHANNELS);
        } catch (SQLException | RuntimeException e) {
            opened.close();
            throw e;
        }
        pending.offer(opened);
        return opened;
    }

    /**
     * Hands a freshly opened channel from the connecting worker to {@link #start}. Whichever
     * side sees the attempt abandoned with the channel still unclaimed closes it, exactly once.
     */
    static final class PushAttempt {

        private final AtomicBoolean abandoned = new AtomicBoolean();
        private final AtomicReference<ChangeChannel> handoff = new AtomicReference<>();

        void offer(ChangeChannel opened) {
            handoff.set(opened);
            if (abandoned.get() && handoff.compareAndSet(opened, null)) {
                LOG.debug("Closing push channel opened after the connect timeout");
                opened.close();
            }
        }

        void claim(ChangeChannel opened) {
            handoff.compareAndSet(opened, null);
        }

        void abandon() {
            abandoned.set(true);
            ChangeChannel late = handoff.getAndSet(null);
            if (late != null) {
                LOG.debug("Closing push channel opened after the connect timeout");
                late.close();
            }
        }
    }

    /**
     * Push loop: waits for notifications until the notifier leaves push mode.
     */
    void listenLoop() {
        ChangeChannel active = channel;
        try {
            while (state.get() == NotifierState.PUSH_ACTIVE) {
                List<ChangeEvent> events = active.awaitEvents(listenTimeout);
                for (ChangeEvent event : events) {
                    dispatchEvent(event);
                }
            }
        } catch (SQLException | RuntimeException e) {
            if (state.get() == NotifierState.PUSH_ACTIVE) {
                switchToPolling("Push channel connection lost", e);
            }
        } finally {
            active.close();
        }
    }

    void dispatchEvent(ChangeEvent event) {
        OptionalLong blockNumber = parseBlockNumber(event.payload());
        if (blockNumber.isEmpty()) {
            LOG.warnf(
                    "Ignoring notification on '%s' with unparseable payload: %s",
                    event.channel(), event.payload());
            if (malformedNotifications != null) {
                malformedNotifications.increment();
            }
            return;
        }
        LOG.debugf("Block %d notification on '%s'", blockNumber.getAsLong(), event.channel());
        deliver(blockNumber.getAsLong(), pushDeliveries);
    }

    /**
     * One polling tick. Does nothing unless the notifier is in polling mode.
     *
     * <p>Delivers every block number above the last polled one, at most the catch-up limit of
     * the newest ones, in ascending order. The first tick delivers only the latest block.
     */
    public void pollTick() {
        if (state.get() != NotifierState.POLLING_ACTIVE) {
            return;
        }

        try {
            OptionalLong latest = repository.findLatestBlockNumber();
            if (latest.isEmpty()) {
                LOG.debug("Polling: no committed blocks yet");
                return;
            }

            long current = latest.getAsLong();
            long previous = lastPolledBlock.get();
            if (current <= previous) {
                return;
            }

            long from =
                    previous < 0
                            ? current
                            : Math.max(previous + 1, current - Math.max(1, catchUpLimit) + 1);
            lastPolledBlock.set(current);

            LOG.debugf("Polling: new blocks %d..%d", from, current);
            for (long number = from; number <= current; number++) {
                deliver(number, pollDeliveries);
            }
        } catch (Exception e) {
            LOG.warnf(e, "Polling for new blocks failed, retrying on next tick");
        }
    }

    private void deliver(long blockNumber, Counter counter) {
        BlockCommitListener target = listener;
        if (target == null || state.get() == NotifierState.STOPPED) {
            return;
        }
        try {
            target.onBlockCommitted(blockNumber);
            if (counter != null) {
                counter.increment();
            }
        } catch (Exception e) {
            LOG.errorf(e, "Block listener failed for block %d", blockNumber);
        }
    }

    /**
     * Extracts a block number from a notification payload.
     *
     * <p>Accepts a JSON object with a {@code blockNumber} or {@code number} field (numeric or
     * numeric string), or a bare non-negative integer.
     *
     * @return the block number, or empty if the payload has none
     */
    OptionalLong parseBlockNumber(String payload) {
        if (payload == null || payload.isBlank()) {
            return OptionalLong.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(payload);
            JsonNode value = root;
            if (root.isObject()) {
                value = root.has("blockNumber") ? root.get("blockNumber") : root.get("number");
            }
            return toBlockNumber(value);
        } catch (JsonProcessingException e) {
            return OptionalLong.empty();
        }
    }

    private static OptionalLong toBlockNumber(JsonNode value) {
        if (value == null) {
            return OptionalLong.empty();
        }
        long number;
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            number = value.longValue();
        } else if (value.isTextual()) {
            try {
                number = Long.parseLong(value.textValue().trim());
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        } else {
            return OptionalLong.empty();
        }
        return number < 0 ? OptionalLong.empty() : OptionalLong.of(number);
    }

    private void switchToPolling(String reason, Throwable cause) {
        NotifierState previous =
                state.getAndUpdate(
                        s -> s == NotifierState.STOPPED ? s : NotifierState.POLLING_ACTIVE);
        if (previous == NotifierState.STOPPED || previous == NotifierState.POLLING_ACTIVE) {
            return;
        }

        fallbackReason = cause == null ? reason : reason + ": " + cause.getMessage();
        if (previous == NotifierState.PUSH_ACTIVE) {
            LOG.warnf(
                    "%s, falling back to polling every %s", fallbackReason, pollInterval);
        } else {
            LOG.warnf(
                    "%s, starting in polling mode (every %s)", fallbackReason, pollInterval);
        }
    }

    /**
     * Stops delivery and releases the push connection, if any.
     */
    @PreDestroy
    public void stop() {
        NotifierState previous = state.getAndSet(NotifierState.STOPPED);
        if (previous == NotifierState.STOPPED) {
            return;
        }
        ChangeChannel active = channel;
        if (active != null) {
            active.close();
        }
        LOG.infof("Block change notifier stopped (was %s)", previous);
    }

    public NotifierState getState() {
        return state.get();
    }

    /**
     * Why the notifier is polling instead of listening.
     *
     * @return the reason, or {@code null} if push never failed
     */
    public String getFallbackReason() {
        return fallbackReason;
    }

    public long getLastPolledBlock() {
        return lastPolledBlock.get();
    }

    public Duration getPollInterval() {
        return pollInterval;
    }
}
