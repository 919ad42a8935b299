/* (C)2026 */
package com.ammann.blockstats.startup;

import com.ammann.blockstats.exception.StoreUnavailableException;
import com.ammann.blockstats.model.BlockSummary;
import com.ammann.blockstats.repository.BlockRepository;
import com.ammann.blockstats.service.BlockChangeNotifier;
import com.ammann.blockstats.service.NotificationTriggerInitializer;
import com.ammann.blockstats.service.SlidingWindowAggregator;
import com.ammann.blockstats.websocket.SubscriptionHub;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Brings the block pipeline up on application startup and down on shutdown.
 * <p>
 * Startup order:
 * <ol>
 *   <li>Cold start: replay the latest persisted blocks into the stats window</li>
 *   <li>Install the notification trigger if it is missing</li>
 *   <li>Start the change notifier with the subscription hub as its listener</li>
 * </ol>
 * <p>
 * If the block store cannot be reached during the cold start the exception propagates out of
 * the startup observer and the application exits with a non-zero status.
 */
@ApplicationScoped
public class BlockStatsBootstrap {

    private static final Logger LOG = Logger.getLogger(BlockStatsBootstrap.class);

    private final SlidingWindowAggregator aggregator;
    private final BlockRepository blockRepository;
    private final NotificationTriggerInitializer triggerInitializer;
    private final BlockChangeNotifier notifier;
    private final SubscriptionHub hub;

    @Inject
    public BlockStatsBootstrap(
            SlidingWindowAggregator aggregator,
            BlockRepository blockRepository,
            NotificationTriggerInitializer triggerInitializer,
            BlockChangeNotifier notifier,
            SubscriptionHub hub) {
        this.aggregator = aggregator;
        this.blockRepository = blockRepository;
        this.triggerInitializer = triggerInitializer;
        this.notifier = notifier;
        this.hub = hub;
    }

    void onStart(@Observes StartupEvent event) {
        start();
    }

    void onStop(@Observes ShutdownEvent event) {
        LOG.info("Block stats pipeline shutting down");
        notifier.stop();
    }

    /**
     * Runs the startup sequence.
     *
     * @throws StoreUnavailableException if the latest blocks cannot be loaded
     */
    public void start() {
        coldStart();
        boolean pushAvailable = triggerInitializer.installTriggers();
        notifier.start(hub, pushAvailable);
        LOG.infof("Block stats pipeline started (notifier state: %s)", notifier.getState());
    }

    private void coldStart() {
        List<BlockSummary> latest;
        try {
            latest = blockRepository.findLatestSummaries(aggregator.getWindowSize());
        } catch (RuntimeException e) {
            LOG.fatalf(e, "Block store unreachable during cold start, cannot continue");
            throw new StoreUnavailableException("Block store unreachable during cold start", e);
        }
        aggregator.initialize(latest);
        LOG.infof(
                "Cold start loaded %d of the latest blocks into a window of %d",
                aggregator.getBlockCount(), aggregator.getWindowSize());
    }
}
