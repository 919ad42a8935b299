/* (C)2026 */
package com.ammann.blockstats.scheduled;

import com.ammann.blockstats.service.BlockChangeNotifier;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Drives the polling fallback of the {@link BlockChangeNotifier}.
 *
 * <p>Ticks every {@code blockstats.notifier.poll-interval}. A tick is a no-op while push
 * notifications work. Overlapping ticks are skipped.
 */
@ApplicationScoped
public class BlockPollingScheduler {

    @Inject BlockChangeNotifier notifier;

    @Scheduled(
            every = "${blockstats.notifier.poll-interval:5s}",
            identity = "block-poll",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void poll() {
        notifier.pollTick();
    }
}
