/* (C)2026 */
package com.ammann.blockstats.scheduled;

import com.ammann.blockstats.service.ResponseCache;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Periodically evicts expired response cache entries so idle keys do not linger.
 */
@ApplicationScoped
public class ResponseCacheSweeper {

    @Inject ResponseCache responseCache;

    @Scheduled(
            every = "${blockstats.cache.sweep-interval:2s}",
            identity = "response-cache-sweep",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void sweep() {
        responseCache.sweep();
    }
}
