/* (C)2026 */
package com.ammann.blockstats.config;

import com.ammann.blockstats.service.SlidingWindowAggregator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * CDI producer for the process-wide {@link SlidingWindowAggregator}.
 *
 * <p>The aggregator itself is a plain class; this producer owns its single instance and hands
 * it to the subscription hub, the REST resources and the startup bootstrap.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>blockstats.aggregator.window-size</li>
 *   <li>blockstats.aggregator.assumed-block-interval</li>
 * </ul>
 */
@ApplicationScoped
public class AggregatorProducer {

    @ConfigProperty(name = "blockstats.aggregator.window-size", defaultValue = "10")
    int windowSize;

    @ConfigProperty(name = "blockstats.aggregator.assumed-block-interval", defaultValue = "12s")
    Duration assumedBlockInterval;

    @Produces
    @Singleton
    public SlidingWindowAggregator createAggregator() {
        return new SlidingWindowAggregator(windowSize, assumedBlockInterval, Clock.systemUTC());
    }
}
