package com.ammann.blockstats.health;

import com.ammann.blockstats.repository.BlockRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;

/**
 * Readiness health check that verifies the block store is reachable and responsive.
 *
 * <p>Reports DOWN if the queries fail or take longer than 1 second. Exposes the stored block
 * count, the latest block number and query latency as health check data.
 */
@Readiness
@ApplicationScoped
public class DatabaseHealthCheck implements HealthCheck {

    static final String NAME = "database-health";

    private final BlockRepository blockRepository;

    @Inject
    public DatabaseHealthCheck(BlockRepository blockRepository) {
        this.blockRepository = blockRepository;
    }

    @Override
    public HealthCheckResponse call() {
        try {
            Instant start = Instant.now();

            long totalBlocks = blockRepository.countBlocks();
            OptionalLong latest = blockRepository.findLatestBlockNumber();

            Duration queryTime = Duration.between(start, Instant.now());
            boolean performanceOk = queryTime.toMillis() < 1000; // < 1 second

            HealthCheckResponseBuilder builder = HealthCheckResponse.named(NAME)
                    .status(performanceOk)
                    .withData("total-blocks", totalBlocks)
                    .withData("query-time-ms", queryTime.toMillis())
                    .withData("performance-ok", performanceOk)
                    .withData("database-type", "PostgreSQL");
            if (latest.isPresent()) {
                builder.withData("latest-block", latest.getAsLong());
            }
            return builder.build();

        } catch (Exception e) {
            return HealthCheckResponse.named(NAME)
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .withData("database-accessible", false)
                    .build();
        }
    }
}
