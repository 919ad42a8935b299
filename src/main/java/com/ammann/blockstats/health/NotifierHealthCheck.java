package com.ammann.blockstats.health;

import com.ammann.blockstats.enumeration.NotifierState;
import com.ammann.blockstats.service.BlockChangeNotifier;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness health check for the block change notifier.
 *
 * <p>Polling mode is a degraded but working state and still reports UP; only a stopped
 * notifier is DOWN.
 */
@Liveness
@ApplicationScoped
public class NotifierHealthCheck implements HealthCheck
{
    static final String NAME = "block-change-notifier";

    private final BlockChangeNotifier notifier;

    @Inject
    public NotifierHealthCheck(BlockChangeNotifier notifier)
    {
        this.notifier = notifier;
    }

    @Override
    public HealthCheckResponse call()
    {
        NotifierState state = notifier.getState();

        HealthCheckResponseBuilder builder = HealthCheckResponse.named(NAME)
                .status(state != NotifierState.STOPPED)
                .withData("state", state.name())
                .withData("push-active", state == NotifierState.PUSH_ACTIVE);

        if (state == NotifierState.POLLING_ACTIVE) {
            builder.withData("poll-interval", notifier.getPollInterval().toString());
            builder.withData("last-polled-block", notifier.getLastPolledBlock());
        }
        if (notifier.getFallbackReason() != null) {
            builder.withData("fallback-reason", notifier.getFallbackReason());
        }
        return builder.build();
    }
}
