/* (C)2026 */
package com.ammann.blockstats.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for creating named ManagedExecutor instances.
 *
 * <p>Provides the "change-notifier-executor" bean used by BlockChangeNotifier: one thread for
 * the bounded LISTEN connection attempt at startup and one for the long-running notification
 * loop.
 */
@ApplicationScoped
public class ExecutorProducer {

    public static final String CHANGE_NOTIFIER_EXECUTOR = "change-notifier-executor";

    /**
     * Produces a named ManagedExecutor for the change notifier.
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named(CHANGE_NOTIFIER_EXECUTOR)
    @ApplicationScoped
    public ManagedExecutor createChangeNotifierExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(2) // connect attempt + listen loop
                .maxQueued(4)
                .propagated(ThreadContext.NONE)
                .cleared(ThreadContext.ALL_REMAINING)
                .build();
    }
}
