/* (C)2026 */
package com.ammann.blockstats.notification;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * A push-style subscription to change notifications of the persistent store.
 *
 * <p>Any {@link SQLException} thrown after {@link #listen(Collection)} succeeded means the
 * channel is broken; callers are expected to close it and fall back to polling.
 */
public interface ChangeChannel extends AutoCloseable {

    /**
     * Subscribes to the given notification channels.
     */
    void listen(Collection<String> channels) throws SQLException;

    /**
     * Waits up to {@code timeout} for notifications.
     *
     * @return received events, empty if none arrived in time
     */
    List<ChangeEvent> awaitEvents(Duration timeout) throws SQLException;

    @Override
    void close();
}
