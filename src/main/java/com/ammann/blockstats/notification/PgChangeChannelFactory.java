/* (C)2026 */
package com.ammann.blockstats.notification;

import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import org.jboss.logging.Logger;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

/**
 * Opens PostgreSQL {@code LISTEN} channels on a dedicated pooled connection.
 *
 * <p>The connection is held for the lifetime of the channel and returned to the pool on
 * {@link ChangeChannel#close()}.
 */
@ApplicationScoped
public class PgChangeChannelFactory implements ChangeChannelFactory {

    private static final Logger LOG = Logger.getLogger(PgChangeChannelFactory.class);
    private static final Pattern CHANNEL_NAME = Pattern.compile("[a-z_][a-z0-9_]*");

    private final AgroalDataSource dataSource;

    @Inject
    public PgChangeChannelFactory(AgroalDataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public ChangeChannel open() throws SQLException {
        Connection connection = dataSource.getConnection();
        try {
            connection.setAutoCommit(true);
            PGConnection pgConnection = connection.unwrap(PGConnection.class);
            return new PgChangeChannel(connection, pgConnection);
        } catch (SQLException e) {
            closeQuietly(connection);
            throw e;
        }
    }

    private static void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            LOG.debugf(e, "Failed to close notification connection");
        }
    }

    static String requireChannelName(String channel) {
        if (channel == null || !CHANNEL_NAME.matcher(channel).matches()) {
            throw new IllegalArgumentException("Invalid notification channel name: " + channel);
        }
        return channel;
    }

    /**
     * {@link ChangeChannel} backed by {@link PGConnection#getNotifications(int)}.
     */
    static final class PgChangeChannel implements ChangeChannel {

        private final Connection connection;
        private final PGConnection pgConnection;

        PgChangeChannel(Connection connection, PGConnection pgConnection) {
            this.connection = connection;
            this.pgConnection = pgConnection;
        }

        @Override
        public void listen(Collection<String> channels) throws SQLException {
            try (Statement statement = connection.createStatement()) {
                for (String channel : channels) {
                    statement.execute("LISTEN " + requireChannelName(channel));
                    LOG.infof("Listening for notifications on channel '%s'", channel);
                }
            }
        }

        @Override
        public List<ChangeEvent> awaitEvents(Duration timeout) throws SQLException {
            PGNotification[] notifications =
                    pgConnection.getNotifications((int) Math.max(1, timeout.toMillis()));
            if (notifications == null || notifications.length == 0) {
                return List.of();
            }
            List<ChangeEvent> events = new ArrayList<>(notifications.length);
            for (PGNotification notification : notifications) {
                events.add(new ChangeEvent(notification.getName(), notification.getParameter()));
            }
            return events;
        }

        @Override
        public void close() {
            closeQuietly(connection);
        }
    }
}
