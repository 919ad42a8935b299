/* (C)2026 */
package com.ammann.blockstats.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.agroal.api.AgroalDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

class PgChangeChannelFactoryTest {

    private AgroalDataSource dataSource;
    private Connection connection;
    private PGConnection pgConnection;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = mock(AgroalDataSource.class);
        connection = mock(Connection.class);
        pgConnection = mock(PGConnection.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.unwrap(PGConnection.class)).thenReturn(pgConnection);
    }

    @Test
    void listensOnEveryChannel() throws SQLException {
        Statement statement = mock(Statement.class);
        when(connection.createStatement()).thenReturn(statement);

        try (ChangeChannel channel = new PgChangeChannelFactory(dataSource).open()) {
            channel.listen(List.of("block_created", "block_updated"));
        }

        verify(connection).setAutoCommit(true);
        verify(statement).execute("LISTEN block_created");
        verify(statement).execute("LISTEN block_updated");
        verify(connection).close();
    }

    @Test
    void convertsNotificationsToEvents() throws SQLException {
        PGNotification notification = mock(PGNotification.class);
        when(notification.getName()).thenReturn("block_created");
        when(notification.getParameter()).thenReturn("{\"blockNumber\":5}");
        when(pgConnection.getNotifications(250)).thenReturn(new PGNotification[] {notification});

        ChangeChannel channel = new PgChangeChannelFactory(dataSource).open();

        assertThat(channel.awaitEvents(Duration.ofMillis(250)))
                .containsExactly(new ChangeEvent("block_created", "{\"blockNumber\":5}"));
    }

    @Test
    void noNotificationsYieldsEmptyList() throws SQLException {
        when(pgConnection.getNotifications(1000)).thenReturn(null);

        ChangeChannel channel = new PgChangeChannelFactory(dataSource).open();

        assertThat(channel.awaitEvents(Duration.ofSeconds(1))).isEmpty();
    }

    @Test
    void failedUnwrapReleasesConnection() throws SQLException {
        when(connection.unwrap(PGConnection.class)).thenThrow(new SQLException("not a PostgreSQL connection"));

        assertThatThrownBy(() -> new PgChangeChannelFactory(dataSource).open())
                .isInstanceOf(SQLException.class);
        verify(connection).close();
    }

    @Test
    void rejectsUnsafeChannelNames() {
        assertThat(PgChangeChannelFactory.requireChannelName("block_created")).isEqualTo("block_created");
        assertThatThrownBy(() -> PgChangeChannelFactory.requireChannelName("x; DROP TABLE blocks"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PgChangeChannelFactory.requireChannelName(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
