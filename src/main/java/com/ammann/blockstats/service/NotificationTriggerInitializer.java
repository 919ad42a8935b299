package com.ammann.blockstats.service;

import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;


/**
 * Installs the store-side objects that publish block changes.
 *
 * <p>Creates the {@code notify_block_change()} function, which sends the block number as
 * {@code {"blockNumber": n}} to {@code block_created} on insert and {@code block_updated} on
 * update, and the {@code block_change_trigger} on the {@code blocks} table. Existing objects
 * are left untouched. Intended to be called once during application startup.
 */
@ApplicationScoped
public class NotificationTriggerInitializer
{
    private static final Logger LOG = Logger.getLogger(NotificationTriggerInitializer.class);

    static final String FUNCTION_NAME = "notify_block_change";
    static final String TRIGGER_NAME = "block_change_trigger";

    static final String CREATE_FUNCTION_SQL = """
            CREATE OR REPLACE FUNCTION notify_block_change() RETURNS trigger AS $$
            BEGIN
                IF TG_OP = 'INSERT' THEN
                    PERFORM pg_notify('block_created', json_build_object('blockNumber', NEW.number)::text);
                ELSE
                    PERFORM pg_notify('block_updated', json_build_object('blockNumber', NEW.number)::text);
                END IF;
                RETURN NEW;
            END;
            $$ LANGUAGE plpgsql""";

    static final String CREATE_TRIGGER_SQL = """
            CREATE TRIGGER block_change_trigger
                AFTER INSERT OR UPDATE ON blocks
                FOR EACH ROW EXECUTE FUNCTION notify_block_change()""";

    private final AgroalDataSource dataSource;

    @Inject
    public NotificationTriggerInitializer(AgroalDataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Creates the notification function and trigger if they do not exist yet.
     *
     * @return {@code true} if both objects are in place afterwards, {@code false} if setup
     *     failed and push notifications cannot work
     */
    public boolean installTriggers() {
        try (Connection connection = dataSource.getConnection()) {
            if (!exists(connection, "SELECT 1 FROM pg_proc WHERE proname = ?", FUNCTION_NAME)) {
                try (PreparedStatement createFunction = connection.prepareStatement(CREATE_FUNCTION_SQL)) {
                    createFunction.execute();
                }
                LOG.infof("Notification function '%s' created", FUNCTION_NAME);
            } else {
                LOG.infof("Notification function '%s' already exists", FUNCTION_NAME);
            }

            if (!exists(connection, "SELECT 1 FROM pg_trigger WHERE tgname = ?", TRIGGER_NAME)) {
                try (PreparedStatement createTrigger = connection.prepareStatement(CREATE_TRIGGER_SQL)) {
                    createTrigger.execute();
                }
                LOG.infof("Notification trigger '%s' created on table 'blocks'", TRIGGER_NAME);
            } else {
                LOG.infof("Notification trigger '%s' already exists", TRIGGER_NAME);
            }
            return true;

        } catch (Exception e) {
            LOG.warn("Failed to install block change notification trigger, push notifications disabled", e);
            return false;
        }
    }

    private static boolean exists(Connection connection, String sql, String name) throws SQLException {
        try (PreparedStatement check = connection.prepareStatement(sql)) {
            check.setString(1, name);
            try (ResultSet rs = check.executeQuery()) {
                return rs.next();
            }
        }
    }
}
