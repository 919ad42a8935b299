/* (C)2026 */
package com.ammann.blockstats.notification;

import java.sql.SQLException;

/**
 * Opens {@link ChangeChannel}s on the persistent store.
 */
@FunctionalInterface
public interface ChangeChannelFactory {

    ChangeChannel open() throws SQLException;
}
