/* (C)2026 */
package com.ammann.blockstats.enumeration;

/**
 * Lifecycle of the block change notifier.
 *
 * <p>Allowed transitions within a run: {@code STARTING -> PUSH_ACTIVE | POLLING_ACTIVE},
 * {@code PUSH_ACTIVE -> POLLING_ACTIVE}, and any state to {@code STOPPED}. Polling never goes
 * back to push.
 */
public enum NotifierState {
    STARTING,
    PUSH_ACTIVE,
    POLLING_ACTIVE,
    STOPPED;

    /**
     * Whether this state still delivers block notifications.
     */
    public boolean isDelivering() {
        return this == PUSH_ACTIVE || this == POLLING_ACTIVE;
    }
}
