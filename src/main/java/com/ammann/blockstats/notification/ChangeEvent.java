/* (C)2026 */
package com.ammann.blockstats.notification;

/**
 * A raw change notification received from the store.
 *
 * @param channel notification channel name
 * @param payload notification payload, unparsed
 */
public record ChangeEvent(String channel, String payload) {}
