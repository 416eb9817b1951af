package com.xmer.qbittorrent.bridge.events;

/**
 * Sent once per continuous polling outage, on the notifications channel.
 *
 * @param failingSinceMs how long polling had been failing when the alert was raised
 * @param timestamp      ISO-8601 instant the alert was raised
 */
public record PollingFailureAlert(
        String service,
        String error,
        long failingSinceMs,
        String timestamp
) {
    public static final String ROUTING_KEY = "notifications.polling.failure";
}
