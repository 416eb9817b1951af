package com.xmer.qbittorrent.bridge.events;

/**
 * Lifecycle events emitted for a tracked torrent, one routing key each.
 */
public enum DownloadEventType {
    PROGRESS("downloads.progress"),
    STALLED("downloads.stalled"),
    PAUSED("downloads.paused"),
    COMPLETE("downloads.complete"),
    REMOVED("downloads.removed");

    private final String routingKey;

    DownloadEventType(String routingKey) {
        this.routingKey = routingKey;
    }

    public String routingKey() {
        return routingKey;
    }
}
