package com.xmer.qbittorrent.bridge.events;

/**
 * Outbound side of the bridge. Implementations decide the transport; callers only pick the event kind.
 */
public interface EventPublisher {

    void publish(DownloadEventType type, DownloadEvent event);

    void publishAlert(PollingFailureAlert alert);
}
