package com.xmer.qbittorrent.bridge.events;

/**
 * Emitted when a tracked torrent disappeared from qBittorrent without completing.
 */
public record DownloadRemovedEvent(
        String id,
        String hash,
        String name,
        String category
) implements DownloadEvent {
}
