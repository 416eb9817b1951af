package com.xmer.qbittorrent.bridge.events;

import com.xmer.qbittorrent.bridge.domain.TorrentStatus;

/**
 * Payload shared by progress, stalled and paused events.
 */
public record DownloadProgressEvent(
        String id,
        String hash,
        String name,
        double progress,
        long downloadSpeed,
        long eta,
        String state,
        String category
) implements DownloadEvent {

    public static DownloadProgressEvent of(String id, TorrentStatus status) {
        return new DownloadProgressEvent(
                id,
                status.hash(),
                status.name(),
                status.progress(),
                status.downloadSpeed(),
                status.eta(),
                status.state(),
                status.category());
    }
}
