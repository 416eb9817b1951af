package com.xmer.qbittorrent.bridge.events;

import com.xmer.qbittorrent.bridge.domain.TorrentStatus;

public record DownloadCompleteEvent(
        String id,
        String hash,
        String name,
        long size,
        String category
) implements DownloadEvent {

    public static DownloadCompleteEvent of(String id, TorrentStatus status) {
        return new DownloadCompleteEvent(id, status.hash(), status.name(), status.size(), status.category());
    }
}
