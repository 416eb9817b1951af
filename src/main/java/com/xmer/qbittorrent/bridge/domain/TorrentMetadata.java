package com.xmer.qbittorrent.bridge.domain;

/**
 * Last known descriptive data for a tracked torrent. Cached in memory only.
 *
 * @param requestId id of the command that created the torrent, empty when unknown
 */
public record TorrentMetadata(
        String requestId,
        String name,
        String category
) {
    public TorrentMetadata {
        requestId = requestId != null ? requestId : "";
        name = name != null ? name : "";
        category = category != null ? category : "";
    }
}
