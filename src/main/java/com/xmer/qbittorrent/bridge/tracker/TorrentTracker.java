package com.xmer.qbittorrent.bridge.tracker;

import com.xmer.qbittorrent.bridge.domain.TorrentMetadata;
import com.xmer.qbittorrent.bridge.domain.TorrentStatus;

import java.util.List;
import java.util.Optional;

/**
 * Tracks the torrents this service submitted.
 * Membership is durable and survives restarts; metadata is a best-effort in-memory cache.
 */
public interface TorrentTracker {

    /**
     * Start tracking a hash. Tracking an already tracked hash is not an error.
     */
    void track(String hash, TorrentMetadata metadata);

    /**
     * Stop tracking a hash and forget its metadata.
     */
    void untrack(String hash);

    /**
     * Current durable membership. After a restart this is where polling resumes from.
     */
    List<String> trackedHashes();

    Optional<TorrentMetadata> findMetadata(String hash);

    void putMetadata(String hash, TorrentMetadata metadata);

    /**
     * Refresh cached name and category from a status query, keeping the known request id.
     */
    void refreshMetadata(List<TorrentStatus> statuses);

    /**
     * Release the underlying connection, if any.
     */
    default void close() {
    }
}
