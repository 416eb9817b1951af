package com.xmer.qbittorrent.bridge.tracker;

import com.xmer.qbittorrent.bridge.domain.TorrentMetadata;
import com.xmer.qbittorrent.bridge.domain.TorrentStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metadata cache shared by the tracker implementations. Subclasses only provide membership.
 */
public abstract class AbstractTorrentTracker implements TorrentTracker {

    private final Map<String, TorrentMetadata> metadataByHash = new ConcurrentHashMap<>();

    protected abstract void addMember(String hash);

    protected abstract void removeMember(String hash);

    @Override
    public void track(String hash, TorrentMetadata metadata) {
        addMember(hash);
        if (metadata != null) {
            metadataByHash.put(hash, metadata);
        }
    }

    @Override
    public void untrack(String hash) {
        removeMember(hash);
        metadataByHash.remove(hash);
    }

    @Override
    public Optional<TorrentMetadata> findMetadata(String hash) {
        return Optional.ofNullable(metadataByHash.get(hash));
    }

    @Override
    public void putMetadata(String hash, TorrentMetadata metadata) {
        metadataByHash.put(hash, metadata);
    }

    @Override
    public void refreshMetadata(List<TorrentStatus> statuses) {
        for (TorrentStatus status : statuses) {
            metadataByHash.compute(status.hash(), (hash, existing) -> new TorrentMetadata(
                    existing != null ? existing.requestId() : "",
                    status.name(),
                    status.category()));
        }
    }
}
