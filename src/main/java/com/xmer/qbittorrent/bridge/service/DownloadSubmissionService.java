package com.xmer.qbittorrent.bridge.service;

import com.xmer.qbittorrent.bridge.client.TorrentClient;
import com.xmer.qbittorrent.bridge.domain.DownloadCommand;
import com.xmer.qbittorrent.bridge.domain.TorrentMetadata;
import com.xmer.qbittorrent.bridge.orchestration.ReconciliationEngine;
import com.xmer.qbittorrent.bridge.tracker.TorrentTracker;
import com.xmer.qbittorrent.bridge.util.InfoHash;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Submits a download to qBittorrent and starts tracking it.
 * <p>
 * The hash is marked pending before qBittorrent is called, so a poll that runs before the torrent
 * shows up in qBittorrent does not report it as removed.
 */
@ApplicationScoped
public class DownloadSubmissionService {

    private static final Logger LOG = Logger.getLogger(DownloadSubmissionService.class);

    @Inject
    TorrentClient client;

    @Inject
    TorrentTracker tracker;

    @Inject
    ReconciliationEngine engine;

    /**
     * @return the info-hash now tracked for the command
     */
    public String submit(DownloadCommand command) {
        String hash = InfoHash.fromMagnet(command.magnetLink());
        String category = command.category().value();
        boolean newlyPending = engine.markPending(hash);

        try {
            client.addTorrent(command.magnetLink(), category);
            tracker.track(hash, new TorrentMetadata(command.id(), "", category));
        } catch (RuntimeException e) {
            if (newlyPending) {
                engine.releasePending(hash);
            }
            LOG.warnf("Failed to submit torrent %s for request %s: %s", hash, command.id(), e.getMessage());
            throw e;
        }

        LOG.infof("Tracking torrent %s for request %s (category %s)", hash, command.id(), category);
        return hash;
    }
}
