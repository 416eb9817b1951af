package com.xmer.qbittorrent.bridge.orchestration;

import com.xmer.qbittorrent.bridge.client.TorrentClient;
import com.xmer.qbittorrent.bridge.domain.CycleResult;
import com.xmer.qbittorrent.bridge.domain.TorrentMetadata;
import com.xmer.qbittorrent.bridge.domain.TorrentStatus;
import com.xmer.qbittorrent.bridge.events.DownloadCompleteEvent;
import com.xmer.qbittorrent.bridge.events.DownloadEventType;
import com.xmer.qbittorrent.bridge.events.DownloadProgressEvent;
import com.xmer.qbittorrent.bridge.events.DownloadRemovedEvent;
import com.xmer.qbittorrent.bridge.events.EventPublisher;
import com.xmer.qbittorrent.bridge.tracker.TorrentTracker;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Reconciles tracked torrents against qBittorrent and turns each status into a lifecycle event.
 * Handles the main flow: list tracked → query → detect removals → classify → untrack finished.
 * <p>
 * Hashes submitted but not yet seen in any status query are pending: qBittorrent may not list a
 * torrent right after it was added, so a pending hash missing from the result is not a removal.
 * <p>
 * Only one cycle runs at a time. A cycle triggered while another is in flight is skipped.
 */
@ApplicationScoped
public class ReconciliationEngine {

    private static final Logger LOG = Logger.getLogger(ReconciliationEngine.class);
    private static final String UNKNOWN = "unknown";

    private final TorrentTracker tracker;
    private final TorrentClient client;
    private final EventPublisher publisher;
    private final PollFailureAlerter alerter;
    private final Duration shutdownGrace;

    private final Set<String> pendingHashes = ConcurrentHashMap.newKeySet();
    private final ReentrantLock cycleLock = new ReentrantLock();
    private volatile boolean stopped;

    public ReconciliationEngine(
            TorrentTracker tracker,
            TorrentClient client,
            EventPublisher publisher,
            Clock clock,
            @ConfigProperty(name = "qbittorrent.poll.failure-alert-threshold", defaultValue = "PT10M") Duration alertThreshold,
            @ConfigProperty(name = "qbittorrent.service-name", defaultValue = "qbittorrent-consumer") String serviceName,
            @ConfigProperty(name = "qbittorrent.poll.shutdown-grace", defaultValue = "PT30S") Duration shutdownGrace
    ) {
        this.tracker = tracker;
        this.client = client;
        this.publisher = publisher;
        this.alerter = new PollFailureAlerter(publisher, clock, alertThreshold, serviceName);
        this.shutdownGrace = shutdownGrace;
    }

    /**
     * Run one reconciliation cycle. Never throws; failures are logged and reported in the result.
     */
    public CycleResult runCycle() {
        if (stopped) {
            return CycleResult.stopped();
        }
        if (!cycleLock.tryLock()) {
            LOG.debug("Previous reconciliation cycle still running, skipping");
            return CycleResult.skipped();
        }

        try {
            if (stopped) {
                return CycleResult.stopped();
            }
            return reconcile();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Reconciliation cycle failed");
            return CycleResult.failed(e.getMessage());
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Mark a hash as submitted but not yet confirmed by qBittorrent.
     *
     * @return false if the hash was already pending
     */
    public boolean markPending(String hash) {
        return pendingHashes.add(hash);
    }

    public void releasePending(String hash) {
        pendingHashes.remove(hash);
    }

    public boolean isPending(String hash) {
        return pendingHashes.contains(hash);
    }

    /**
     * Prevent further cycles. An in-flight cycle is allowed to finish, bounded by the shutdown grace.
     */
    public void stop() {
        stopped = true;
        try {
            if (cycleLock.tryLock(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                cycleLock.unlock();
            } else {
                LOG.warnf("In-flight reconciliation cycle did not finish within %s", shutdownGrace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.info("Polling stopped");
    }

    public boolean isStopped() {
        return stopped;
    }

    FailureWindow failureWindow() {
        return alerter.window();
    }

    private CycleResult reconcile() {
        List<String> hashes = tracker.trackedHashes();
        if (hashes.isEmpty()) {
            return CycleResult.idle();
        }

        List<TorrentStatus> statuses;
        try {
            statuses = client.getTorrentsInfo(hashes);
        } catch (RuntimeException e) {
            LOG.warnf("Poll failed: %s", e.getMessage());
            alerter.recordFailure(e);
            return CycleResult.queryFailed(hashes.size(), e.getMessage());
        }

        alerter.recordSuccess();
        tracker.refreshMetadata(statuses);

        Set<String> reported = statuses.stream()
                .map(TorrentStatus::hash)
                .collect(Collectors.toSet());

        int published = 0;
        int removed = 0;
        int failures = 0;
        for (String hash : hashes) {
            if (!reported.contains(hash) && !pendingHashes.contains(hash)) {
                try {
                    publishRemoved(hash);
                    published++;
                    removed++;
                } catch (RuntimeException e) {
                    LOG.errorf(e, "Failed to report removal of %s, will retry next cycle", hash);
                    failures++;
                }
            }
        }

        for (String hash : hashes) {
            if (reported.contains(hash) && pendingHashes.remove(hash)) {
                LOG.debugf("Torrent confirmed by qBittorrent: %s", hash);
            }
        }

        int completed = 0;
        for (TorrentStatus status : statuses) {
            try {
                if (publishStatus(status) == DownloadEventType.COMPLETE) {
                    completed++;
                }
                published++;
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to process status of %s (%s)", status.name(), status.hash());
                failures++;
            }
        }

        if (failures > 0) {
            LOG.warnf("Reconciliation cycle finished with %d failed torrents", failures);
        }
        LOG.debugf("Reconciliation cycle complete: %d tracked, %d reported, %d completed, %d removed",
                hashes.size(), statuses.size(), completed, removed);
        return CycleResult.completed(hashes.size(), published, completed, removed, failures);
    }

    /**
     * Completion wins over stalled/paused: qBittorrent can still report a transitional state on the
     * snapshot where progress reaches 1.0.
     */
    private DownloadEventType publishStatus(TorrentStatus status) {
        String requestId = requestIdOf(status.hash());

        if (status.isComplete()) {
            publisher.publish(DownloadEventType.COMPLETE, DownloadCompleteEvent.of(requestId, status));
            tracker.untrack(status.hash());
            LOG.infof("Download complete: %s (%s)", status.name(), status.hash());
            return DownloadEventType.COMPLETE;
        }

        DownloadEventType type = switch (status.state()) {
            case TorrentStatus.STATE_STALLED -> DownloadEventType.STALLED;
            case TorrentStatus.STATE_PAUSED -> DownloadEventType.PAUSED;
            default -> DownloadEventType.PROGRESS;
        };
        publisher.publish(type, DownloadProgressEvent.of(requestId, status));
        return type;
    }

    private void publishRemoved(String hash) {
        Optional<TorrentMetadata> metadata = tracker.findMetadata(hash);
        publisher.publish(DownloadEventType.REMOVED, new DownloadRemovedEvent(
                metadata.map(TorrentMetadata::requestId).orElse(""),
                hash,
                metadata.map(TorrentMetadata::name).orElse(UNKNOWN),
                metadata.map(TorrentMetadata::category).orElse(UNKNOWN)));
        tracker.untrack(hash);
        LOG.infof("Torrent removed from qBittorrent: %s", hash);
    }

    private String requestIdOf(String hash) {
        return tracker.findMetadata(hash).map(TorrentMetadata::requestId).orElse("");
    }
}
