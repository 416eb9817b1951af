package com.xmer.qbittorrent.bridge.orchestration;

import com.xmer.qbittorrent.bridge.domain.CycleResult;
import com.xmer.qbittorrent.bridge.tracker.TorrentTracker;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Optional;

/**
 * Drives the reconciliation engine on a fixed interval and ties it to the application lifecycle.
 * Set {@code qbittorrent.poll.interval=off} to disable polling.
 */
@ApplicationScoped
public class ReconciliationScheduler {

    private static final Logger LOG = Logger.getLogger(ReconciliationScheduler.class);

    @Inject
    ReconciliationEngine engine;

    @Inject
    TorrentTracker tracker;

    @ConfigProperty(name = "qbittorrent.poll.interval")
    String interval;

    @ConfigProperty(name = "qbittorrent.poll.legacy-interval-ms")
    Optional<Long> legacyIntervalMs;

    void onStartup(@Observes StartupEvent event) {
        legacyIntervalWarning(legacyIntervalMs, interval).ifPresent(LOG::warn);
        try {
            LOG.infof("Resuming with %d tracked torrents", tracker.trackedHashes().size());
        } catch (RuntimeException e) {
            LOG.warnf(e, "Could not read tracked torrents on startup, polling will retry");
        }
    }

    @Scheduled(identity = "download-reconciliation",
            every = "${qbittorrent.poll.interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void poll() {
        CycleResult result = engine.runCycle();
        LOG.tracef("Reconciliation cycle finished: %s", result);
    }

    /**
     * Deployments configured with {@code PROGRESS_INTERVAL_MS} silently fall back to the default
     * interval, so point them at {@code PROGRESS_INTERVAL}.
     */
    static Optional<String> legacyIntervalWarning(Optional<Long> legacyMs, String interval) {
        return legacyMs.map(ms -> String.format(
                "PROGRESS_INTERVAL_MS=%d is ignored, polling every %s; set PROGRESS_INTERVAL=%s instead",
                ms, interval, Duration.ofMillis(ms)));
    }

    void onShutdown(@Observes ShutdownEvent event) {
        LOG.info("Shutting down...");
        engine.stop();
        tracker.close();
        LOG.info("Shutdown complete");
    }
}
