package com.xmer.qbittorrent.bridge.orchestration;

import com.xmer.qbittorrent.bridge.events.EventPublisher;
import com.xmer.qbittorrent.bridge.events.PollingFailureAlert;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Raises one alert per polling outage once it has lasted longer than the threshold.
 * Not thread-safe; only the reconciliation cycle touches it.
 */
public class PollFailureAlerter {

    private static final Logger LOG = Logger.getLogger(PollFailureAlerter.class);

    private final EventPublisher publisher;
    private final Clock clock;
    private final Duration threshold;
    private final String serviceName;
    private final FailureWindow window = new FailureWindow();

    public PollFailureAlerter(EventPublisher publisher, Clock clock, Duration threshold, String serviceName) {
        this.publisher = publisher;
        this.clock = clock;
        this.threshold = threshold;
        this.serviceName = serviceName;
    }

    /**
     * Record a failed poll and alert if the outage crossed the threshold and nobody was told yet.
     *
     * @return true if an alert was published by this call
     */
    public boolean recordFailure(Throwable error) {
        Instant now = clock.instant();
        window.open(now);

        Duration elapsed = window.elapsed(now);
        if (elapsed.compareTo(threshold) < 0 || window.alertSent()) {
            return false;
        }

        PollingFailureAlert alert = new PollingFailureAlert(
                serviceName,
                describe(error),
                elapsed.toMillis(),
                now.toString());
        try {
            publisher.publishAlert(alert);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Could not publish polling failure alert, will retry on the next failed poll");
            return false;
        }

        window.markAlertSent();
        LOG.errorf("Polling failure alert sent: failing for %d ms", elapsed.toMillis());
        return true;
    }

    public void recordSuccess() {
        if (window.isOpen()) {
            LOG.infof("Polling recovered after %d ms", window.elapsed(clock.instant()).toMillis());
        }
        window.close();
    }

    public FailureWindow window() {
        return window;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }
}
