package com.xmer.qbittorrent.bridge.orchestration;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * A continuous run of failed polls. {@code alertSent} can only be set while the window is open;
 * closing the window clears both.
 */
public final class FailureWindow {

    private Instant firstFailureAt;
    private boolean alertSent;

    /**
     * Open the window at {@code now} unless it is already open.
     */
    void open(Instant now) {
        if (firstFailureAt == null) {
            firstFailureAt = now;
        }
    }

    void close() {
        firstFailureAt = null;
        alertSent = false;
    }

    void markAlertSent() {
        if (firstFailureAt == null) {
            throw new IllegalStateException("No open failure window");
        }
        alertSent = true;
    }

    Duration elapsed(Instant now) {
        return firstFailureAt == null ? Duration.ZERO : Duration.between(firstFailureAt, now);
    }

    public boolean isOpen() {
        return firstFailureAt != null;
    }

    public boolean alertSent() {
        return alertSent;
    }

    public Optional<Instant> firstFailureAt() {
        return Optional.ofNullable(firstFailureAt);
    }
}
