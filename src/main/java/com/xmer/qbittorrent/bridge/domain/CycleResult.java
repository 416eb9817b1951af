package com.xmer.qbittorrent.bridge.domain;

/**
 * Result of a single reconciliation cycle.
 */
public record CycleResult(
        Outcome outcome,
        int tracked,
        int published,
        int completed,
        int removed,
        int itemFailures,
        String errorMessage
) {
    public enum Outcome {
        IDLE,
        COMPLETED,
        QUERY_FAILED,
        SKIPPED,
        STOPPED,
        FAILED
    }

    public static CycleResult idle() {
        return new CycleResult(Outcome.IDLE, 0, 0, 0, 0, 0, null);
    }

    /**
     * @param itemFailures torrents whose event could not be published or whose store update failed;
     *                     they stay tracked and are retried on the next cycle
     */
    public static CycleResult completed(int tracked, int published, int completed, int removed, int itemFailures) {
        return new CycleResult(Outcome.COMPLETED, tracked, published, completed, removed, itemFailures, null);
    }

    public static CycleResult queryFailed(int tracked, String error) {
        return new CycleResult(Outcome.QUERY_FAILED, tracked, 0, 0, 0, 0, error);
    }

    public static CycleResult skipped() {
        return new CycleResult(Outcome.SKIPPED, 0, 0, 0, 0, 0, "Previous cycle still running");
    }

    public static CycleResult stopped() {
        return new CycleResult(Outcome.STOPPED, 0, 0, 0, 0, 0, null);
    }

    public static CycleResult failed(String error) {
        return new CycleResult(Outcome.FAILED, 0, 0, 0, 0, 0, error);
    }
}
