package com.xmer.qbittorrent.bridge.orchestration;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconciliationSchedulerTest {

    @Test
    void shouldWarnWhenLegacyMillisecondIntervalIsSet() {
        Optional<String> warning = ReconciliationScheduler.legacyIntervalWarning(Optional.of(15000L), "30s");

        assertEquals(
                "PROGRESS_INTERVAL_MS=15000 is ignored, polling every 30s; set PROGRESS_INTERVAL=PT15S instead",
                warning.orElseThrow());
    }

    @Test
    void shouldStayQuietWithoutLegacyInterval() {
        assertTrue(ReconciliationScheduler.legacyIntervalWarning(Optional.empty(), "30s").isEmpty());
    }
}
