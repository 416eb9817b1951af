package com.xmer.qbittorrent.bridge.tracker;

import com.xmer.qbittorrent.bridge.domain.TorrentMetadata;
import com.xmer.qbittorrent.bridge.domain.TorrentStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryTorrentTrackerTest {

    private static final String HASH = "aabbccddee11223344556677889900aabbccddee";

    private InMemoryTorrentTracker tracker;

    @BeforeEach
    void setup() {
        tracker = new InMemoryTorrentTracker();
    }

    @Test
    void shouldTrackHashOnlyOnce() {
        tracker.track(HASH, new TorrentMetadata("req-1", "", "sonarr"));
        tracker.track(HASH, new TorrentMetadata("req-1", "", "sonarr"));

        assertEquals(List.of(HASH), tracker.trackedHashes());
    }

    @Test
    void shouldForgetMetadataWhenUntracked() {
        tracker.track(HASH, new TorrentMetadata("req-1", "Show", "sonarr"));

        tracker.untrack(HASH);

        assertTrue(tracker.trackedHashes().isEmpty());
        assertTrue(tracker.findMetadata(HASH).isEmpty());
    }

    @Test
    void shouldReturnEmptyForUnknownHash() {
        assertTrue(tracker.findMetadata("0000000000000000000000000000000000000000").isEmpty());
    }

    @Test
    void shouldKeepRequestIdWhenRefreshing() {
        tracker.track(HASH, new TorrentMetadata("req-1", "", "sonarr"));

        tracker.refreshMetadata(List.of(status(HASH, "Some.Show.S01E01", "sonarr")));

        TorrentMetadata metadata = tracker.findMetadata(HASH).orElseThrow();
        assertEquals("req-1", metadata.requestId());
        assertEquals("Some.Show.S01E01", metadata.name());
        assertEquals("sonarr", metadata.category());
    }

    @Test
    void shouldUseEmptyRequestIdWhenNoneKnown() {
        tracker.refreshMetadata(List.of(status(HASH, "Resumed.Game", "games")));

        TorrentMetadata metadata = tracker.findMetadata(HASH).orElseThrow();
        assertEquals("", metadata.requestId());
        assertEquals("Resumed.Game", metadata.name());
    }

    @Test
    void shouldReplaceMetadataExplicitly() {
        tracker.putMetadata(HASH, new TorrentMetadata("req-9", "Movie", "radarr"));

        assertEquals("req-9", tracker.findMetadata(HASH).orElseThrow().requestId());
    }

    private static TorrentStatus status(String hash, String name, String category) {
        return new TorrentStatus(hash, name, 0.5, 1000, 60, "downloading", category, 2048);
    }
}
