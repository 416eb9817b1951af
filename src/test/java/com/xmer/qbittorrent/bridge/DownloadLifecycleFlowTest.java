package com.xmer.qbittorrent.bridge;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.xmer.qbittorrent.bridge.domain.CycleResult;
import com.xmer.qbittorrent.bridge.domain.TorrentMetadata;
import com.xmer.qbittorrent.bridge.orchestration.ReconciliationEngine;
import com.xmer.qbittorrent.bridge.testing.QBittorrentWireMockResource;
import com.xmer.qbittorrent.bridge.tracker.TorrentTracker;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import io.smallrye.reactive.messaging.memory.InMemoryConnector;
import io.smallrye.reactive.messaging.memory.InMemorySink;
import io.smallrye.reactive.messaging.memory.InMemorySource;
import io.smallrye.reactive.messaging.rabbitmq.OutgoingRabbitMQMetadata;
import io.vertx.core.json.JsonObject;
import jakarta.enterprise.inject.Any;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@QuarkusTest
@QuarkusTestResource(QBittorrentWireMockResource.class)
class DownloadLifecycleFlowTest {

    private static final String MAGNET = "magnet:?xt=urn:btih:AABBCCDDEE11223344556677889900AABBCCDDEE";
    private static final String HASH = "aabbccddee11223344556677889900aabbccddee";
    private static final String OTHER_HASH = "0123456789abcdef0123456789abcdef01234567";

    @Inject
    @Any
    InMemoryConnector connector;

    @Inject
    ReconciliationEngine engine;

    @Inject
    TorrentTracker tracker;

    private WireMockServer qbittorrent;
    private InMemorySink<JsonObject> events;

    @BeforeEach
    void setup() {
        qbittorrent = QBittorrentWireMockResource.server();
        qbittorrent.resetRequests();
        qbittorrent.stubFor(post(urlEqualTo("/api/v2/torrents/add"))
                .willReturn(aResponse().withStatus(200).withBody("Ok.")));
        events = connector.sink("download-events");
        events.clear();
    }

    @Test
    void shouldFollowSubmittedTorrentUntilComplete() {
        InMemorySource<JsonObject> commands = connector.source("download-commands");
        commands.send(new JsonObject()
                .put("id", "req-42")
                .put("magnetLink", MAGNET)
                .put("category", "sonarr"));

        await().atMost(Duration.ofSeconds(10)).until(() -> tracker.trackedHashes().contains(HASH));
        qbittorrent.verify(postRequestedFor(urlEqualTo("/api/v2/torrents/add")));
        assertTrue(engine.isPending(HASH));

        // qBittorrent has not listed the torrent yet
        stubInfo("[]");
        assertEquals(CycleResult.Outcome.COMPLETED, engine.runCycle().outcome());
        assertTrue(events.received().isEmpty());
        assertTrue(tracker.trackedHashes().contains(HASH));

        stubInfo(infoJson(0.5, "downloading"));
        engine.runCycle();
        await().atMost(Duration.ofSeconds(5)).until(() -> events.received().size() == 1);
        Message<JsonObject> progress = events.received().get(0);
        assertEquals("downloads.progress", routingKey(progress));
        assertEquals("req-42", progress.getPayload().getString("id"));
        assertEquals(HASH, progress.getPayload().getString("hash"));
        assertEquals(1048576L, progress.getPayload().getLong("downloadSpeed"));
        assertFalse(engine.isPending(HASH));

        stubInfo(infoJson(1.0, "uploading"));
        engine.runCycle();
        await().atMost(Duration.ofSeconds(5)).until(() -> events.received().size() == 2);
        Message<JsonObject> complete = events.received().get(1);
        assertEquals("downloads.complete", routingKey(complete));
        assertEquals(734003200L, complete.getPayload().getLong("size"));
        assertFalse(tracker.trackedHashes().contains(HASH));
    }

    @Test
    void shouldSkipCycleWhenQBittorrentFails() {
        tracker.track(OTHER_HASH, new TorrentMetadata("req-7", "", "games"));
        try {
            qbittorrent.stubFor(get(urlPathEqualTo("/api/v2/torrents/info"))
                    .willReturn(aResponse().withStatus(503)));

            CycleResult result = engine.runCycle();

            assertEquals(CycleResult.Outcome.QUERY_FAILED, result.outcome());
            assertTrue(tracker.trackedHashes().contains(OTHER_HASH));
            assertTrue(events.received().isEmpty());
        } finally {
            tracker.untrack(OTHER_HASH);
        }
    }

    private void stubInfo(String body) {
        qbittorrent.stubFor(get(urlPathEqualTo("/api/v2/torrents/info")).willReturn(okJson(body)));
    }

    private static String infoJson(double progress, String state) {
        return "[" + new JsonObject()
                .put("hash", HASH)
                .put("name", "Some.Show.S01E01")
                .put("progress", progress)
                .put("dlspeed", 1048576)
                .put("eta", 300)
                .put("state", state)
                .put("category", "sonarr")
                .put("size", 734003200L)
                .encode() + "]";
    }

    private static String routingKey(Message<JsonObject> message) {
        return message.getMetadata(OutgoingRabbitMQMetadata.class)
                .map(OutgoingRabbitMQMetadata::getRoutingKey)
                .orElse(null);
    }
}
