package com.xmer.qbittorrent.bridge.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * One entry of the qBittorrent {@code /api/v2/torrents/info} response.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TorrentStatus(
        @JsonProperty("hash") String hash,
        @JsonProperty("name") String name,
        @JsonProperty("progress") double progress,
        @JsonProperty("dlspeed") long downloadSpeed,
        @JsonProperty("eta") long eta,
        @JsonProperty("state") String state,
        @JsonProperty("category") String category,
        @JsonProperty("size") long size
) {
    public static final String STATE_STALLED = "stalledDL";
    public static final String STATE_PAUSED = "pausedDL";

    public TorrentStatus {
        if (hash == null || hash.isBlank()) {
            throw new IllegalArgumentException("hash cannot be blank");
        }
        hash = hash.toLowerCase(Locale.ROOT);
        name = name != null ? name : "";
        state = state != null ? state : "";
        category = category != null ? category : "";
    }

    public boolean isComplete() {
        return progress >= 1.0;
    }
}
