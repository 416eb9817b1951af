package com.xmer.qbittorrent.bridge.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Categories a download command may request. The wire value is also the qBittorrent category name.
 */
public enum TorrentCategory {
    SONARR,
    RADARR,
    GAMES;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<TorrentCategory> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (TorrentCategory category : values()) {
            if (category.value().equals(value)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    public static String allowedValues() {
        return Arrays.stream(values()).map(TorrentCategory::value).collect(Collectors.joining(", "));
    }
}
