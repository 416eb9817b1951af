package com.xmer.qbittorrent.bridge.domain;

import com.xmer.qbittorrent.bridge.error.ErrorCodes;
import com.xmer.qbittorrent.bridge.error.NonRetryableException;

import java.util.Map;

/**
 * A validated "add torrent" request.
 */
public record DownloadCommand(
        String id,
        String magnetLink,
        TorrentCategory category
) {
    public static final String MAGNET_PREFIX = "magnet:";

    public DownloadCommand {
        if (id == null || id.isEmpty()) {
            throw new NonRetryableException("Invalid or missing id", ErrorCodes.INVALID_MESSAGE);
        }
        if (magnetLink == null || !magnetLink.startsWith(MAGNET_PREFIX)) {
            throw new NonRetryableException("Invalid or missing magnetLink", ErrorCodes.INVALID_MESSAGE,
                    Map.of("id", id));
        }
        if (category == null) {
            throw new NonRetryableException("Missing category", ErrorCodes.INVALID_CATEGORY, Map.of("id", id));
        }
    }

    /**
     * Builds a command from loosely typed message fields, rejecting anything that is not a usable request.
     */
    public static DownloadCommand of(Object id, Object magnetLink, Object category) {
        if (!(id instanceof String idValue)) {
            throw new NonRetryableException("Invalid or missing id", ErrorCodes.INVALID_MESSAGE);
        }
        if (!(magnetLink instanceof String linkValue)) {
            throw new NonRetryableException("Invalid or missing magnetLink", ErrorCodes.INVALID_MESSAGE,
                    Map.of("id", idValue));
        }
        TorrentCategory resolved = category instanceof String categoryValue
                ? TorrentCategory.fromValue(categoryValue).orElse(null)
                : null;
        if (resolved == null) {
            throw new NonRetryableException(
                    "Invalid category: " + category + ". Must be one of: " + TorrentCategory.allowedValues(),
                    ErrorCodes.INVALID_CATEGORY,
                    Map.of("id", idValue, "category", String.valueOf(category)));
        }
        return new DownloadCommand(idValue, linkValue, resolved);
    }
}
