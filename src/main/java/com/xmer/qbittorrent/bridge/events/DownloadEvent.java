package com.xmer.qbittorrent.bridge.events;

/**
 * Payload of a lifecycle event. Serialized as JSON with the record components as fields.
 */
public interface DownloadEvent {

    /**
     * Request id of the command that created the torrent, empty when unknown.
     */
    String id();

    String hash();
}
