package com.xmer.qbittorrent.bridge.client;

import com.xmer.qbittorrent.bridge.domain.TorrentStatus;

import java.util.List;

/**
 * Operations the bridge needs from the download client.
 */
public interface TorrentClient {

    /**
     * @return the lower-case info-hash of the submitted torrent
     */
    String addTorrent(String magnetLink, String category);

    List<TorrentStatus> getTorrentsInfo(List<String> hashes);
}
