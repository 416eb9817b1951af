package com.xmer.qbittorrent.bridge.error;

public final class ErrorCodes {

    public static final String QBITTORRENT_CONNECTION = "ERR_QBITTORRENT_CONNECTION";
    public static final String LOGIN_FAILED = "ERR_LOGIN_FAILED";
    public static final String INVALID_CREDENTIALS = "ERR_INVALID_CREDENTIALS";
    public static final String NO_SID = "ERR_NO_SID";
    public static final String ADD_TORRENT = "ERR_ADD_TORRENT";
    public static final String GET_TORRENTS = "ERR_GET_TORRENTS";
    public static final String MALFORMED_RESPONSE = "ERR_MALFORMED_RESPONSE";
    public static final String INVALID_MAGNET = "ERR_INVALID_MAGNET";
    public static final String INVALID_MESSAGE = "ERR_INVALID_MESSAGE";
    public static final String INVALID_CATEGORY = "ERR_INVALID_CATEGORY";

    private ErrorCodes() {
    }
}
