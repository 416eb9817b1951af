package com.xmer.qbittorrent.bridge.error;

import java.util.Map;

/**
 * The upstream API answered, but not in the shape we rely on (login rejected with an HTTP error,
 * no session cookie, unreadable status body). Usually a configuration or version mismatch.
 */
public class ApiContractException extends DownloadBridgeException {

    public ApiContractException(String message, String code) {
        this(message, code, Map.of(), null);
    }

    public ApiContractException(String message, String code, Map<String, Object> context) {
        this(message, code, context, null);
    }

    public ApiContractException(String message, String code, Map<String, Object> context, Throwable cause) {
        super(message, code, context, cause);
    }

    @Override
    public boolean retryable() {
        return false;
    }
}
