package com.xmer.qbittorrent.bridge.error;

import java.util.Map;

/**
 * Bad input or bad credentials. Retrying the same request will fail the same way.
 */
public class NonRetryableException extends DownloadBridgeException {

    public NonRetryableException(String message, String code) {
        this(message, code, Map.of());
    }

    public NonRetryableException(String message, String code, Map<String, Object> context) {
        super(message, code, context, null);
    }

    @Override
    public boolean retryable() {
        return false;
    }
}
