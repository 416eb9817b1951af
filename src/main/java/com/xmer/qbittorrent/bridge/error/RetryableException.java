package com.xmer.qbittorrent.bridge.error;

import java.util.Map;

/**
 * Transport or upstream failure that may go away on its own (connection refused, timeout, 5xx).
 */
public class RetryableException extends DownloadBridgeException {

    public RetryableException(String message, String code) {
        this(message, code, Map.of(), null);
    }

    public RetryableException(String message, String code, Map<String, Object> context) {
        this(message, code, context, null);
    }

    public RetryableException(String message, String code, Map<String, Object> context, Throwable cause) {
        super(message, code, context, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
