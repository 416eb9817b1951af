package com.xmer.qbittorrent.bridge.error;

import java.util.Map;

/**
 * Base for failures raised by the bridge.
 * The {@link #code()} is stable and safe to log or put on a dead-letter header.
 */
public abstract class DownloadBridgeException extends RuntimeException {

    private final String code;
    private final Map<String, Object> context;

    protected DownloadBridgeException(String message, String code, Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.context = context != null ? Map.copyOf(context) : Map.of();
    }

    public String code() {
        return code;
    }

    public Map<String, Object> context() {
        return context;
    }

    /**
     * Whether redelivering the same input could succeed.
     */
    public abstract boolean retryable();
}
