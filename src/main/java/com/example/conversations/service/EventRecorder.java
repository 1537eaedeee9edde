package com.example.conversations.service;

import java.util.Map;

/**
 * Sink for notable service events. Implementations are fire-and-forget: they must
 * not throw and must not block the caller for any meaningful time.
 */
public interface EventRecorder {

    void recordInfo(String message, Map<String, ?> context);

    void recordWarning(String message, Map<String, ?> context);

    /**
     * @param cause the failure being recorded, may be {@code null}
     */
    void recordError(String message, Map<String, ?> context, Throwable cause);
}
