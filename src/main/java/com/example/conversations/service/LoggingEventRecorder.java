package com.example.conversations.service;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.slf4j.event.Level;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link EventRecorder} that writes through SLF4J. Context entries are exposed in the
 * MDC for the duration of the log call and appended to the message.
 */
@Slf4j
@Component
public class LoggingEventRecorder implements EventRecorder {

    @Override
    public void recordInfo(String message, Map<String, ?> context) {
        record(Level.INFO, message, context, null);
    }

    @Override
    public void recordWarning(String message, Map<String, ?> context) {
        record(Level.WARN, message, context, null);
    }

    @Override
    public void recordError(String message, Map<String, ?> context, Throwable cause) {
        record(Level.ERROR, message, context, cause);
    }

    private void record(Level level, String message, Map<String, ?> context, Throwable cause) {
        List<String> added = new ArrayList<>();
        try {
            if (context != null) {
                context.forEach((key, value) -> {
                    if (key != null && MDC.get(key) == null) {
                        MDC.put(key, String.valueOf(value));
                        added.add(key);
                    }
                });
            }
            log.atLevel(level)
                    .setCause(cause)
                    .log("{} {}", message, context == null ? Map.of() : context);
        } finally {
            added.forEach(MDC::remove);
        }
    }
}
