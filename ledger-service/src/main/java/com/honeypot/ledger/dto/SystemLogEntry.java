package com.honeypot.ledger.dto;

import com.honeypot.common.model.LogLevel;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Structured event for the {@code system_logs} table. {@code sessionId} may be {@code null}
 * for events not scoped to a session.
 */
public record SystemLogEntry(
    UUID sessionId,
    LogLevel level,
    String component,
    String eventType,
    String message,
    Map<String, Object> details
) {
    public SystemLogEntry {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(message, "message");
    }

    public static SystemLogEntry info(UUID sessionId, String component, String eventType,
                                      String message, Map<String, Object> details) {
        return new SystemLogEntry(sessionId, LogLevel.INFO, component, eventType, message, details);
    }

    public static SystemLogEntry warning(UUID sessionId, String component, String eventType,
                                         String message, Map<String, Object> details) {
        return new SystemLogEntry(sessionId, LogLevel.WARNING, component, eventType, message, details);
    }
}
