package com.honeypot.ledger.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Structured audit event. {@code sessionId} is {@code null} for events not tied to a session.
 * {@code details} is a JSON-serialised {@code Map<String, Object>}.
 */
@Data
@NoArgsConstructor
@Table("system_logs")
public class SystemLog {

    @Id
    private UUID id;

    private UUID sessionId;

    private String logLevel;

    private String component;

    private String eventType;

    private String message;

    /** JSON-serialised {@code Map<String, Object>} */
    private String details;

    private LocalDateTime timestamp;
}
