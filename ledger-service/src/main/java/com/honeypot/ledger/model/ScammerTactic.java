package com.honeypot.ledger.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only record of a manipulation tactic spotted in a scammer turn.
 * {@code keywordsUsed} is a JSON-serialised {@code List<String>}, {@code []} when none.
 */
@Data
@NoArgsConstructor
@Table("scammer_tactics")
public class ScammerTactic {

    @Id
    private UUID id;

    private UUID sessionId;

    private String tacticType;

    private String tacticDescription;

    private Integer detectedAtTurn;

    private String messageText;

    /** JSON-serialised {@code List<String>} */
    private String keywordsUsed;

    private String threatLevel;

    private LocalDateTime timestamp;
}
