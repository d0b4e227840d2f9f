package com.honeypot.common.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One prior message as the inbound envelope carries it. {@code timestamp} is passed through
 * verbatim (ISO-8601 or epoch millis, depending on the sender).
 */
public record ConversationHistoryItem(
    @JsonProperty("sender")    String sender,
    @JsonProperty("text")      String text,
    @JsonProperty("timestamp") String timestamp
) {}
