package com.honeypot.common.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Inbound envelope delivered by the messaging front end for every scammer turn.
 *
 * <p>{@code message} holds {@code sender}, {@code text} and {@code timestamp};
 * {@code conversationHistory} is never {@code null} after construction.
 */
public record IncomingMessageRequest(
    @JsonProperty("sessionId")           String sessionId,
    @JsonProperty("message")             Map<String, Object> message,
    @JsonProperty("conversationHistory") List<ConversationHistoryItem> conversationHistory,
    @JsonProperty("metadata")            Map<String, Object> metadata
) {
    public IncomingMessageRequest {
        conversationHistory = conversationHistory == null ? List.of() : List.copyOf(conversationHistory);
    }

    public String messageText() {
        Object text = message == null ? null : message.get("text");
        return text == null ? null : String.valueOf(text);
    }

    public String messageSender() {
        Object sender = message == null ? null : message.get("sender");
        return sender == null ? null : String.valueOf(sender);
    }
}
