package com.supportchat.domain.model;

import com.supportchat.domain.analysis.MessageAnalysis;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Objects;

/**
 * One turn of a user's conversation.
 *
 * <p>Messages form an append-only log per user: {@code sequence} is the
 * 1-based arrival position within the user's history and timestamps never
 * decrease along it. Incoming messages carry the analysis computed at
 * ingestion; outgoing replies carry none.
 */
@Value
@Builder
public class ConversationMessage {

    /**
     * Store-assigned identifier, {@code null} until appended.
     */
    Long id;

    String userId;
    long sequence;
    MessageDirection direction;
    String text;
    Instant timestamp;
    MessageAnalysis analysis;

    public static ConversationMessage incoming(
            String userId, long sequence, String text, Instant timestamp, MessageAnalysis analysis) {

        return ConversationMessage.builder()
            .userId(userId)
            .sequence(sequence)
            .direction(MessageDirection.INCOMING)
            .text(text == null ? "" : text)
            .timestamp(Objects.requireNonNull(timestamp, "Timestamp must not be null"))
            .analysis(Objects.requireNonNull(analysis, "Incoming message requires an analysis"))
            .build();
    }

    public static ConversationMessage outgoing(String userId, long sequence, String text, Instant timestamp) {
        return ConversationMessage.builder()
            .userId(userId)
            .sequence(sequence)
            .direction(MessageDirection.OUTGOING)
            .text(text == null ? "" : text)
            .timestamp(Objects.requireNonNull(timestamp, "Timestamp must not be null"))
            .build();
    }

    public boolean isIncoming() {
        return direction == MessageDirection.INCOMING;
    }

    public ConversationMessage withId(Long id) {
        return new ConversationMessage(id, userId, sequence, direction, text, timestamp, analysis);
    }
}
