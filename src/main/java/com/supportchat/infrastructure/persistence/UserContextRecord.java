package com.supportchat.infrastructure.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Stored rolling state of one user. Collections are kept as JSON text.
 */
@Entity
@Table(name = "user_contexts")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class UserContextRecord {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false, length = 128)
    private String userId;

    @Column(name = "total_messages", nullable = false)
    private long totalMessages;

    @Column(name = "incoming_messages", nullable = false)
    private long incomingMessages;

    @Column(name = "crisis_events", nullable = false)
    private long crisisEvents;

    @Column(name = "last_crisis_at")
    private Instant lastCrisisAt;

    @Column(name = "first_message_at")
    private Instant firstMessageAt;

    @Column(name = "last_message_at")
    private Instant lastMessageAt;

    @Column(name = "first_incoming_at")
    private Instant firstIncomingAt;

    @Column(name = "last_incoming_at")
    private Instant lastIncomingAt;

    /**
     * Negative flags oldest first, one character per turn ('1' negative, '0' not).
     */
    @Column(name = "sentiment_window", nullable = false, length = 256)
    private String sentimentWindow;

    @Column(name = "topic_tallies", nullable = false, columnDefinition = "TEXT")
    private String topicTallies;

    @Column(name = "recent_incoming", nullable = false, columnDefinition = "TEXT")
    private String recentIncoming;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public UserContextRecord(String userId) {
        this.userId = userId;
    }
}
