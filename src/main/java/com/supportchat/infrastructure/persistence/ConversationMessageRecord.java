package com.supportchat.infrastructure.persistence;

import com.supportchat.domain.analysis.CrisisTier;
import com.supportchat.domain.analysis.UrgencyLevel;
import com.supportchat.domain.model.MessageDirection;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Row of the append-only message log. Analysis columns are null for outgoing replies.
 */
@Entity
@Table(
    name = "conversation_messages",
    uniqueConstraints = @UniqueConstraint(name = "uk_message_user_sequence", columnNames = {"user_id", "sequence"}),
    indexes = @Index(name = "idx_message_user_timestamp", columnList = "user_id, created_at")
)
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ConversationMessageRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false, length = 128)
    private String userId;

    @Column(name = "sequence", nullable = false, updatable = false)
    private long sequence;

    @Enumerated(EnumType.STRING)
    @Column(name = "direction", nullable = false, updatable = false, length = 16)
    private MessageDirection direction;

    @Column(name = "content", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "is_crisis", updatable = false)
    private Boolean crisis;

    @Enumerated(EnumType.STRING)
    @Column(name = "urgency_level", updatable = false, length = 16)
    private UrgencyLevel urgencyLevel;

    @Enumerated(EnumType.STRING)
    @Column(name = "crisis_tier", updatable = false, length = 16)
    private CrisisTier crisisTier;

    @Column(name = "is_negative", updatable = false)
    private Boolean negative;

    @Column(name = "is_positive", updatable = false)
    private Boolean positive;

    @Column(name = "message_length", updatable = false)
    private Integer messageLength;

    @Column(name = "has_question", updatable = false)
    private Boolean question;

    /**
     * Topic labels as a sorted JSON array.
     */
    @Column(name = "topics", updatable = false, columnDefinition = "TEXT")
    private String topics;

    @Column(name = "degraded", updatable = false)
    private Boolean degraded;
}
