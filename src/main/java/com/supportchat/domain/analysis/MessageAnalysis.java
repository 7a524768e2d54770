package com.supportchat.domain.analysis;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Classification of a single message, computed once at ingestion.
 *
 * <p><strong>Invariant:</strong> a crisis message always carries
 * {@link UrgencyLevel#HIGH} or {@link UrgencyLevel#CRITICAL}.
 */
@Value
public class MessageAnalysis {

    boolean crisis;
    UrgencyLevel urgencyLevel;

    /**
     * Highest matched crisis tier, {@code null} when no crisis term matched.
     */
    CrisisTier crisisTier;

    boolean negative;
    boolean positive;
    int messageLength;
    boolean question;

    /**
     * Topic labels mentioned by the message, each listed once, in label order.
     */
    Set<String> topics;

    /**
     * Set when the crisis table was unavailable and detection could not run.
     */
    boolean degraded;

    @Builder
    private MessageAnalysis(
            boolean crisis,
            UrgencyLevel urgencyLevel,
            CrisisTier crisisTier,
            boolean negative,
            boolean positive,
            int messageLength,
            boolean question,
            Set<String> topics,
            boolean degraded) {

        UrgencyLevel urgency = Objects.requireNonNull(urgencyLevel, "Urgency level must not be null");
        if (crisis && !urgency.isAtLeast(UrgencyLevel.HIGH)) {
            throw new IllegalArgumentException("Crisis message must have HIGH or CRITICAL urgency, got " + urgency);
        }
        if (negative && positive) {
            throw new IllegalArgumentException("Message cannot be both negative and positive");
        }
        if (messageLength < 0) {
            throw new IllegalArgumentException("Message length must not be negative");
        }
        this.crisis = crisis;
        this.urgencyLevel = urgency;
        this.crisisTier = crisisTier;
        this.negative = negative;
        this.positive = positive;
        this.messageLength = messageLength;
        this.question = question;
        this.topics = topics == null
            ? Collections.emptySortedSet()
            : Collections.unmodifiableSortedSet(new TreeSet<>(topics));
        this.degraded = degraded;
    }
}
