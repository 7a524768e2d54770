package com.supportchat.domain.context;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Derived, read-only view of a {@link UserContextAggregate}.
 */
@Value
@Builder
public class UserContextSummary {
    String userId;
    long totalMessages;
    long incomingMessages;
    SentimentTrend sentimentTrend;
    List<String> commonTopics;
    EngagementLevel engagementLevel;
    long crisisEvents;
    Instant lastCrisisAt;
    Instant firstMessageAt;
    Instant lastMessageAt;
}
