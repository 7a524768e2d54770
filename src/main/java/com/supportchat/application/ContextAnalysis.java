package com.supportchat.application;

import com.supportchat.domain.analysis.MessageAnalysis;
import com.supportchat.domain.context.EngagementLevel;
import com.supportchat.domain.context.SentimentTrend;
import com.supportchat.domain.context.UserContextSummary;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot returned for each analyzed message: the message's own analysis plus
 * the user's context after folding it in.
 */
@Value
@Builder
public class ContextAnalysis {
    String userId;
    Long messageId;
    Instant receivedAt;
    MessageAnalysis currentMessageAnalysis;
    long totalMessages;
    SentimentTrend sentimentTrend;
    List<String> commonTopics;
    EngagementLevel engagementLevel;
    long crisisEvents;
    Instant lastCrisisAt;

    public static ContextAnalysis of(Long messageId, Instant receivedAt, MessageAnalysis analysis,
                                     UserContextSummary summary) {
        return ContextAnalysis.builder()
            .userId(summary.getUserId())
            .messageId(messageId)
            .receivedAt(receivedAt)
            .currentMessageAnalysis(analysis)
            .totalMessages(summary.getTotalMessages())
            .sentimentTrend(summary.getSentimentTrend())
            .commonTopics(summary.getCommonTopics())
            .engagementLevel(summary.getEngagementLevel())
            .crisisEvents(summary.getCrisisEvents())
            .lastCrisisAt(summary.getLastCrisisAt())
            .build();
    }

    public boolean isCrisis() {
        return currentMessageAnalysis.isCrisis();
    }
}
