package com.supportchat.interfaces.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.supportchat.domain.context.UserContextSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Full context of a user as maintained by the aggregator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UserAnalysisResponse {

    private String userId;
    private long totalMessages;
    private long incomingMessages;
    private String sentimentTrend;
    private List<String> commonTopics;
    private String engagementLevel;
    private long crisisEvents;
    private Instant lastCrisisAt;
    private Instant firstMessageAt;
    private Instant lastMessageAt;

    public static UserAnalysisResponse from(UserContextSummary summary) {
        return UserAnalysisResponse.builder()
            .userId(summary.getUserId())
            .totalMessages(summary.getTotalMessages())
            .incomingMessages(summary.getIncomingMessages())
            .sentimentTrend(summary.getSentimentTrend().name().toLowerCase(Locale.ROOT))
            .commonTopics(summary.getCommonTopics())
            .engagementLevel(summary.getEngagementLevel().name().toLowerCase(Locale.ROOT))
            .crisisEvents(summary.getCrisisEvents())
            .lastCrisisAt(summary.getLastCrisisAt())
            .firstMessageAt(summary.getFirstMessageAt())
            .lastMessageAt(summary.getLastMessageAt())
            .build();
    }
}
