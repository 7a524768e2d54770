package com.supportchat.interfaces.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.supportchat.application.ContextAnalysis;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Context analysis of one message as returned by the chat endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ContextAnalysisDto {

    private String userId;
    private long totalMessages;
    private String sentimentTrend;
    private String engagementLevel;
    private List<String> commonTopics;
    private long crisisEvents;
    private Instant lastCrisisAt;
    private MessageAnalysisDto currentMessageAnalysis;

    public static ContextAnalysisDto from(ContextAnalysis analysis) {
        return ContextAnalysisDto.builder()
            .userId(analysis.getUserId())
            .totalMessages(analysis.getTotalMessages())
            .sentimentTrend(analysis.getSentimentTrend().name().toLowerCase(Locale.ROOT))
            .engagementLevel(analysis.getEngagementLevel().name().toLowerCase(Locale.ROOT))
            .commonTopics(analysis.getCommonTopics())
            .crisisEvents(analysis.getCrisisEvents())
            .lastCrisisAt(analysis.getLastCrisisAt())
            .currentMessageAnalysis(MessageAnalysisDto.from(analysis.getCurrentMessageAnalysis()))
            .build();
    }
}
