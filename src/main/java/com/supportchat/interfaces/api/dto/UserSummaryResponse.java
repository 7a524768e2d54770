package com.supportchat.interfaces.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.supportchat.domain.context.UserContextSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UserSummaryResponse {

    private String userId;
    private long totalMessages;
    private Instant firstMessageAt;
    private Instant lastMessageAt;

    public static UserSummaryResponse from(UserContextSummary summary) {
        return UserSummaryResponse.builder()
            .userId(summary.getUserId())
            .totalMessages(summary.getTotalMessages())
            .firstMessageAt(summary.getFirstMessageAt())
            .lastMessageAt(summary.getLastMessageAt())
            .build();
    }
}
