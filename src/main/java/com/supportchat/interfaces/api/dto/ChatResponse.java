package com.supportchat.interfaces.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.supportchat.application.ChatResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for one chat turn.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChatResponse {

    private String response;
    private String userId;
    private Long messageId; // id of the stored reply
    private ContextAnalysisDto contextAnalysis;
    private List<String> crisisResources;

    public static ChatResponse from(ChatResult result) {
        return ChatResponse.builder()
            .response(result.getResponse())
            .userId(result.getUserId())
            .messageId(result.getMessageId())
            .contextAnalysis(ContextAnalysisDto.from(result.getContextAnalysis()))
            .crisisResources(result.getCrisisResources())
            .build();
    }
}
