package com.supportchat.interfaces.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.supportchat.domain.model.ConversationMessage;
import com.supportchat.domain.model.MessageDirection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Recent turns of a user's conversation, oldest first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HistoryResponse {

    private String userId;
    private List<MessageDto> history;

    public static HistoryResponse of(String userId, List<ConversationMessage> messages) {
        return HistoryResponse.builder()
            .userId(userId)
            .history(messages.stream().map(MessageDto::from).collect(Collectors.toList()))
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class MessageDto {
        private Long id;
        private long sequence;
        private String role; // "user" or "assistant"
        private String content;
        private Instant timestamp;
        private MessageAnalysisDto analysis;

        static MessageDto from(ConversationMessage message) {
            return MessageDto.builder()
                .id(message.getId())
                .sequence(message.getSequence())
                .role(message.getDirection() == MessageDirection.INCOMING ? "user" : "assistant")
                .content(message.getText())
                .timestamp(message.getTimestamp())
                .analysis(message.getAnalysis() == null ? null : MessageAnalysisDto.from(message.getAnalysis()))
                .build();
        }
    }
}
