package com.supportchat.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.supportchat.domain.analysis.MessageAnalysis;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Locale;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MessageAnalysisDto {

    @JsonProperty("is_crisis")
    private boolean crisis;

    private String urgencyLevel;
    private String crisisTier;

    @JsonProperty("is_negative")
    private boolean negative;

    @JsonProperty("is_positive")
    private boolean positive;

    private int messageLength;

    @JsonProperty("has_question")
    private boolean question;

    private List<String> topics;
    private boolean degraded;

    public static MessageAnalysisDto from(MessageAnalysis analysis) {
        return MessageAnalysisDto.builder()
            .crisis(analysis.isCrisis())
            .urgencyLevel(analysis.getUrgencyLevel().name().toLowerCase(Locale.ROOT))
            .crisisTier(analysis.getCrisisTier() == null
                ? null : analysis.getCrisisTier().name().toLowerCase(Locale.ROOT))
            .negative(analysis.isNegative())
            .positive(analysis.isPositive())
            .messageLength(analysis.getMessageLength())
            .question(analysis.isQuestion())
            .topics(List.copyOf(analysis.getTopics()))
            .degraded(analysis.isDegraded())
            .build();
    }
}
