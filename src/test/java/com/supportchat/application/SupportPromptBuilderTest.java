package com.supportchat.application;

import com.supportchat.domain.analysis.CrisisTier;
import com.supportchat.domain.analysis.MessageAnalysis;
import com.supportchat.domain.analysis.UrgencyLevel;
import com.supportchat.domain.context.EngagementLevel;
import com.supportchat.domain.context.SentimentTrend;
import com.supportchat.domain.model.ConversationMessage;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SupportPromptBuilderTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    private final SupportPromptBuilder builder = new SupportPromptBuilder(6);

    @Test
    void includesProfileHistoryAndCurrentMessage() {
        List<ConversationMessage> history = List.of(
            ConversationMessage.incoming("u1", 1, "work is rough", T0, analysis(false)),
            ConversationMessage.outgoing("u1", 2, "That sounds hard.", T0.plusSeconds(5)));

        String prompt = builder.build(context(false, List.of("work", "stress")), history, "still stressed");

        assertTrue(prompt.startsWith(SupportPromptBuilder.SYSTEM_INSTRUCTIONS));
        assertTrue(prompt.contains("User Profile (ID: u1):"));
        assertTrue(prompt.contains("- Total messages: 3"));
        assertTrue(prompt.contains("- Engagement level: medium"));
        assertTrue(prompt.contains("- Overall sentiment trend: worsening"));
        assertTrue(prompt.contains("- Common topics discussed: work, stress"));
        assertTrue(prompt.contains("User: work is rough\nAssistant: That sounds hard."));
        assertTrue(prompt.endsWith("Current User Message: still stressed\n\nAssistant:"));
        assertFalse(prompt.contains(SupportPromptBuilder.CRISIS_INSTRUCTIONS));
    }

    @Test
    void keepsOnlyNewestTurns() {
        List<ConversationMessage> history = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            history.add(ConversationMessage.outgoing("u1", i, "turn " + i, T0.plusSeconds(i)));
        }

        String prompt = builder.build(context(false, List.of()), history, "now");

        assertFalse(prompt.contains("turn 4\n"));
        assertTrue(prompt.contains("Assistant: turn 5"));
        assertTrue(prompt.contains("Assistant: turn 10"));
        assertFalse(prompt.contains("Common topics discussed"));
    }

    @Test
    void crisisAddsCareInstructions() {
        String prompt = builder.build(context(true, List.of()), List.of(), "I want to end it all");

        assertTrue(prompt.contains(SupportPromptBuilder.CRISIS_INSTRUCTIONS));
        assertTrue(prompt.contains("- Current message urgency: critical"));
        assertFalse(prompt.contains("Recent Conversation History"));
    }

    @Test
    void rejectsNonPositiveHistoryTurns() {
        assertThrows(IllegalArgumentException.class, () -> new SupportPromptBuilder(0));
    }

    private static MessageAnalysis analysis(boolean crisis) {
        return MessageAnalysis.builder()
            .crisis(crisis)
            .urgencyLevel(crisis ? UrgencyLevel.CRITICAL : UrgencyLevel.LOW)
            .crisisTier(crisis ? CrisisTier.IMMINENT : null)
            .build();
    }

    private static ContextAnalysis context(boolean crisis, List<String> topics) {
        return ContextAnalysis.builder()
            .userId("u1")
            .messageId(3L)
            .receivedAt(T0)
            .currentMessageAnalysis(analysis(crisis))
            .totalMessages(3)
            .sentimentTrend(SentimentTrend.WORSENING)
            .commonTopics(topics)
            .engagementLevel(EngagementLevel.MEDIUM)
            .crisisEvents(crisis ? 1 : 0)
            .build();
    }
}
