package com.supportchat.application;

import com.supportchat.domain.model.ConversationMessage;
import com.supportchat.domain.model.MessageDirection;

import java.util.List;
import java.util.Locale;

/**
 * Assembles the prompt sent to the reply generator: standing instructions,
 * the user's profile as derived from their context, the most recent turns
 * and the current message.
 */
public class SupportPromptBuilder {

    static final String SYSTEM_INSTRUCTIONS =
        "You are a warm, supportive, and helpful assistant trained to support users with mental health "
            + "and addiction recovery. You are not a therapist, but you offer empathetic, kind, and motivating "
            + "conversation. Always maintain a supportive and non-judgmental tone. Personalize your responses "
            + "based on the user's history and patterns.";

    static final String CRISIS_INSTRUCTIONS =
        "The current message shows signs of crisis. Respond with care, encourage the user to reach out to "
            + "a crisis line or emergency services, and do not minimize what they are feeling.";

    private final int historyTurns;

    public SupportPromptBuilder(int historyTurns) {
        if (historyTurns < 1) {
            throw new IllegalArgumentException("History turns must be at least 1");
        }
        this.historyTurns = historyTurns;
    }

    public int getHistoryTurns() {
        return historyTurns;
    }

    /**
     * @param context analysis of the current message and the user's context after it
     * @param history earlier turns, oldest first; only the newest are included
     * @param message current message text
     */
    public String build(ContextAnalysis context, List<ConversationMessage> history, String message) {
        StringBuilder prompt = new StringBuilder(SYSTEM_INSTRUCTIONS);

        prompt.append("\n\nUser Profile (ID: ").append(context.getUserId()).append("):");
        prompt.append("\n- Total messages: ").append(context.getTotalMessages());
        prompt.append("\n- Engagement level: ").append(label(context.getEngagementLevel()));
        prompt.append("\n- Overall sentiment trend: ").append(label(context.getSentimentTrend()));
        if (!context.getCommonTopics().isEmpty()) {
            prompt.append("\n- Common topics discussed: ").append(String.join(", ", context.getCommonTopics()));
        }
        if (context.getCrisisEvents() > 0) {
            prompt.append("\n- Earlier crisis indicators: ").append(context.getCrisisEvents());
        }
        prompt.append("\n- Current message urgency: ")
            .append(label(context.getCurrentMessageAnalysis().getUrgencyLevel()));

        if (context.isCrisis()) {
            prompt.append("\n\n").append(CRISIS_INSTRUCTIONS);
        }

        if (!history.isEmpty()) {
            prompt.append("\n\nRecent Conversation History:");
            int from = Math.max(0, history.size() - historyTurns);
            for (ConversationMessage turn : history.subList(from, history.size())) {
                prompt.append('\n')
                    .append(turn.getDirection() == MessageDirection.INCOMING ? "User" : "Assistant")
                    .append(": ")
                    .append(turn.getText());
            }
        }

        prompt.append("\n\nCurrent User Message: ").append(message == null ? "" : message);
        prompt.append("\n\nAssistant:");
        return prompt.toString();
    }

    private static String label(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
