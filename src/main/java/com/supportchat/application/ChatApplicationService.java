package com.supportchat.application;

import com.supportchat.config.PerformanceConfiguration.BusinessMetrics;
import com.supportchat.config.SupportProperties;
import com.supportchat.domain.context.EngagementLevel;
import com.supportchat.domain.context.SentimentTrend;
import com.supportchat.domain.context.UserContextSummary;
import com.supportchat.domain.model.ConversationMessage;
import com.supportchat.infrastructure.generation.GenerationException;
import com.supportchat.infrastructure.generation.ResponseGenerator;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Application service for a chat turn.
 *
 * Orchestrates:
 * - Context analysis of the user's message
 * - Reply generation with the user's profile and recent turns
 * - Fallback replies when generation is unavailable or unusable
 * - Recording the reply and attaching crisis resources
 */
@Service
@Slf4j
public class ChatApplicationService {

    static final int MINIMUM_REPLY_LENGTH = 10;

    static final String SHORT_REPLY_FALLBACK =
        "I understand what you're saying. Could you tell me more about how you're feeling?";

    static final String UNAVAILABLE_FALLBACK =
        "I'm here to listen and support you. I'm experiencing some technical difficulties right now, "
            + "but I want you to know that your feelings are valid and important. "
            + "Would you like to try sharing again?";

    static final String GREETING_NEW_USER = "Hello! I'm here to support you. How are you feeling today?";
    static final String GREETING_ENGAGED =
        "Welcome back! I'm glad to see you again. How have you been since we last talked?";
    static final String GREETING_POSITIVE =
        "Hello! I noticed you've been in a positive mood lately. How are you doing today?";
    static final String GREETING_NEGATIVE = "Hi there. I'm here to listen and support you. What's on your mind today?";
    static final String GREETING_DEFAULT = "Hello! How are you feeling today? I'm here to listen and support you.";

    private final ContextAnalysisEngine engine;
    private final ResponseGenerator generator;
    private final SupportPromptBuilder promptBuilder;
    private final List<String> crisisResources;
    private final BusinessMetrics metrics;

    public ChatApplicationService(
            ContextAnalysisEngine engine,
            ResponseGenerator generator,
            SupportPromptBuilder promptBuilder,
            SupportProperties properties,
            BusinessMetrics metrics) {

        this.engine = engine;
        this.generator = generator;
        this.promptBuilder = promptBuilder;
        this.crisisResources = List.copyOf(properties.getCrisisResources());
        this.metrics = metrics;
    }

    /**
     * Handle one user message end to end.
     *
     * @throws IllegalArgumentException if the user id is malformed
     */
    public ChatResult chat(String userId, String message) {
        List<ConversationMessage> history = engine.history(userId, promptBuilder.getHistoryTurns());
        ContextAnalysis analysis = engine.analyze(userId, message);

        boolean fallback = false;
        String reply;
        if (!generator.isAvailable()) {
            metrics.recordGenerationFallback("unconfigured");
            reply = UNAVAILABLE_FALLBACK;
            fallback = true;
        } else {
            try {
                reply = generator.generate(promptBuilder.build(analysis, history, message));
                if (reply == null || reply.strip().length() < MINIMUM_REPLY_LENGTH) {
                    log.warn("Generated reply too short, using fallback: userId={}", Encode.forJava(userId));
                    metrics.recordGenerationFallback("short_reply");
                    reply = SHORT_REPLY_FALLBACK;
                    fallback = true;
                } else {
                    reply = reply.strip();
                }
            } catch (GenerationException e) {
                log.error("Reply generation failed: userId={}, error={}", Encode.forJava(userId), e.getMessage());
                metrics.recordGenerationFallback("error");
                reply = UNAVAILABLE_FALLBACK;
                fallback = true;
            }
        }

        ConversationMessage stored = engine.recordReply(userId, reply);

        List<String> resources = List.of();
        String shown = reply;
        if (analysis.isCrisis()) {
            resources = crisisResources;
            shown = reply + "\n\n" + String.join("\n", crisisResources);
        }

        return ChatResult.builder()
            .userId(userId)
            .response(shown)
            .messageId(stored.getId())
            .contextAnalysis(analysis)
            .crisisResources(resources)
            .fallback(fallback)
            .build();
    }

    /**
     * Greeting chosen from what is known about the user.
     */
    public String greeting(String userId) {
        UserContextSummary summary = engine.describe(userId);
        if (summary.getTotalMessages() == 0) {
            return GREETING_NEW_USER;
        }
        if (summary.getEngagementLevel() == EngagementLevel.HIGH) {
            return GREETING_ENGAGED;
        }
        SentimentTrend trend = summary.getSentimentTrend();
        if (trend == SentimentTrend.POSITIVE || trend == SentimentTrend.IMPROVING) {
            return GREETING_POSITIVE;
        }
        if (trend == SentimentTrend.NEGATIVE || trend == SentimentTrend.WORSENING) {
            return GREETING_NEGATIVE;
        }
        return GREETING_DEFAULT;
    }
}
