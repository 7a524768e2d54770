package com.supportchat.interfaces.api;

import com.supportchat.application.ChatApplicationService;
import com.supportchat.application.ChatResult;
import com.supportchat.application.ContextAnalysis;
import com.supportchat.application.ContextAnalysisEngine;
import com.supportchat.application.exceptions.UserContextBusyException;
import com.supportchat.config.SecurityConfiguration;
import com.supportchat.domain.analysis.CrisisTier;
import com.supportchat.domain.analysis.MessageAnalysis;
import com.supportchat.domain.analysis.UrgencyLevel;
import com.supportchat.domain.context.EngagementLevel;
import com.supportchat.domain.context.SentimentTrend;
import com.supportchat.domain.context.UserContextSummary;
import com.supportchat.domain.model.ConversationMessage;
import com.supportchat.domain.repository.ConversationStoreException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ChatRestController.class)
@Import(SecurityConfiguration.class)
class ChatRestControllerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ChatApplicationService chatService;

    @MockBean
    private ContextAnalysisEngine engine;

    @Test
    void chatReturnsReplyAndSnakeCaseAnalysis() throws Exception {
        when(chatService.chat("u1", "I want to end it all")).thenReturn(ChatResult.builder()
            .userId("u1")
            .response("You matter.\n\nCall or text 988.")
            .messageId(7L)
            .contextAnalysis(crisisContext())
            .crisisResources(List.of("Call or text 988."))
            .build());

        mockMvc.perform(post("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_id\":\"u1\",\"message\":\"I want to end it all\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.response").value("You matter.\n\nCall or text 988."))
            .andExpect(jsonPath("$.user_id").value("u1"))
            .andExpect(jsonPath("$.message_id").value(7))
            .andExpect(jsonPath("$.crisis_resources", hasSize(1)))
            .andExpect(jsonPath("$.context_analysis.total_messages").value(3))
            .andExpect(jsonPath("$.context_analysis.sentiment_trend").value("worsening"))
            .andExpect(jsonPath("$.context_analysis.engagement_level").value("medium"))
            .andExpect(jsonPath("$.context_analysis.common_topics[0]").value("stress"))
            .andExpect(jsonPath("$.context_analysis.current_message_analysis.is_crisis").value(true))
            .andExpect(jsonPath("$.context_analysis.current_message_analysis.urgency_level").value("critical"))
            .andExpect(jsonPath("$.context_analysis.current_message_analysis.crisis_tier").value("imminent"))
            .andExpect(jsonPath("$.context_analysis.current_message_analysis.has_question").value(false));
    }

    @Test
    void chatRejectsMalformedUserId() throws Exception {
        mockMvc.perform(post("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_id\":\"bad id!\",\"message\":\"hello\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"))
            .andExpect(jsonPath("$.status").value(400))
            .andExpect(jsonPath("$.invalid_fields[0].field").value("user_id"))
            .andExpect(jsonPath("$.invalid_fields[0].reason").isNotEmpty())
            .andExpect(jsonPath("$.invalid_fields[0].rejected_value").doesNotExist());

        verify(chatService, never()).chat(anyString(), anyString());
    }

    @Test
    void chatRejectsMissingMessage() throws Exception {
        mockMvc.perform(post("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_id\":\"u1\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void chatRejectsUnreadableBody() throws Exception {
        mockMvc.perform(post("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void busyUserMapsToConflict() throws Exception {
        when(chatService.chat("u1", "hello")).thenThrow(new UserContextBusyException("busy"));

        mockMvc.perform(post("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_id\":\"u1\",\"message\":\"hello\"}"))
            .andExpect(status().isConflict());
    }

    @Test
    void storeFailureMapsToServiceUnavailable() throws Exception {
        when(chatService.chat("u1", "hello")).thenThrow(new ConversationStoreException("db down"));

        mockMvc.perform(post("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user_id\":\"u1\",\"message\":\"hello\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.detail").value("Conversation storage is temporarily unavailable. Please retry."))
            .andExpect(jsonPath("$.request_id").isNotEmpty())
            .andExpect(jsonPath("$.invalid_fields").doesNotExist());
    }

    @Test
    void historyListsTurnsWithRoles() throws Exception {
        MessageAnalysis analysis = MessageAnalysis.builder()
            .urgencyLevel(UrgencyLevel.LOW)
            .messageLength(5)
            .build();
        when(engine.history("u1", 20)).thenReturn(List.of(
            ConversationMessage.incoming("u1", 1, "hello", T0, analysis).withId(1L),
            ConversationMessage.outgoing("u1", 2, "Hi there, how are you?", T0.plusSeconds(2)).withId(2L)));

        mockMvc.perform(get("/api/v1/users/u1/history"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.user_id").value("u1"))
            .andExpect(jsonPath("$.history", hasSize(2)))
            .andExpect(jsonPath("$.history[0].role").value("user"))
            .andExpect(jsonPath("$.history[1].role").value("assistant"))
            .andExpect(jsonPath("$.history[1].content").value("Hi there, how are you?"));
    }

    @Test
    void invalidLimitIsBadRequest() throws Exception {
        when(engine.history("u1", 1000)).thenThrow(new IllegalArgumentException("Limit must be between 1 and 100"));

        mockMvc.perform(get("/api/v1/users/u1/history").param("limit", "1000"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.detail").value("Invalid request: Limit must be between 1 and 100"));
    }

    @Test
    void analysisReturnsSummary() throws Exception {
        when(engine.describe("u1")).thenReturn(UserContextSummary.builder()
            .userId("u1")
            .totalMessages(12)
            .incomingMessages(6)
            .sentimentTrend(SentimentTrend.IMPROVING)
            .commonTopics(List.of("sleep", "work"))
            .engagementLevel(EngagementLevel.HIGH)
            .crisisEvents(1)
            .lastCrisisAt(T0)
            .firstMessageAt(T0)
            .lastMessageAt(T0.plusSeconds(600))
            .build());

        mockMvc.perform(get("/api/v1/users/u1/analysis"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_messages").value(12))
            .andExpect(jsonPath("$.sentiment_trend").value("improving"))
            .andExpect(jsonPath("$.engagement_level").value("high"))
            .andExpect(jsonPath("$.crisis_events").value(1));

        mockMvc.perform(get("/api/v1/users/u1/summary"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_messages").value(12));
    }

    @Test
    void greetingIsPersonalized() throws Exception {
        when(chatService.greeting("u1")).thenReturn("Welcome back!");

        mockMvc.perform(get("/api/v1/users/u1/greeting"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.greeting").value("Welcome back!"));
    }

    @Test
    void corsAllowsAnyOriginWithoutCredentials() throws Exception {
        mockMvc.perform(options("/api/v1/chat")
                .header("Origin", "https://chat.example.org")
                .header("Access-Control-Request-Method", "POST"))
            .andExpect(status().isOk())
            .andExpect(header().string("Access-Control-Allow-Origin", "*"))
            .andExpect(header().doesNotExist("Access-Control-Allow-Credentials"));
    }

    @Test
    void unknownPathsAreDenied() throws Exception {
        mockMvc.perform(get("/internal/secret"))
            .andExpect(status().isForbidden());
    }

    private static ContextAnalysis crisisContext() {
        MessageAnalysis analysis = MessageAnalysis.builder()
            .crisis(true)
            .urgencyLevel(UrgencyLevel.CRITICAL)
            .crisisTier(CrisisTier.IMMINENT)
            .messageLength(20)
            .topics(Set.of())
            .build();
        return ContextAnalysis.builder()
            .userId("u1")
            .messageId(6L)
            .receivedAt(T0)
            .currentMessageAnalysis(analysis)
            .totalMessages(3)
            .sentimentTrend(SentimentTrend.WORSENING)
            .commonTopics(List.of("stress"))
            .engagementLevel(EngagementLevel.MEDIUM)
            .crisisEvents(1)
            .lastCrisisAt(T0)
            .build();
    }
}
