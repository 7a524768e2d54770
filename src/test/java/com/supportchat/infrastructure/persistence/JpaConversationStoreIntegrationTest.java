package com.supportchat.infrastructure.persistence;

import com.supportchat.application.ContextAnalysis;
import com.supportchat.application.ContextAnalysisEngine;
import com.supportchat.domain.analysis.MessageAnalysis;
import com.supportchat.domain.analysis.UrgencyLevel;
import com.supportchat.domain.context.UserContextAggregate;
import com.supportchat.domain.context.UserContextSummary;
import com.supportchat.domain.model.ConversationMessage;
import com.supportchat.domain.model.MessageDirection;
import com.supportchat.domain.repository.ConversationStore;
import com.supportchat.domain.repository.ConversationStoreException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
@ActiveProfiles("test")
class JpaConversationStoreIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("support_chat")
            .withUsername("support_chat")
            .withPassword("changeme");

    @DynamicPropertySource
    static void registerProps(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    ContextAnalysisEngine engine;

    @Autowired
    ConversationStore store;

    private static String newUser() {
        return "it-" + UUID.randomUUID();
    }

    @Test
    void messagesAndAggregateSurviveRoundTrip() {
        String userId = newUser();

        engine.analyze(userId, "I had a tough day at work, feeling stressed");
        engine.recordReply(userId, "That sounds exhausting. What happened?");
        ContextAnalysis crisis = engine.analyze(userId, "I want to end it all");

        assertTrue(crisis.isCrisis());
        assertEquals(3, crisis.getTotalMessages());
        assertEquals(1, crisis.getCrisisEvents());

        List<ConversationMessage> history = engine.history(userId, 10);
        assertEquals(List.of(1L, 2L, 3L),
            history.stream().map(ConversationMessage::getSequence).collect(Collectors.toList()));
        assertEquals(MessageDirection.OUTGOING, history.get(1).getDirection());
        assertNull(history.get(1).getAnalysis());
        assertEquals(UrgencyLevel.CRITICAL, history.get(2).getAnalysis().getUrgencyLevel());
        assertTrue(history.get(0).getAnalysis().getTopics().contains("work"));

        UserContextAggregate stored = store.load(userId).orElseThrow();
        assertEquals(3, stored.getTotalMessages());
        assertEquals(2, stored.getSentimentWindow().size());
        assertEquals(2, stored.getRecentIncoming().size());
        assertEquals(crisis.getReceivedAt(), stored.getLastCrisisAt());
    }

    @Test
    void rebuildEqualsIncrementalAggregate() {
        String userId = newUser();
        for (String text : List.of("can't sleep again", "my boss is awful", "feeling better today", "anxious")) {
            engine.analyze(userId, text);
            engine.recordReply(userId, "reply to: " + text.length());
        }
        UserContextSummary before = engine.describe(userId);

        UserContextSummary rebuilt = engine.rebuild(userId);

        assertEquals(before, rebuilt);
        assertEquals(8, rebuilt.getTotalMessages());
    }

    @Test
    void staleAggregateIsRejected() {
        String userId = newUser();
        engine.analyze(userId, "hello");
        UserContextAggregate loaded = store.load(userId).orElseThrow();

        engine.analyze(userId, "hello again");

        assertThrows(ConversationStoreException.class, () -> store.save(loaded));
        assertEquals(2, store.load(userId).orElseThrow().getTotalMessages());
    }

    @Test
    void duplicateCreationIsRejected() {
        String userId = newUser();
        engine.analyze(userId, "hello");

        assertThrows(ConversationStoreException.class, () -> store.save(UserContextAggregate.empty(userId)));
    }

    @Test
    void topicLabelsWithCommasSurviveRoundTrip() {
        String userId = newUser();
        MessageAnalysis analysis = MessageAnalysis.builder()
            .urgencyLevel(UrgencyLevel.LOW)
            .messageLength(12)
            .topics(Set.of("drugs, alcohol", "work"))
            .build();

        store.append(ConversationMessage.incoming(
            userId, 1L, "beer at work", Instant.now().truncatedTo(ChronoUnit.MICROS), analysis));

        List<ConversationMessage> history = store.findAll(userId);
        assertEquals(1, history.size());
        assertEquals(Set.of("drugs, alcohol", "work"), history.get(0).getAnalysis().getTopics());
    }

    @Test
    void unknownUserHasNoAggregateOrHistory() {
        String userId = newUser();

        assertTrue(store.load(userId).isEmpty());
        assertTrue(store.findRecent(userId, 5).isEmpty());
        assertEquals(0, engine.describe(userId).getTotalMessages());
    }
}
