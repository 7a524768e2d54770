package com.supportchat.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supportchat.domain.analysis.MessageAnalysis;
import com.supportchat.domain.context.TopicTally;
import com.supportchat.domain.context.UserContextAggregate;
import com.supportchat.domain.model.ConversationMessage;
import com.supportchat.domain.model.MessageDirection;
import com.supportchat.domain.repository.ConversationStore;
import com.supportchat.domain.repository.ConversationStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Adapter implementing {@link ConversationStore} with Spring Data JPA.
 *
 * Responsibilities:
 * - Map domain messages and aggregates to their table rows
 * - Join the caller's transaction so append and save commit together
 * - Reject saves carrying a stale aggregate version
 * - Translate data access failures into ConversationStoreException
 */
@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class JpaConversationStore implements ConversationStore {

    private static final TypeReference<Map<String, List<Long>>> TALLIES_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> INSTANTS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> TOPICS_TYPE = new TypeReference<>() {
    };

    private final SpringDataConversationMessageRepository messageRepository;
    private final SpringDataUserContextRepository contextRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<UserContextAggregate> load(String userId) {
        return translate("load user context", () -> contextRepository.findById(userId).map(this::toAggregate));
    }

    @Override
    public ConversationMessage append(ConversationMessage message) {
        ConversationMessageRecord saved = translate("append message",
            () -> messageRepository.saveAndFlush(toRecord(message)));

        log.debug("Message appended: userId={}, sequence={}, id={}",
            Encode.forJava(message.getUserId()), message.getSequence(), saved.getId());
        return message.withId(saved.getId());
    }

    @Override
    public UserContextAggregate save(UserContextAggregate aggregate) {
        UserContextAggregate.Snapshot snapshot = aggregate.toSnapshot();

        UserContextRecord saved = translate("save user context", () -> {
            UserContextRecord record;
            if (snapshot.getVersion() == null) {
                if (contextRepository.existsById(snapshot.getUserId())) {
                    throw new ConversationStoreException("User context already exists: concurrent creation");
                }
                record = new UserContextRecord(snapshot.getUserId());
            } else {
                record = contextRepository.findById(snapshot.getUserId())
                    .orElseThrow(() -> new ConversationStoreException("User context vanished before update"));
                if (!snapshot.getVersion().equals(record.getVersion())) {
                    throw new ConversationStoreException("Stale user context: expected version "
                        + snapshot.getVersion() + ", stored " + record.getVersion());
                }
            }
            copyInto(snapshot, record);
            return contextRepository.saveAndFlush(record);
        });

        if (log.isDebugEnabled()) {
            log.debug("User context persisted: userId={}, totalMessages={}, version={}",
                Encode.forJava(saved.getUserId()), saved.getTotalMessages(), saved.getVersion());
        }
        return UserContextAggregate.reconstitute(snapshot.withVersion(saved.getVersion()));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ConversationMessage> findRecent(String userId, int limit) {
        List<ConversationMessageRecord> latest = translate("read history",
            () -> messageRepository.findLatest(userId, PageRequest.of(0, limit)));

        List<ConversationMessage> messages = latest.stream()
            .map(this::toMessage)
            .collect(Collectors.toCollection(ArrayList::new));
        Collections.reverse(messages);
        return messages;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ConversationMessage> findAll(String userId) {
        return translate("read full history", () -> messageRepository.findByUserIdOrderBySequenceAsc(userId))
            .stream()
            .map(this::toMessage)
            .collect(Collectors.toList());
    }

    private <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Conversation store failure during {}: {}", operation, e.getMessage());
            throw new ConversationStoreException("Failed to " + operation, e);
        }
    }

    // Mapping

    private ConversationMessageRecord toRecord(ConversationMessage message) {
        ConversationMessageRecord.ConversationMessageRecordBuilder builder = ConversationMessageRecord.builder()
            .userId(message.getUserId())
            .sequence(message.getSequence())
            .direction(message.getDirection())
            .content(message.getText())
            .createdAt(message.getTimestamp());

        MessageAnalysis analysis = message.getAnalysis();
        if (analysis != null) {
            builder.crisis(analysis.isCrisis())
                .urgencyLevel(analysis.getUrgencyLevel())
                .crisisTier(analysis.getCrisisTier())
                .negative(analysis.isNegative())
                .positive(analysis.isPositive())
                .messageLength(analysis.getMessageLength())
                .question(analysis.isQuestion())
                .topics(writeJson(new TreeSet<>(analysis.getTopics())))
                .degraded(analysis.isDegraded());
        }
        return builder.build();
    }

    private ConversationMessage toMessage(ConversationMessageRecord record) {
        MessageAnalysis analysis = null;
        if (record.getDirection() == MessageDirection.INCOMING && record.getUrgencyLevel() != null) {
            analysis = MessageAnalysis.builder()
                .crisis(Boolean.TRUE.equals(record.getCrisis()))
                .urgencyLevel(record.getUrgencyLevel())
                .crisisTier(record.getCrisisTier())
                .negative(Boolean.TRUE.equals(record.getNegative()))
                .positive(Boolean.TRUE.equals(record.getPositive()))
                .messageLength(record.getMessageLength() == null ? 0 : record.getMessageLength())
                .question(Boolean.TRUE.equals(record.getQuestion()))
                .topics(readTopics(record.getTopics()))
                .degraded(Boolean.TRUE.equals(record.getDegraded()))
                .build();
        }
        return ConversationMessage.builder()
            .id(record.getId())
            .userId(record.getUserId())
            .sequence(record.getSequence())
            .direction(record.getDirection())
            .text(record.getContent())
            .timestamp(record.getCreatedAt())
            .analysis(analysis)
            .build();
    }

    private void copyInto(UserContextAggregate.Snapshot snapshot, UserContextRecord record) {
        record.setTotalMessages(snapshot.getTotalMessages());
        record.setIncomingMessages(snapshot.getIncomingMessages());
        record.setCrisisEvents(snapshot.getCrisisEvents());
        record.setLastCrisisAt(snapshot.getLastCrisisAt());
        record.setFirstMessageAt(snapshot.getFirstMessageAt());
        record.setLastMessageAt(snapshot.getLastMessageAt());
        record.setFirstIncomingAt(snapshot.getFirstIncomingAt());
        record.setLastIncomingAt(snapshot.getLastIncomingAt());
        record.setSentimentWindow(snapshot.getSentimentWindow().stream()
            .map(negative -> negative ? "1" : "0")
            .collect(Collectors.joining()));
        record.setTopicTallies(writeJson(tallyColumns(snapshot.getTopicTallies())));
        record.setRecentIncoming(writeJson(snapshot.getRecentIncoming().stream()
            .map(Instant::toString)
            .collect(Collectors.toList())));
        record.setUpdatedAt(clock.instant());
    }

    private UserContextAggregate toAggregate(UserContextRecord record) {
        List<Boolean> window = new ArrayList<>();
        for (char flag : record.getSentimentWindow().toCharArray()) {
            window.add(flag == '1');
        }

        Map<String, TopicTally> tallies = new LinkedHashMap<>();
        readJson(record.getTopicTallies(), TALLIES_TYPE).forEach((topic, values) ->
            tallies.put(topic, new TopicTally(values.get(0), values.get(1))));

        List<Instant> recent = readJson(record.getRecentIncoming(), INSTANTS_TYPE).stream()
            .map(Instant::parse)
            .collect(Collectors.toList());

        return UserContextAggregate.reconstitute(UserContextAggregate.Snapshot.builder()
            .userId(record.getUserId())
            .totalMessages(record.getTotalMessages())
            .incomingMessages(record.getIncomingMessages())
            .crisisEvents(record.getCrisisEvents())
            .lastCrisisAt(record.getLastCrisisAt())
            .firstMessageAt(record.getFirstMessageAt())
            .lastMessageAt(record.getLastMessageAt())
            .firstIncomingAt(record.getFirstIncomingAt())
            .lastIncomingAt(record.getLastIncomingAt())
            .version(record.getVersion())
            .sentimentWindow(window)
            .topicTallies(tallies)
            .recentIncoming(recent)
            .build());
    }

    private static Map<String, List<Long>> tallyColumns(Map<String, TopicTally> tallies) {
        Map<String, List<Long>> columns = new LinkedHashMap<>();
        new TreeSet<>(tallies.keySet()).forEach(topic -> {
            TopicTally tally = tallies.get(topic);
            columns.put(topic, List.of(tally.getCount(), tally.getLastSequence()));
        });
        return columns;
    }

    private Set<String> readTopics(String topics) {
        if (topics == null || topics.isEmpty()) {
            return Set.of();
        }
        return new TreeSet<>(readJson(topics, TOPICS_TYPE));
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ConversationStoreException("Failed to serialize stored value", e);
        }
    }

    private <T> T readJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new ConversationStoreException("Stored value is corrupt", e);
        }
    }
}
