package com.supportchat.application;

import com.supportchat.config.PerformanceConfiguration.BusinessMetrics;
import com.supportchat.domain.analysis.MessageAnalysis;
import com.supportchat.domain.analysis.MessageClassifier;
import com.supportchat.domain.context.UserContextAggregate;
import com.supportchat.domain.context.UserContextAggregator;
import com.supportchat.domain.context.UserContextSummary;
import com.supportchat.domain.model.ConversationMessage;
import com.supportchat.domain.repository.ConversationStore;
import com.supportchat.infrastructure.concurrency.UserLockRegistry;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Facade over classification and per-user aggregation.
 *
 * <p>For each inbound message: classify the text (pure, outside any lock),
 * then inside the user's critical section load the aggregate, fold the message
 * into a copy, and append the message and save the aggregate in one
 * transaction. A failure anywhere before commit leaves the stored aggregate
 * unchanged and propagates to the caller; nothing is retried here.
 *
 * <p>Requests for different users never share a lock.
 */
@Service
@Slf4j
public class ContextAnalysisEngine {

    static final int MAX_USER_ID_LENGTH = 128;
    static final int MAX_HISTORY_LIMIT = 100;
    private static final Pattern USER_ID_PATTERN = Pattern.compile("[A-Za-z0-9._:@-]+");

    private final MessageClassifier classifier;
    private final UserContextAggregator aggregator;
    private final ConversationStore store;
    private final UserLockRegistry lockRegistry;
    private final TransactionOperations transactions;
    private final Clock clock;
    private final BusinessMetrics metrics;

    public ContextAnalysisEngine(
            MessageClassifier classifier,
            UserContextAggregator aggregator,
            ConversationStore store,
            UserLockRegistry lockRegistry,
            TransactionOperations transactions,
            Clock clock,
            BusinessMetrics metrics) {

        this.classifier = classifier;
        this.aggregator = aggregator;
        this.store = store;
        this.lockRegistry = lockRegistry;
        this.transactions = transactions;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Analyze an incoming message and fold it into the user's context.
     *
     * @param userId user identifier
     * @param text message text, may be empty
     * @return the message analysis and the user's updated context
     * @throws IllegalArgumentException if the user id is malformed
     */
    public ContextAnalysis analyze(String userId, String text) {
        validateUserId(userId);

        MessageAnalysis analysis = classifier.classify(text);
        if (analysis.isDegraded()) {
            metrics.recordDegradedClassification();
        }

        ContextAnalysis result = lockRegistry.executeWithLock(userId, () -> {
            UserContextAggregate current = loadOrCreate(userId);
            Instant timestamp = nextTimestamp(current);
            ConversationMessage message = ConversationMessage.incoming(
                userId, current.getTotalMessages() + 1, text, timestamp, analysis);

            UserContextAggregate updated = aggregator.update(current, message, analysis);
            Committed committed = commit(message, updated);

            return ContextAnalysis.of(committed.message.getId(), timestamp, analysis,
                aggregator.summarize(committed.aggregate));
        });

        metrics.recordMessageAnalyzed(analysis.getUrgencyLevel());
        if (analysis.isCrisis()) {
            metrics.recordCrisisDetected(analysis.getUrgencyLevel());
            log.warn("Crisis detected: userId={}, urgency={}, crisisEvents={}",
                Encode.forJava(userId), analysis.getUrgencyLevel(), result.getCrisisEvents());
        } else {
            log.info("Message analyzed: userId={}, totalMessages={}, urgency={}, trend={}",
                Encode.forJava(userId), result.getTotalMessages(), analysis.getUrgencyLevel(),
                result.getSentimentTrend());
        }
        return result;
    }

    /**
     * Append a generated reply to the user's history.
     *
     * @return the stored outgoing message
     */
    public ConversationMessage recordReply(String userId, String text) {
        validateUserId(userId);

        ConversationMessage stored = lockRegistry.executeWithLock(userId, () -> {
            UserContextAggregate current = loadOrCreate(userId);
            ConversationMessage message = ConversationMessage.outgoing(
                userId, current.getTotalMessages() + 1, text, nextTimestamp(current));

            UserContextAggregate updated = aggregator.update(current, message, null);
            return commit(message, updated).message;
        });

        metrics.recordReplyRecorded();
        log.debug("Reply recorded: userId={}, sequence={}", Encode.forJava(userId), stored.getSequence());
        return stored;
    }

    /**
     * Current context of a user without adding a message; empty context for unknown users.
     */
    public UserContextSummary describe(String userId) {
        validateUserId(userId);
        return aggregator.summarize(loadOrCreate(userId));
    }

    /**
     * Most recent turns of the user's conversation, oldest first. At most
     * {@value #MAX_HISTORY_LIMIT} turns are returned per call.
     */
    public List<ConversationMessage> history(String userId, int limit) {
        validateUserId(userId);
        if (limit < 1 || limit > MAX_HISTORY_LIMIT) {
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_HISTORY_LIMIT);
        }
        return store.findRecent(userId, limit);
    }

    /**
     * Replace the stored aggregate with one replayed from the full history.
     */
    public UserContextSummary rebuild(String userId) {
        validateUserId(userId);

        UserContextSummary summary = lockRegistry.executeWithLock(userId, () -> {
            UserContextAggregate current = loadOrCreate(userId);
            UserContextAggregate replayed = aggregator.replay(userId, store.findAll(userId));
            if (replayed.getTotalMessages() != current.getTotalMessages()) {
                log.warn("Replayed history length differs from stored aggregate: userId={}, stored={}, replayed={}",
                    Encode.forJava(userId), current.getTotalMessages(), replayed.getTotalMessages());
            }
            UserContextAggregate toSave = UserContextAggregate.reconstitute(
                replayed.toSnapshot().withVersion(current.getVersion()));
            UserContextAggregate saved = transactions.execute(status -> store.save(toSave));
            return aggregator.summarize(saved);
        });

        log.info("User context rebuilt: userId={}, totalMessages={}",
            Encode.forJava(userId), summary.getTotalMessages());
        return summary;
    }

    private UserContextAggregate loadOrCreate(String userId) {
        return store.load(userId).orElseGet(() -> UserContextAggregate.empty(userId));
    }

    private Committed commit(ConversationMessage message, UserContextAggregate updated) {
        return transactions.execute(status -> {
            ConversationMessage storedMessage = store.append(message);
            UserContextAggregate storedAggregate = store.save(updated);
            return new Committed(storedMessage, storedAggregate);
        });
    }

    /**
     * Clock reading at database precision, clamped so a user's timestamps never decrease.
     */
    private Instant nextTimestamp(UserContextAggregate current) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        Instant last = current.getLastMessageAt();
        return last != null && now.isBefore(last) ? last : now;
    }

    static void validateUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id is required");
        }
        if (userId.length() > MAX_USER_ID_LENGTH) {
            throw new IllegalArgumentException("User id must not exceed " + MAX_USER_ID_LENGTH + " characters");
        }
        if (!USER_ID_PATTERN.matcher(userId).matches()) {
            throw new IllegalArgumentException("User id contains unsupported characters");
        }
    }

    private static final class Committed {
        private final ConversationMessage message;
        private final UserContextAggregate aggregate;

        private Committed(ConversationMessage message, UserContextAggregate aggregate) {
            this.message = message;
            this.aggregate = aggregate;
        }
    }
}
