package com.supportchat.domain.context;

import lombok.Builder;
import lombok.Getter;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rolling conversational state for one user.
 *
 * <p>The aggregate is the fold of the user's message history: every field is
 * derivable by replaying that history from {@link #empty(String)} through the
 * {@link UserContextAggregator}. It keeps only what the fold needs, namely counters,
 * the bounded sentiment window, cumulative topic tallies and the incoming
 * timestamps inside the engagement window, so per-message cost does not grow
 * with history length.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>{@code totalMessages} equals the length of the user's history</li>
 *   <li>{@code totalMessages}, {@code crisisEvents} and every topic count never decrease</li>
 *   <li>{@code lastMessageAt} never moves backwards</li>
 * </ul>
 *
 * <p>Instances are not thread-safe. The engine mutates only private copies
 * obtained through {@link #copy()} while holding the user's lock.
 */
@Getter
public class UserContextAggregate {

    private final String userId;
    private long totalMessages;
    private long incomingMessages;
    private long crisisEvents;
    private Instant lastCrisisAt;
    private Instant firstMessageAt;
    private Instant lastMessageAt;
    private Instant firstIncomingAt;
    private Instant lastIncomingAt;

    /**
     * Optimistic lock version of the stored row, {@code null} until first saved.
     */
    private Long version;

    private final Deque<Boolean> sentimentWindow;

    private final Map<String, TopicTally> topicTallies;

    private final Deque<Instant> recentIncoming;

    private UserContextAggregate(String userId) {
        this.userId = userId;
        this.sentimentWindow = new ArrayDeque<>();
        this.topicTallies = new HashMap<>();
        this.recentIncoming = new ArrayDeque<>();
    }

    /**
     * Lazily created state for a user with no history.
     */
    public static UserContextAggregate empty(String userId) {
        return new UserContextAggregate(Objects.requireNonNull(userId, "User id must not be null"));
    }

    /**
     * Reconstitute from persistence. No validation beyond null checks; the
     * store is trusted to return what was saved.
     */
    public static UserContextAggregate reconstitute(Snapshot snapshot) {
        UserContextAggregate aggregate = empty(snapshot.getUserId());
        aggregate.totalMessages = snapshot.getTotalMessages();
        aggregate.incomingMessages = snapshot.getIncomingMessages();
        aggregate.crisisEvents = snapshot.getCrisisEvents();
        aggregate.lastCrisisAt = snapshot.getLastCrisisAt();
        aggregate.firstMessageAt = snapshot.getFirstMessageAt();
        aggregate.lastMessageAt = snapshot.getLastMessageAt();
        aggregate.firstIncomingAt = snapshot.getFirstIncomingAt();
        aggregate.lastIncomingAt = snapshot.getLastIncomingAt();
        aggregate.version = snapshot.getVersion();
        if (snapshot.getSentimentWindow() != null) {
            aggregate.sentimentWindow.addAll(snapshot.getSentimentWindow());
        }
        if (snapshot.getTopicTallies() != null) {
            aggregate.topicTallies.putAll(snapshot.getTopicTallies());
        }
        if (snapshot.getRecentIncoming() != null) {
            aggregate.recentIncoming.addAll(snapshot.getRecentIncoming());
        }
        return aggregate;
    }

    /**
     * Deep copy sharing no mutable state with this instance.
     */
    public UserContextAggregate copy() {
        return reconstitute(toSnapshot());
    }

    public Snapshot toSnapshot() {
        return Snapshot.builder()
            .userId(userId)
            .totalMessages(totalMessages)
            .incomingMessages(incomingMessages)
            .crisisEvents(crisisEvents)
            .lastCrisisAt(lastCrisisAt)
            .firstMessageAt(firstMessageAt)
            .lastMessageAt(lastMessageAt)
            .firstIncomingAt(firstIncomingAt)
            .lastIncomingAt(lastIncomingAt)
            .version(version)
            .sentimentWindow(new ArrayList<>(sentimentWindow))
            .topicTallies(new HashMap<>(topicTallies))
            .recentIncoming(new ArrayList<>(recentIncoming))
            .build();
    }

    public boolean isNew() {
        return totalMessages == 0;
    }

    /**
     * Negative flags of the most recent incoming turns, oldest first.
     */
    public List<Boolean> getSentimentWindow() {
        return List.copyOf(sentimentWindow);
    }

    public Map<String, TopicTally> getTopicTallies() {
        return Collections.unmodifiableMap(topicTallies);
    }

    /**
     * Incoming timestamps inside the engagement window, oldest first.
     */
    public List<Instant> getRecentIncoming() {
        return List.copyOf(recentIncoming);
    }

    // Fold steps, driven by UserContextAggregator.

    void countMessage(Instant timestamp) {
        totalMessages++;
        if (firstMessageAt == null) {
            firstMessageAt = timestamp;
        }
        lastMessageAt = timestamp;
    }

    void countIncoming(Instant timestamp) {
        incomingMessages++;
        if (firstIncomingAt == null) {
            firstIncomingAt = timestamp;
        }
        lastIncomingAt = timestamp;
    }

    void pushSentiment(boolean negative, int capacity) {
        sentimentWindow.addLast(negative);
        while (sentimentWindow.size() > capacity) {
            sentimentWindow.removeFirst();
        }
    }

    void tallyTopic(String topic, long sequence) {
        topicTallies.merge(topic, TopicTally.first(sequence), (existing, ignored) -> existing.increment(sequence));
    }

    void recordCrisis(Instant timestamp) {
        crisisEvents++;
        lastCrisisAt = timestamp;
    }

    void pushIncoming(Instant timestamp, Instant windowStart) {
        recentIncoming.addLast(timestamp);
        while (!recentIncoming.isEmpty() && recentIncoming.peekFirst().isBefore(windowStart)) {
            recentIncoming.removeFirst();
        }
    }

    /**
     * Serializable view of the aggregate used by persistence adapters.
     */
    @Value
    @Builder
    public static class Snapshot {
        String userId;
        long totalMessages;
        long incomingMessages;
        long crisisEvents;
        Instant lastCrisisAt;
        Instant firstMessageAt;
        Instant lastMessageAt;
        Instant firstIncomingAt;
        Instant lastIncomingAt;
        Long version;
        List<Boolean> sentimentWindow;
        Map<String, TopicTally> topicTallies;
        List<Instant> recentIncoming;

        /**
         * Same state with the version the store assigned on save.
         */
        public Snapshot withVersion(Long newVersion) {
            return new Snapshot(userId, totalMessages, incomingMessages, crisisEvents, lastCrisisAt,
                firstMessageAt, lastMessageAt, firstIncomingAt, lastIncomingAt, newVersion,
                sentimentWindow, topicTallies, recentIncoming);
        }
    }
}
