package com.supportchat.domain.context;

import com.supportchat.domain.analysis.MessageAnalysis;
import com.supportchat.domain.model.ConversationMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Fold step over a user's history plus the derivations read from the folded state.
 *
 * <p>{@link #update} never mutates its input: it returns a fresh aggregate, so a
 * failed write leaves the caller's state untouched. Given the same policy, the
 * same ordered messages always fold to the same aggregate, and the incremental
 * result equals a full {@link #replay}.
 *
 * <p>Outgoing replies are counted in the history length but contribute nothing
 * to sentiment, topics, crisis events or engagement.
 */
public class UserContextAggregator {

    private static final Comparator<Map.Entry<String, TopicTally>> TOPIC_RANKING =
        Comparator.<Map.Entry<String, TopicTally>>comparingLong(e -> e.getValue().getCount()).reversed()
            .thenComparing(Comparator.<Map.Entry<String, TopicTally>>comparingLong(
                e -> e.getValue().getLastSequence()).reversed())
            .thenComparing(Map.Entry::getKey);

    private final AggregationPolicy policy;

    public UserContextAggregator(AggregationPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "Aggregation policy must not be null");
    }

    public AggregationPolicy getPolicy() {
        return policy;
    }

    /**
     * Fold one message into the aggregate.
     *
     * @param aggregate current state (not modified)
     * @param message next message of the same user, in arrival order
     * @param analysis classification of an incoming message; ignored for outgoing ones
     * @return updated state
     * @throws IllegalArgumentException if the message belongs to another user,
     *     is out of sequence, or predates the latest folded message
     */
    public UserContextAggregate update(
            UserContextAggregate aggregate, ConversationMessage message, MessageAnalysis analysis) {

        Objects.requireNonNull(aggregate, "Aggregate must not be null");
        Objects.requireNonNull(message, "Message must not be null");
        checkOrdering(aggregate, message);

        UserContextAggregate next = aggregate.copy();
        Instant timestamp = message.getTimestamp();
        next.countMessage(timestamp);

        if (!message.isIncoming()) {
            return next;
        }
        if (analysis == null) {
            throw new IllegalArgumentException("Incoming message requires an analysis");
        }

        next.countIncoming(timestamp);
        next.pushSentiment(analysis.isNegative(), policy.getSentimentWindow());
        for (String topic : analysis.getTopics()) {
            next.tallyTopic(topic, message.getSequence());
        }
        if (analysis.isCrisis()) {
            next.recordCrisis(timestamp);
        }
        next.pushIncoming(timestamp, timestamp.minus(policy.getEngagementWindow()));
        return next;
    }

    /**
     * Rebuild a user's aggregate from the full ordered history.
     */
    public UserContextAggregate replay(String userId, List<ConversationMessage> history) {
        UserContextAggregate aggregate = UserContextAggregate.empty(userId);
        for (ConversationMessage message : history) {
            aggregate = update(aggregate, message, message.getAnalysis());
        }
        return aggregate;
    }

    public UserContextSummary summarize(UserContextAggregate aggregate) {
        return UserContextSummary.builder()
            .userId(aggregate.getUserId())
            .totalMessages(aggregate.getTotalMessages())
            .incomingMessages(aggregate.getIncomingMessages())
            .sentimentTrend(sentimentTrend(aggregate.getSentimentWindow()))
            .commonTopics(commonTopics(aggregate.getTopicTallies()))
            .engagementLevel(engagementLevel(aggregate))
            .crisisEvents(aggregate.getCrisisEvents())
            .lastCrisisAt(aggregate.getLastCrisisAt())
            .firstMessageAt(aggregate.getFirstMessageAt())
            .lastMessageAt(aggregate.getLastMessageAt())
            .build();
    }

    /**
     * Trend over the negative flags of the window, oldest first.
     *
     * <p>The newest {@code n/2} flags form the recent half and the older
     * remainder the prior half. A shift larger than the trend delta between
     * the halves reports a direction; otherwise the overall ratio decides.
     * Fewer flags than the minimum sample report {@link SentimentTrend#NEUTRAL}.
     */
    SentimentTrend sentimentTrend(List<Boolean> window) {
        int n = window.size();
        if (n < policy.getMinimumTrendSample()) {
            return SentimentTrend.NEUTRAL;
        }
        int recentSize = n / 2;
        int priorSize = n - recentSize;

        double priorRatio = negativeRatio(window.subList(0, priorSize));
        double recentRatio = negativeRatio(window.subList(priorSize, n));

        if (recentSize > 0) {
            if (recentRatio - priorRatio > policy.getTrendDelta()) {
                return SentimentTrend.WORSENING;
            }
            if (priorRatio - recentRatio > policy.getTrendDelta()) {
                return SentimentTrend.IMPROVING;
            }
        }

        double overall = negativeRatio(window);
        if (overall > policy.getNegativeRatio()) {
            return SentimentTrend.NEGATIVE;
        }
        if (overall < policy.getPositiveRatio()) {
            return SentimentTrend.POSITIVE;
        }
        return SentimentTrend.NEUTRAL;
    }

    List<String> commonTopics(Map<String, TopicTally> tallies) {
        return tallies.entrySet().stream()
            .sorted(TOPIC_RANKING)
            .limit(policy.getTopTopics())
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    }

    /**
     * Incoming messages per hour inside the trailing window ending at the latest
     * incoming message. A history shorter than the window is measured over the
     * span it actually covers, floored at the minimum span.
     */
    EngagementLevel engagementLevel(UserContextAggregate aggregate) {
        List<Instant> recent = aggregate.getRecentIncoming();
        if (recent.isEmpty() || aggregate.getLastIncomingAt() == null) {
            return EngagementLevel.LOW;
        }
        Duration covered = Duration.between(aggregate.getFirstIncomingAt(), aggregate.getLastIncomingAt());
        Duration span = covered.compareTo(policy.getEngagementWindow()) > 0 ? policy.getEngagementWindow() : covered;
        if (span.compareTo(policy.getMinimumEngagementSpan()) < 0) {
            span = policy.getMinimumEngagementSpan();
        }
        double hours = span.toMillis() / 3_600_000.0;
        double rate = recent.size() / hours;

        if (rate >= policy.getHighEngagementRate()) {
            return EngagementLevel.HIGH;
        }
        if (rate > policy.getMediumEngagementRate()) {
            return EngagementLevel.MEDIUM;
        }
        return EngagementLevel.LOW;
    }

    private void checkOrdering(UserContextAggregate aggregate, ConversationMessage message) {
        if (!aggregate.getUserId().equals(message.getUserId())) {
            throw new IllegalArgumentException("Message belongs to a different user");
        }
        long expected = aggregate.getTotalMessages() + 1;
        if (message.getSequence() != expected) {
            throw new IllegalArgumentException(
                "Message out of sequence: expected " + expected + ", got " + message.getSequence());
        }
        if (message.getTimestamp() == null) {
            throw new IllegalArgumentException("Message timestamp must not be null");
        }
        Instant last = aggregate.getLastMessageAt();
        if (last != null && message.getTimestamp().isBefore(last)) {
            throw new IllegalArgumentException("Message timestamp precedes the latest message");
        }
    }

    private static double negativeRatio(List<Boolean> flags) {
        if (flags.isEmpty()) {
            return 0.0;
        }
        long negatives = flags.stream().filter(Boolean::booleanValue).count();
        return (double) negatives / flags.size();
    }
}
