package com.supportchat.domain.context;

import lombok.Value;

/**
 * Cumulative mention count of one topic plus the sequence of the latest message mentioning it.
 */
@Value
public class TopicTally {

    long count;
    long lastSequence;

    public static TopicTally first(long sequence) {
        return new TopicTally(1, sequence);
    }

    public TopicTally increment(long sequence) {
        return new TopicTally(count + 1, Math.max(lastSequence, sequence));
    }
}
