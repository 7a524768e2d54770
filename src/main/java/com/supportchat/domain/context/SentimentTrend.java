package com.supportchat.domain.context;

/**
 * Direction of a user's recent negative-sentiment ratio.
 */
public enum SentimentTrend {
    POSITIVE,
    NEGATIVE,
    NEUTRAL,
    IMPROVING,
    WORSENING
}
