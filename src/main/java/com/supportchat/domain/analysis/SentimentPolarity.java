package com.supportchat.domain.analysis;

import java.util.Locale;

public enum SentimentPolarity {
    POSITIVE,
    NEGATIVE;

    public static SentimentPolarity fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
