package com.supportchat.domain.analysis;

import java.util.Locale;

/**
 * Severity tier of a crisis lexicon term, ordered from least to most severe.
 */
public enum CrisisTier {
    MODERATE(UrgencyLevel.MEDIUM, false),
    SEVERE(UrgencyLevel.HIGH, true),
    IMMINENT(UrgencyLevel.CRITICAL, true);

    private final UrgencyLevel urgency;
    private final boolean crisis;

    CrisisTier(UrgencyLevel urgency, boolean crisis) {
        this.urgency = urgency;
        this.crisis = crisis;
    }

    public UrgencyLevel urgency() {
        return urgency;
    }

    public boolean isCrisis() {
        return crisis;
    }

    public static CrisisTier fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
