package com.supportchat.domain.analysis;

/**
 * Urgency assigned to a single message, ordered from least to most urgent.
 */
public enum UrgencyLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(UrgencyLevel other) {
        return compareTo(other) >= 0;
    }
}
