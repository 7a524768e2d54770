package com.supportchat.domain.context;

public enum EngagementLevel {
    LOW,
    MEDIUM,
    HIGH
}
