package com.supportchat.domain.model;

/**
 * Direction of a conversation turn relative to the user.
 */
public enum MessageDirection {
    /** Written by the user. */
    INCOMING,
    /** Generated reply sent back to the user. */
    OUTGOING
}
