package com.supportchat.application;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one chat turn: the reply shown to the user, the stored reply's
 * identifier and the context analysis of the user's message.
 */
@Value
@Builder
public class ChatResult {
    String userId;
    String response;
    Long messageId;
    ContextAnalysis contextAnalysis;
    List<String> crisisResources;
    boolean fallback;
}
