package com.supportchat.domain.repository;

/**
 * Conversation history or user aggregate could not be read or written.
 *
 * <p>Nothing of the failed operation has been committed when this is thrown.
 */
public class ConversationStoreException extends RuntimeException {

    public ConversationStoreException(String message) {
        super(message);
    }

    public ConversationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
