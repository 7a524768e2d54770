package com.supportchat.domain.repository;

import com.supportchat.domain.context.UserContextAggregate;
import com.supportchat.domain.model.ConversationMessage;

import java.util.List;
import java.util.Optional;

/**
 * Persistence port for conversation history and per-user aggregates.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>guarantee read-your-writes for sequential operations on one user</li>
 *   <li>never reorder or rewrite appended messages</li>
 *   <li>reject a save whose aggregate version is stale</li>
 *   <li>report failures as {@link ConversationStoreException}, without retrying</li>
 * </ul>
 *
 * <p>{@link #append} and {@link #save} are called together inside one
 * transaction; adapters must take part in the caller's transaction so that
 * both writes commit or neither does.
 *
 * @since 1.0.0
 */
public interface ConversationStore {

    /**
     * Load the user's aggregate.
     *
     * @param userId user identifier
     * @return stored aggregate, empty for a user never seen before
     */
    Optional<UserContextAggregate> load(String userId);

    /**
     * Append a message to the user's history.
     *
     * @param message message with its sequence already assigned
     * @return the stored message with its identifier
     */
    ConversationMessage append(ConversationMessage message);

    /**
     * Create or update the user's aggregate.
     *
     * @param aggregate aggregate carrying the version it was loaded with
     * @return the aggregate as stored, with its new version
     */
    UserContextAggregate save(UserContextAggregate aggregate);

    /**
     * Most recent messages of a user, oldest first.
     *
     * @param userId user identifier
     * @param limit maximum number of messages
     * @return up to {@code limit} messages in arrival order
     */
    List<ConversationMessage> findRecent(String userId, int limit);

    /**
     * Full history of a user in arrival order, used for replay.
     */
    List<ConversationMessage> findAll(String userId);
}
