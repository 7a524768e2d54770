package com.supportchat.support;

import com.supportchat.domain.context.UserContextAggregate;
import com.supportchat.domain.model.ConversationMessage;
import com.supportchat.domain.repository.ConversationStore;
import com.supportchat.domain.repository.ConversationStoreException;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionOperations;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link ConversationStore} held in memory, with failure injection and a
 * {@link TransactionOperations} that restores the previous contents when the
 * callback throws.
 */
public class InMemoryConversationStore implements ConversationStore {

    private final Map<String, UserContextAggregate.Snapshot> aggregates = new HashMap<>();
    private final Map<String, List<ConversationMessage>> messages = new HashMap<>();
    private final AtomicLong ids = new AtomicLong();

    private volatile boolean failAppend;
    private volatile boolean failSave;
    private volatile boolean failLoad;

    public void failAppend(boolean fail) {
        this.failAppend = fail;
    }

    public void failSave(boolean fail) {
        this.failSave = fail;
    }

    public void failLoad(boolean fail) {
        this.failLoad = fail;
    }

    public TransactionOperations transactions() {
        return new TransactionOperations() {
            @Override
            public <T> T execute(TransactionCallback<T> action) {
                Map<String, UserContextAggregate.Snapshot> aggregatesBefore;
                Map<String, List<ConversationMessage>> messagesBefore;
                synchronized (InMemoryConversationStore.this) {
                    aggregatesBefore = new HashMap<>(aggregates);
                    messagesBefore = deepCopy(messages);
                }
                try {
                    return action.doInTransaction(new SimpleTransactionStatus());
                } catch (RuntimeException e) {
                    synchronized (InMemoryConversationStore.this) {
                        aggregates.clear();
                        aggregates.putAll(aggregatesBefore);
                        messages.clear();
                        messages.putAll(messagesBefore);
                    }
                    throw e;
                }
            }
        };
    }

    @Override
    public synchronized Optional<UserContextAggregate> load(String userId) {
        if (failLoad) {
            throw new ConversationStoreException("Injected load failure");
        }
        return Optional.ofNullable(aggregates.get(userId)).map(UserContextAggregate::reconstitute);
    }

    @Override
    public synchronized ConversationMessage append(ConversationMessage message) {
        if (failAppend) {
            throw new ConversationStoreException("Injected append failure");
        }
        ConversationMessage stored = message.withId(ids.incrementAndGet());
        messages.computeIfAbsent(message.getUserId(), id -> new ArrayList<>()).add(stored);
        return stored;
    }

    @Override
    public synchronized UserContextAggregate save(UserContextAggregate aggregate) {
        if (failSave) {
            throw new ConversationStoreException("Injected save failure");
        }
        UserContextAggregate.Snapshot current = aggregates.get(aggregate.getUserId());
        Long storedVersion = current == null ? null : current.getVersion();
        if (!Objects.equals(storedVersion, aggregate.getVersion())) {
            throw new ConversationStoreException("Stale user context");
        }
        long nextVersion = storedVersion == null ? 0L : storedVersion + 1;
        UserContextAggregate.Snapshot saved = aggregate.toSnapshot().withVersion(nextVersion);
        aggregates.put(aggregate.getUserId(), saved);
        return UserContextAggregate.reconstitute(saved);
    }

    @Override
    public synchronized List<ConversationMessage> findRecent(String userId, int limit) {
        List<ConversationMessage> all = messages.getOrDefault(userId, List.of());
        return new ArrayList<>(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    @Override
    public synchronized List<ConversationMessage> findAll(String userId) {
        return new ArrayList<>(messages.getOrDefault(userId, List.of()));
    }

    public synchronized Optional<UserContextAggregate.Snapshot> storedSnapshot(String userId) {
        return Optional.ofNullable(aggregates.get(userId));
    }

    private static Map<String, List<ConversationMessage>> deepCopy(Map<String, List<ConversationMessage>> source) {
        Map<String, List<ConversationMessage>> copy = new HashMap<>();
        source.forEach((userId, log) -> copy.put(userId, new ArrayList<>(log)));
        return copy;
    }
}
