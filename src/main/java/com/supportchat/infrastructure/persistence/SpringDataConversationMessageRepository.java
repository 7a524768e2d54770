package com.supportchat.infrastructure.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for the message log.
 */
@Repository
public interface SpringDataConversationMessageRepository extends JpaRepository<ConversationMessageRecord, Long> {

    /**
     * Newest messages first; callers reverse for arrival order.
     */
    @Query("SELECT m FROM ConversationMessageRecord m WHERE m.userId = :userId ORDER BY m.sequence DESC")
    List<ConversationMessageRecord> findLatest(@Param("userId") String userId, Pageable page);

    List<ConversationMessageRecord> findByUserIdOrderBySequenceAsc(String userId);

    long countByUserId(String userId);
}
