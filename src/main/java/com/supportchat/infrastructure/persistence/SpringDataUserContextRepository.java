package com.supportchat.infrastructure.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Spring Data JPA repository for per-user context rows, keyed by user id.
 */
@Repository
public interface SpringDataUserContextRepository extends JpaRepository<UserContextRecord, String> {
}
