package com.example.clipnotes_backend.repository;

import com.example.clipnotes_backend.model.InsightShare;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Repository for share links keyed by token hash.
 */
public interface InsightShareRepository extends JpaRepository<InsightShare, String> {
    /**
     * Bumps the last-accessed timestamp without touching the payload.
     *
     * @param tokenHash  share key.
     * @param accessedAt access instant.
     * @return number of updated rows.
     */
    @Modifying
    @Transactional
    @Query("update InsightShare s set s.lastAccessedAt = :accessedAt where s.tokenHash = :tokenHash")
    int touch(@Param("tokenHash") String tokenHash, @Param("accessedAt") Instant accessedAt);
}
