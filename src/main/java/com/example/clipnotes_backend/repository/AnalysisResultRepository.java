package com.example.clipnotes_backend.repository;

import com.example.clipnotes_backend.model.AnalysisResult;
import com.example.clipnotes_backend.model.Clip;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for stored analysis results.
 */
public interface AnalysisResultRepository extends JpaRepository<AnalysisResult, UUID> {
    /**
     * Lists analyses created at or after {@code since}, oldest first.
     *
     * @param since inclusive lower bound.
     * @return matching analyses.
     */
    List<AnalysisResult> findByCreatedAtGreaterThanEqualOrderByCreatedAtAsc(Instant since);

    /**
     * Lists analyses created in {@code [since, until)}, oldest first.
     *
     * @param since inclusive lower bound.
     * @param until exclusive upper bound.
     * @return matching analyses.
     */
    List<AnalysisResult> findByCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByCreatedAtAsc(Instant since, Instant until);

    Optional<AnalysisResult> findFirstByClipOrderByCreatedAtDesc(Clip clip);

    /**
     * Averages the reported latency of analyses created at or after {@code since}.
     *
     * @param since inclusive lower bound.
     * @return mean latency in milliseconds, or {@code null} when no analysis reported one.
     */
    @Query("select avg(a.latencyMs) from AnalysisResult a where a.createdAt >= :since and a.latencyMs is not null")
    Double averageLatencySince(@Param("since") Instant since);

    @Query("select count(a) from AnalysisResult a where a.errorCode is not null or a.errorMessage is not null")
    long countFailed();

    @Query("select a.createdAt from AnalysisResult a where a.createdAt >= :since order by a.createdAt")
    List<Instant> findCreatedAtSince(@Param("since") Instant since);
}
