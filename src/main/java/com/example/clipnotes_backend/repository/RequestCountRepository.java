package com.example.clipnotes_backend.repository;

import com.example.clipnotes_backend.model.RequestCount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Repository for per-day request counters.
 */
public interface RequestCountRepository extends JpaRepository<RequestCount, LocalDate> {
    /**
     * Adds one to the counter of {@code day} in a single statement.
     *
     * @param day       UTC calendar day.
     * @param updatedAt increment instant.
     * @return number of updated rows; zero when the day has no row yet.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("update RequestCount r set r.requests = r.requests + 1, r.updatedAt = :updatedAt where r.requestDate = :day")
    int increment(@Param("day") LocalDate day, @Param("updatedAt") Instant updatedAt);

    List<RequestCount> findByRequestDateGreaterThanEqual(LocalDate since);
}
