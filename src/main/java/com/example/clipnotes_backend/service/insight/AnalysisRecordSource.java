package com.example.clipnotes_backend.service.insight;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Read-only access to stored analyses.
 */
public interface AnalysisRecordSource {
    /**
     * Returns analyses created in {@code [since, until)}, or {@code [since, +inf)} when
     * {@code until} is {@code null}, ordered ascending by creation time.
     *
     * @param since inclusive lower bound.
     * @param until exclusive upper bound, or {@code null}.
     * @return matching records.
     */
    List<AnalysisRecord> findCreatedBetween(Instant since, @Nullable Instant until);
}
