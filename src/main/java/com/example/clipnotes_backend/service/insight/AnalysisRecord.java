package com.example.clipnotes_backend.service.insight;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read-only view of a persisted analysis consumed by the aggregator.
 *
 * @param clipId    clip the analysis belongs to.
 * @param createdAt UTC creation instant.
 * @param events    events in stored order.
 */
public record AnalysisRecord(UUID clipId, Instant createdAt, List<AnalysisEvent> events) {
    public AnalysisRecord {
        events = events == null ? List.of() : List.copyOf(events);
    }
}
