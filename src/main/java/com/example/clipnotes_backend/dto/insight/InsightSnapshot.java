package com.example.clipnotes_backend.dto.insight;

import com.example.clipnotes_backend.service.insight.InsightWindow;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated, summarised insight view for one window.
 *
 * @param window         window the snapshot covers.
 * @param generatedAt    reference instant used for aggregation.
 * @param summary        narrative summary.
 * @param summarySource  provenance of {@code summary}.
 * @param severityTotals window-wide event counts per severity.
 * @param series         chart buckets in ascending order.
 * @param topLabels      up to five most frequent labels.
 * @param delta          change against the prior window, {@code null} when both windows are empty.
 * @param cacheExpiresAt expiry of the cache entry this snapshot was served from.
 */
public record InsightSnapshot(InsightWindow window,
                              Instant generatedAt,
                              String summary,
                              String summarySource,
                              SeverityTotals severityTotals,
                              List<SeriesBucket> series,
                              List<TopLabel> topLabels,
                              InsightDelta delta,
                              Instant cacheExpiresAt) {

    public static final String SOURCE_FALLBACK = "fallback";

    public InsightSnapshot {
        series = series == null ? List.of() : List.copyOf(series);
        topLabels = topLabels == null ? List.of() : List.copyOf(topLabels);
    }

    /**
     * Returns this snapshot annotated with the given cache expiry; {@code this} when unchanged.
     */
    public InsightSnapshot withCacheExpiresAt(Instant expiresAt) {
        if (Objects.equals(cacheExpiresAt, expiresAt)) {
            return this;
        }
        return new InsightSnapshot(window, generatedAt, summary, summarySource, severityTotals,
                series, topLabels, delta, expiresAt);
    }
}
