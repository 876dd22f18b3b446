package com.example.clipnotes_backend.dto.metrics;

import java.time.Instant;
import java.util.List;

/**
 * Usage metrics. {@code errorRate} is {@code null} until the first analysis is stored.
 */
public record MetricsResponse(Instant generatedAt,
                              long totalClips,
                              long totalAnalyses,
                              double avgLatencyMs,
                              long requestsToday,
                              int clipsToday,
                              List<HourlyMetricsBucket> perHour,
                              List<DailyMetricsBucket> perDay,
                              boolean latencyFlag,
                              Double errorRate) {
}
