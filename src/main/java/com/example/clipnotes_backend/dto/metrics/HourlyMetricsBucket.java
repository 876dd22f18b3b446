package com.example.clipnotes_backend.dto.metrics;

import java.time.Instant;

/**
 * Analyses stored during the UTC hour starting at {@code hour}.
 */
public record HourlyMetricsBucket(Instant hour, int analyses) {
}
