package com.example.clipnotes_backend.dto.insight;

import java.time.Instant;

/**
 * One chart bucket, covering {@code [bucketStart, bucketStart + quantum)}.
 *
 * @param bucketStart aligned UTC bucket start.
 * @param total       number of analyses attributed to the bucket.
 * @param severity    event counts per severity within the bucket.
 */
public record SeriesBucket(Instant bucketStart, int total, SeverityTotals severity) {
}
