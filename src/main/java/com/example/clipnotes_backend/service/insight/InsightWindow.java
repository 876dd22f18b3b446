package com.example.clipnotes_backend.service.insight;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Supported insight horizons and their bucket alignment rules.
 * <p>
 * All timestamp normalization for the insight layer happens here: instants are UTC by definition
 * and are truncated to the bucket quantum before any bucket matching.
 */
public enum InsightWindow {
    LAST_24_HOURS("24h", 24, ChronoUnit.HOURS, "the past 24 hours"),
    LAST_7_DAYS("7d", 7, ChronoUnit.DAYS, "the past 7 days");

    private final String key;
    private final int bucketCount;
    private final ChronoUnit quantum;
    private final String phrase;

    InsightWindow(String key, int bucketCount, ChronoUnit quantum, String phrase) {
        this.key = key;
        this.bucketCount = bucketCount;
        this.quantum = quantum;
        this.phrase = phrase;
    }

    /**
     * Normalises and validates a raw window string ({@code " 7D "} becomes {@code 7d}).
     *
     * @param raw user supplied value, may be {@code null}.
     * @return the matching window.
     * @throws InvalidWindowException when the value is blank or unsupported.
     */
    @JsonCreator
    public static InsightWindow validate(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidWindowException(raw, "Window value is required");
        }
        String normalized = raw.strip().toLowerCase(Locale.ROOT);
        for (InsightWindow window : values()) {
            if (window.key.equals(normalized)) {
                return window;
            }
        }
        throw new InvalidWindowException(raw, "Unsupported window '" + raw + "'. Expected one of: 24h, 7d");
    }

    @JsonValue
    public String key() {
        return key;
    }

    public int bucketCount() {
        return bucketCount;
    }

    public Duration bucketSize() {
        return quantum.getDuration();
    }

    /**
     * Full span of the window, {@code bucketCount} quanta.
     */
    public Duration duration() {
        return bucketSize().multipliedBy(bucketCount);
    }

    /**
     * Human readable phrase used by generated summaries.
     */
    public String phrase() {
        return phrase;
    }

    /**
     * Truncates an instant down to this window's bucket quantum.
     *
     * @param instant UTC instant.
     * @return start of the bucket containing {@code instant}.
     */
    public Instant truncate(Instant instant) {
        return instant.truncatedTo(quantum);
    }

    /**
     * Returns the first bucket edge for the given reference instant.
     */
    public Instant firstEdge(Instant now) {
        return truncate(now).minus(bucketSize().multipliedBy(bucketCount - 1L));
    }

    /**
     * Returns {@code bucketCount} contiguous, ascending bucket starts ending at {@code truncate(now)}.
     *
     * @param now reference instant.
     * @return immutable list of bucket edges.
     */
    public List<Instant> bucketEdges(Instant now) {
        Instant start = firstEdge(now);
        List<Instant> edges = new ArrayList<>(bucketCount);
        for (int i = 0; i < bucketCount; i++) {
            edges.add(start.plus(bucketSize().multipliedBy(i)));
        }
        return List.copyOf(edges);
    }

    @Override
    public String toString() {
        return key;
    }
}
