package com.example.clipnotes_backend.service.insight;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Normalised event severity with the weight used for label averages.
 */
public enum Severity {
    LOW(0),
    MEDIUM(1),
    HIGH(2);

    private static final Map<String, Severity> SYNONYMS = Map.of(
            "low", LOW,
            "medium", MEDIUM,
            "mid", MEDIUM,
            "med", MEDIUM,
            "high", HIGH,
            "severe", HIGH
    );

    private final int weight;

    Severity(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    /**
     * Maps a raw severity string onto the fixed synonym table.
     *
     * @param raw stored severity, may be {@code null}.
     * @return severity, or empty when the value is unknown.
     */
    public static Optional<Severity> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(SYNONYMS.get(raw.strip().toLowerCase(Locale.ROOT)));
    }
}
