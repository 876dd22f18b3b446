package com.example.clipnotes_backend.dto.insight;

/**
 * Event counts per normalised severity.
 */
public record SeverityTotals(int low, int medium, int high) {

    public static SeverityTotals empty() {
        return new SeverityTotals(0, 0, 0);
    }

    public int total() {
        return low + medium + high;
    }
}
