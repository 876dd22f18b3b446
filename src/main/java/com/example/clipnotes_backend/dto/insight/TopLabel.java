package com.example.clipnotes_backend.dto.insight;

/**
 * Frequently occurring label.
 *
 * @param label       title-cased label.
 * @param count       number of events carrying the label.
 * @param avgSeverity mean severity weight (low=0, medium=1, high=2), {@code null} when count is zero.
 */
public record TopLabel(String label, int count, Double avgSeverity) {
}
