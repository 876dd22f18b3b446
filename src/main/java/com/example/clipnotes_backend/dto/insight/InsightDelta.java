package com.example.clipnotes_backend.dto.insight;

/**
 * Change relative to the immediately preceding window of equal length.
 */
public record InsightDelta(int analyses, int highSeverity) {
}
