package com.example.clipnotes_backend.service.insight;

/**
 * Labeled event as stored on an analysis; severity is the raw stored string.
 */
public record AnalysisEvent(String label, String severity) {
}
