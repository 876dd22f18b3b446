package com.example.clipnotes_backend.dto.insight;

/**
 * Body for regenerate/share calls; the window defaults to {@code 24h}.
 */
public record InsightWindowRequest(String window) {
    public String windowOrDefault() {
        return window == null ? "24h" : window;
    }
}
