package com.example.clipnotes_backend.dto.web;

import com.example.clipnotes_backend.model.Clip;

import java.time.Instant;
import java.util.UUID;

public record ClipResponse(UUID id,
                           String filename,
                           String assetId,
                           String status,
                           Instant createdAt,
                           Instant lastAnalysisAt,
                           Integer latencyMs) {

    public static ClipResponse from(Clip clip) {
        return new ClipResponse(clip.getId(), clip.getFilename(), clip.getAssetId(), clip.getStatus().name(),
                clip.getCreatedAt(), clip.getLastAnalysisAt(), clip.getLatencyMs());
    }
}
