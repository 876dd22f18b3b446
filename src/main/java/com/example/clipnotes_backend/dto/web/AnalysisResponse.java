package com.example.clipnotes_backend.dto.web;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record AnalysisResponse(UUID id,
                               UUID clipId,
                               String summary,
                               List<MomentDTO> moments,
                               String prompt,
                               Integer latencyMs,
                               String errorCode,
                               String errorMessage,
                               Instant createdAt) {
}
