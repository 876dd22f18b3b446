package com.example.clipnotes_backend.dto.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Analysis payload. A non-blank {@code errorCode} or {@code errorMessage} records a failed run.
 */
public record AnalysisSaveRequest(String summary,
                                  @NotNull List<@Valid MomentDTO> moments,
                                  String prompt,
                                  @PositiveOrZero Integer latencyMs,
                                  @Size(max = 64) String errorCode,
                                  String errorMessage) {
}
