package com.example.clipnotes_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Stored outcome of one analysis run for a clip. Moments are kept as JSON objects with
 * {@code startS}, {@code endS}, {@code label} and {@code severity} keys.
 */
@Entity
@Table(name = "analysis_result", indexes = {
        @Index(name = "ix_analysis_result_created_at", columnList = "created_at")
})
public class AnalysisResult {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "clip_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_analysis_result_clip"))
    private Clip clip;

    @Column(name = "summary", columnDefinition = "text")
    private String summary;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "moments", nullable = false)
    private List<Map<String, Object>> moments = new ArrayList<>();

    @Column(name = "prompt", columnDefinition = "text")
    private String prompt;

    @Column(name = "latency_ms")
    private Integer latencyMs;

    @Column(name = "error_code", length = 64)
    private String errorCode;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected AnalysisResult() {}

    public AnalysisResult(Clip clip, Instant createdAt) {
        this.clip = clip;
        this.createdAt = createdAt;
    }

    public UUID getId() { return id; }
    public Clip getClip() { return clip; }
    public String getSummary() { return summary; }
    public void setSummary(String summary) { this.summary = summary; }
    public List<Map<String, Object>> getMoments() { return moments; }
    public void setMoments(List<Map<String, Object>> moments) { this.moments = moments; }
    public String getPrompt() { return prompt; }
    public void setPrompt(String prompt) { this.prompt = prompt; }
    public Integer getLatencyMs() { return latencyMs; }
    public void setLatencyMs(Integer latencyMs) { this.latencyMs = latencyMs; }
    public String getErrorCode() { return errorCode; }
    public void setErrorCode(String errorCode) { this.errorCode = errorCode; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public Instant getCreatedAt() { return createdAt; }
}
