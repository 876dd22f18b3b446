package com.example.clipnotes_backend.model;

import com.example.clipnotes_backend.util.ClipStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "clip")
public class Clip {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "filename", nullable = false, length = 255)
    private String filename;

    @Column(name = "asset_id", length = 255)
    private String assetId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ClipStatus status = ClipStatus.PENDING;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_analysis_at")
    private Instant lastAnalysisAt;

    @Column(name = "latency_ms")
    private Integer latencyMs;

    protected Clip() {}

    public Clip(String filename) {
        this.filename = filename;
    }

    public UUID getId() { return id; }
    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }
    public String getAssetId() { return assetId; }
    public void setAssetId(String assetId) { this.assetId = assetId; }
    public ClipStatus getStatus() { return status; }
    public void setStatus(ClipStatus status) { this.status = status; }
    public Instant getCreatedAt() { return createdAt; }

    /**
     * Returns when the most recent analysis was stored.
     *
     * @return instant or {@code null} before the first analysis.
     */
    public Instant getLastAnalysisAt() { return lastAnalysisAt; }
    public void setLastAnalysisAt(Instant lastAnalysisAt) { this.lastAnalysisAt = lastAnalysisAt; }
    public Integer getLatencyMs() { return latencyMs; }
    public void setLatencyMs(Integer latencyMs) { this.latencyMs = latencyMs; }
}
