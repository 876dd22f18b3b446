package com.example.clipnotes_backend.model;

import com.example.clipnotes_backend.service.insight.InsightWindow;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.Map;

/**
 * Persisted share link. The primary key is the salted token hash; the plaintext token is never stored.
 */
@Entity
@Table(name = "insight_share", indexes = {
        @Index(name = "ix_insight_share_window", columnList = "window_key")
})
public class InsightShare implements Persistable<String> {
    @Id
    @Column(name = "token_hash", nullable = false, updatable = false, length = 128)
    private String tokenHash;

    @Convert(converter = InsightWindowConverter.class)
    @Column(name = "window_key", nullable = false, updatable = false, length = 8)
    private InsightWindow window;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_accessed_at")
    private Instant lastAccessedAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", nullable = false)
    private Map<String, Object> payload;

    // assigned ids would otherwise be merged, silently overwriting a colliding row
    @Transient
    private boolean isNew = true;

    protected InsightShare() {
    }

    public InsightShare(String tokenHash, InsightWindow window, Map<String, Object> payload, Instant createdAt) {
        this.tokenHash = tokenHash;
        this.window = window;
        this.payload = payload;
        this.createdAt = createdAt;
    }

    @Override
    public String getId() {
        return tokenHash;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }

    public String getTokenHash() {
        return tokenHash;
    }

    /**
     * Returns the window the token is bound to for its whole lifetime.
     */
    public InsightWindow getWindow() {
        return window;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastAccessedAt() {
        return lastAccessedAt;
    }

    public void setLastAccessedAt(Instant lastAccessedAt) {
        this.lastAccessedAt = lastAccessedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    /**
     * Returns the last persisted snapshot as a JSON object tree.
     */
    public Map<String, Object> getPayload() {
        return payload;
    }

    public void setPayload(Map<String, Object> payload) {
        this.payload = payload;
    }
}
