package com.example.clipnotes_backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Number of API requests served on one UTC calendar day.
 */
@Entity
@Table(name = "request_count")
public class RequestCount implements Persistable<LocalDate> {
    @Id
    @Column(name = "request_date", nullable = false, updatable = false)
    private LocalDate requestDate;

    @Column(name = "requests", nullable = false)
    private long requests;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Transient
    private boolean isNew = true;

    protected RequestCount() {
    }

    public RequestCount(LocalDate requestDate, long requests, Instant updatedAt) {
        this.requestDate = requestDate;
        this.requests = requests;
        this.updatedAt = updatedAt;
    }

    @Override
    public LocalDate getId() {
        return requestDate;
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

    public LocalDate getRequestDate() {
        return requestDate;
    }

    public long getRequests() {
        return requests;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
