package com.example.clipnotes_backend.service.insight;

import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Cached value with its expiry; {@code expiresAt == null} never expires on its own.
 */
public record CacheEntry<V>(V value, @Nullable Instant expiresAt) {

    public boolean isValid(Instant now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }
}
