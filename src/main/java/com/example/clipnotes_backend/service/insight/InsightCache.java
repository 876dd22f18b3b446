package com.example.clipnotes_backend.service.insight;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-window TTL cache that runs at most one builder per window at a time.
 * <p>
 * The key space is closed, so one lock per window is created up front and never replaced.
 * Callers that queued behind a running build receive that build's entry instead of rebuilding,
 * which keeps concurrent requests collapsed even when the TTL is zero.
 */
public class InsightCache<V> {
    private static final Logger LOGGER = LoggerFactory.getLogger(InsightCache.class);

    private final Duration ttl;
    private final Clock clock;
    private final Map<InsightWindow, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final Map<InsightWindow, KeyState<V>> keyStates = new EnumMap<>(InsightWindow.class);

    public InsightCache(int ttlSeconds, Clock clock) {
        this.ttl = Duration.ofSeconds(ttlSeconds);
        this.clock = clock;
        for (InsightWindow window : InsightWindow.values()) {
            keyStates.put(window, new KeyState<>());
        }
    }

    /**
     * Returns the entry for {@code key} when present and unexpired; expired entries are evicted.
     *
     * @param key window key.
     * @return valid entry or empty on a miss.
     */
    public Optional<CacheEntry<V>> get(InsightWindow key) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isValid(clock.instant())) {
            return Optional.of(entry);
        }
        entries.remove(key, entry);
        LOGGER.debug("InsightCache evict window={} expiresAt={}", key, entry.expiresAt());
        return Optional.empty();
    }

    public CacheEntry<V> set(InsightWindow key, V value) {
        return set(key, value, null);
    }

    /**
     * Stores a value. Without an explicit expiry the entry lives for the configured TTL; a TTL of
     * zero or less expires it immediately so the next independent {@link #get} misses.
     *
     * @param key       window key.
     * @param value     value to cache.
     * @param expiresAt explicit expiry or {@code null} to derive it from the TTL.
     * @return the stored entry.
     */
    public CacheEntry<V> set(InsightWindow key, V value, @Nullable Instant expiresAt) {
        Instant expiry = expiresAt != null ? expiresAt : computeExpiry(clock.instant());
        CacheEntry<V> entry = new CacheEntry<>(value, expiry);
        entries.put(key, entry);
        return entry;
    }

    public void invalidate(InsightWindow key) {
        entries.remove(key);
        keyStates.get(key).lastBuilt = null;
    }

    public void invalidateAll() {
        entries.clear();
        keyStates.values().forEach(state -> state.lastBuilt = null);
    }

    /**
     * Returns the cached entry or builds, stores and returns a new one.
     * <p>
     * The builder runs at most once concurrently per key. A failing builder leaves no entry behind
     * and its exception reaches the caller that ran it; queued callers then retry the build.
     *
     * @param key     window key.
     * @param builder produces the value on a miss.
     * @return valid entry, or the entry just built by this or a concurrent caller.
     */
    public CacheEntry<V> getOrSet(InsightWindow key, Supplier<? extends V> builder) {
        Optional<CacheEntry<V>> cached = get(key);
        if (cached.isPresent()) {
            LOGGER.debug("InsightCache hit window={}", key);
            return cached.get();
        }

        KeyState<V> state = keyStates.get(key);
        long observedGeneration = state.generation;
        state.lock.lock();
        try {
            CacheEntry<V> concurrentBuild = state.lastBuilt;
            if (state.generation != observedGeneration && concurrentBuild != null) {
                LOGGER.debug("InsightCache joined concurrent build window={}", key);
                return concurrentBuild;
            }
            cached = get(key);
            if (cached.isPresent()) {
                return cached.get();
            }

            LOGGER.debug("InsightCache miss window={}", key);
            CacheEntry<V> entry = set(key, builder.get());
            state.lastBuilt = entry;
            state.generation++;
            return entry;
        } finally {
            state.lock.unlock();
        }
    }

    private Instant computeExpiry(Instant now) {
        if (ttl.isZero() || ttl.isNegative()) {
            return now;
        }
        return now.plus(ttl);
    }

    private static final class KeyState<V> {
        private final ReentrantLock lock = new ReentrantLock();
        // written under lock, read before locking to detect builds that finished while waiting
        private volatile long generation;
        private volatile CacheEntry<V> lastBuilt;
    }
}
