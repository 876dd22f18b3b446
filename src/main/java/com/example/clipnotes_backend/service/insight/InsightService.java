package com.example.clipnotes_backend.service.insight;

import com.example.clipnotes_backend.config.InsightProperties;
import com.example.clipnotes_backend.dto.insight.InsightSnapshot;
import com.example.clipnotes_backend.dto.insight.ShareResponse;
import com.example.clipnotes_backend.model.InsightShare;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.Map;

/**
 * Coordinates aggregation, caching and sharing of insight snapshots.
 */
@Service
public class InsightService {
    private static final Logger LOGGER = LoggerFactory.getLogger(InsightService.class);
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final InsightAggregator aggregator;
    private final SummaryGenerator summaryGenerator;
    private final InsightCache<InsightSnapshot> cache;
    private final InsightShareStore shareStore;
    private final ObjectMapper objectMapper;
    private final InsightProperties properties;

    public InsightService(InsightAggregator aggregator,
                          SummaryGenerator summaryGenerator,
                          InsightCache<InsightSnapshot> cache,
                          @Nullable InsightShareStore shareStore,
                          ObjectMapper objectMapper,
                          InsightProperties properties) {
        this.aggregator = aggregator;
        this.summaryGenerator = summaryGenerator;
        this.cache = cache;
        this.shareStore = shareStore;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public int cacheTtlSeconds() {
        return properties.getCacheTtlSeconds();
    }

    public InsightSnapshot getSnapshot(String window) {
        return getSnapshot(window, false);
    }

    /**
     * Returns the cached snapshot for a window, building it on a miss.
     *
     * @param window     raw window value.
     * @param regenerate drop the cached entry first.
     * @return snapshot annotated with the expiry of the cache entry it came from.
     * @throws InvalidWindowException for unsupported windows.
     */
    public InsightSnapshot getSnapshot(String window, boolean regenerate) {
        return snapshotFor(InsightWindow.validate(window), regenerate);
    }

    public InsightSnapshot regenerateSnapshot(String window) {
        return getSnapshot(window, true);
    }

    public ShareResponse createShare(String window) {
        return createShare(window, null);
    }

    /**
     * Persists the current snapshot behind a new share token.
     *
     * @param window    raw window value.
     * @param expiresAt optional share expiry; defaults to the snapshot's cache expiry.
     * @return token and fully-qualified share URL.
     * @throws ShareUnavailableException when sharing is not configured.
     */
    public ShareResponse createShare(String window, @Nullable Instant expiresAt) {
        InsightShareStore store = requireShareStore();
        InsightWindow insightWindow = InsightWindow.validate(window);
        String origin = shareOrigin();

        InsightSnapshot snapshot = snapshotFor(insightWindow, false);
        String token = store.createShare(insightWindow, toPayload(snapshot),
                expiresAt != null ? expiresAt : snapshot.cacheExpiresAt());

        LOGGER.info("InsightService share created window={} generatedAt={}", insightWindow, snapshot.generatedAt());
        return new ShareResponse(token, origin + "/share/" + token, insightWindow,
                snapshot.generatedAt(), snapshot.cacheExpiresAt());
    }

    /**
     * Returns a live snapshot for a share token, falling back to the persisted payload when the
     * live build fails.
     *
     * @param token  plaintext share token.
     * @param window optional window assertion; must match the window the token was issued for.
     * @return live or last persisted snapshot.
     * @throws ShareTokenNotFoundException when the token is unknown.
     * @throws InvalidWindowException      when {@code window} is invalid or does not match.
     */
    public InsightSnapshot getSharedSnapshot(String token, @Nullable String window) {
        InsightShareStore store = requireShareStore();
        InsightShare share = store.getShare(token);
        InsightWindow boundWindow = share.getWindow();
        if (window != null && InsightWindow.validate(window) != boundWindow) {
            throw new InvalidWindowException(window, "Requested window does not match share token");
        }

        InsightSnapshot snapshot;
        try {
            snapshot = snapshotFor(boundWindow, false);
        } catch (RuntimeException ex) {
            LOGGER.warn("InsightService shared refresh failed window={}, serving persisted payload: {}", boundWindow, ex.getMessage());
            return fromPayload(share.getPayload(), ex);
        }

        try {
            store.updatePayload(token, toPayload(snapshot), snapshot.cacheExpiresAt());
        } catch (RuntimeException ex) {
            LOGGER.warn("InsightService shared payload write-back failed window={}: {}", boundWindow, ex.getMessage());
        }
        return snapshot;
    }

    /**
     * Aggregates and summarises a window. Cache expiry is left unset; it belongs to the cache layer.
     */
    InsightSnapshot buildSnapshot(InsightWindow window) {
        long started = System.nanoTime();
        AggregatedInsights aggregated = aggregator.aggregate(window);
        String summary = summaryGenerator.buildFallback(aggregated);
        LOGGER.info("InsightService built window={} analyses={} highSeverityAnalyses={} tookMs={}",
                window, aggregated.analyses(), aggregated.highSeverityAnalyses(), (System.nanoTime() - started) / 1_000_000);
        return new InsightSnapshot(
                aggregated.window(),
                aggregated.generatedAt(),
                summary,
                InsightSnapshot.SOURCE_FALLBACK,
                aggregated.severityTotals(),
                aggregated.series(),
                aggregated.topLabels(),
                aggregated.delta(),
                null);
    }

    /**
     * Builds the public share link: the configured base URL reduced to its origin plus {@code /share/{token}}.
     */
    String buildShareUrl(String token) {
        return shareOrigin() + "/share/" + token;
    }

    private InsightSnapshot snapshotFor(InsightWindow window, boolean regenerate) {
        if (regenerate) {
            LOGGER.info("InsightService regenerate window={}", window);
            cache.invalidate(window);
        }
        CacheEntry<InsightSnapshot> entry = cache.getOrSet(window, () -> buildSnapshot(window));
        // the cached value stays canonical; callers get an annotated copy
        return entry.value().withCacheExpiresAt(entry.expiresAt());
    }

    private InsightShareStore requireShareStore() {
        if (shareStore == null) {
            throw new ShareUnavailableException("Insight sharing is not configured");
        }
        return shareStore;
    }

    private String shareOrigin() {
        String baseUrl = properties.getShare().getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ShareUnavailableException("Share base URL is not configured");
        }
        String trimmed = baseUrl.strip();
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() != null && uri.getRawAuthority() != null) {
                return uri.getScheme() + "://" + uri.getRawAuthority();
            }
        } catch (URISyntaxException e) {
            LOGGER.debug("InsightService share base URL is not a URI, using as-is: {}", e.getMessage());
        }
        return trimmed.replaceAll("/+$", "");
    }

    private Map<String, Object> toPayload(InsightSnapshot snapshot) {
        return objectMapper.convertValue(snapshot, PAYLOAD_TYPE);
    }

    private InsightSnapshot fromPayload(Map<String, Object> payload, RuntimeException liveFailure) {
        InsightSnapshot persisted;
        try {
            persisted = objectMapper.convertValue(payload, InsightSnapshot.class);
        } catch (IllegalArgumentException parseFailure) {
            liveFailure.addSuppressed(parseFailure);
            throw liveFailure;
        }
        if (persisted == null || persisted.window() == null || persisted.generatedAt() == null
                || persisted.summary() == null || persisted.severityTotals() == null) {
            throw liveFailure;
        }
        return persisted;
    }
}
