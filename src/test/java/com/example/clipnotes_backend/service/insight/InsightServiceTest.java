package com.example.clipnotes_backend.service.insight;

import com.example.clipnotes_backend.config.InsightProperties;
import com.example.clipnotes_backend.dto.insight.InsightSnapshot;
import com.example.clipnotes_backend.dto.insight.ShareResponse;
import com.example.clipnotes_backend.model.InsightShare;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static com.example.clipnotes_backend.service.insight.InMemoryAnalysisRecordSource.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InsightServiceTest {

    private static final Instant NOW = Instant.parse("2025-11-07T12:30:00Z");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private MutableClock clock;
    private InMemoryAnalysisRecordSource source;
    private InsightCache<InsightSnapshot> cache;
    private InsightShareStore shareStore;
    private InsightProperties properties;
    private InsightService service;

    @BeforeEach
    void setup() {
        clock = new MutableClock(NOW);
        source = new InMemoryAnalysisRecordSource();
        properties = new InsightProperties();
        properties.getShare().setBaseUrl("https://clipnotes.example.com/insights");
        cache = new InsightCache<>(properties.getCacheTtlSeconds(), clock);
        shareStore = mock(InsightShareStore.class);
        service = newService(shareStore);
    }

    @Test
    void snapshotIsServedFromCacheWithinTtl() {
        source.add(NOW.minus(Duration.ofHours(1)), event("intrusion", "high"));
        InsightSnapshot first = service.getSnapshot("24h");

        source.add(NOW.minus(Duration.ofMinutes(30)), event("intrusion", "high"));
        clock.advance(Duration.ofSeconds(30));
        InsightSnapshot second = service.getSnapshot("24h");

        assertThat(second.severityTotals()).isEqualTo(first.severityTotals());
        assertThat(second.summary()).isEqualTo(first.summary());
        assertThat(second.generatedAt()).isEqualTo(NOW);
        assertThat(second.cacheExpiresAt()).isEqualTo(NOW.plusSeconds(60));
    }

    @Test
    void regenerateBypassesCache() {
        source.add(NOW.minus(Duration.ofHours(1)), event("intrusion", "high"));
        InsightSnapshot before = service.getSnapshot("24h");

        source.add(NOW.minus(Duration.ofMinutes(30)), event("intrusion", "high"));
        InsightSnapshot after = service.regenerateSnapshot("24h");

        assertThat(after.severityTotals().high()).isEqualTo(before.severityTotals().high() + 1);
        assertThat(service.getSnapshot("24h").severityTotals()).isEqualTo(after.severityTotals());
    }

    @Test
    void snapshotRebuildsAfterTtl() {
        service.getSnapshot("7d");
        source.add(NOW.minus(Duration.ofHours(3)), event("smoke", "medium"));

        clock.advance(Duration.ofSeconds(61));
        InsightSnapshot rebuilt = service.getSnapshot("7d");

        assertThat(rebuilt.severityTotals().medium()).isEqualTo(1);
        assertThat(rebuilt.window()).isEqualTo(InsightWindow.LAST_7_DAYS);
        assertThat(rebuilt.series()).hasSize(7);
    }

    @Test
    void windowIsNormalizedBeforeCaching() {
        InsightSnapshot first = service.getSnapshot("  7D ");
        InsightSnapshot second = service.getSnapshot("7d");

        assertThat(first.window()).isEqualTo(InsightWindow.LAST_7_DAYS);
        assertThat(second).isEqualTo(first);
        assertThat(source.queries()).isEqualTo(2);
    }

    @Test
    void invalidWindowIsRejected() {
        assertThatThrownBy(() -> service.getSnapshot("30d"))
                .isInstanceOf(InvalidWindowException.class);
        assertThat(source.queries()).isZero();
    }

    @Test
    void cachedValueIsNotAnnotatedInPlace() {
        InsightSnapshot served = service.getSnapshot("24h");

        InsightSnapshot stored = cache.get(InsightWindow.LAST_24_HOURS).orElseThrow().value();
        assertThat(stored.cacheExpiresAt()).isNull();
        assertThat(served.cacheExpiresAt()).isEqualTo(NOW.plusSeconds(60));
        assertThat(served.summarySource()).isEqualTo(InsightSnapshot.SOURCE_FALLBACK);
    }

    @Test
    void emptyStoreYieldsNoEventsSummary() {
        InsightSnapshot snapshot = service.getSnapshot("24h");

        assertThat(snapshot.summary()).isEqualTo(SummaryGenerator.NO_EVENTS);
        assertThat(snapshot.delta()).isNull();
        assertThat(snapshot.topLabels()).isEmpty();
    }

    @Test
    void createShareBuildsUrlFromOrigin() {
        source.add(NOW.minus(Duration.ofHours(2)), event("intrusion", "high"));
        when(shareStore.createShare(eq(InsightWindow.LAST_24_HOURS), anyMap(), any())).thenReturn("abc123");

        ShareResponse response = service.createShare("24h");

        assertThat(response.token()).isEqualTo("abc123");
        assertThat(response.url()).isEqualTo("https://clipnotes.example.com/share/abc123");
        assertThat(response.window()).isEqualTo(InsightWindow.LAST_24_HOURS);
        assertThat(response.generatedAt()).isEqualTo(NOW);
        assertThat(response.cacheExpiresAt()).isEqualTo(NOW.plusSeconds(60));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(shareStore).createShare(eq(InsightWindow.LAST_24_HOURS), payload.capture(), eq(NOW.plusSeconds(60)));
        assertThat(payload.getValue()).containsEntry("window", "24h").containsKey("summary").containsKey("series");
    }

    @Test
    void createShareHonoursExplicitExpiry() {
        Instant expiry = NOW.plus(Duration.ofDays(3));
        when(shareStore.createShare(eq(InsightWindow.LAST_7_DAYS), anyMap(), eq(expiry))).thenReturn("tok");

        ShareResponse response = service.createShare("7d", expiry);

        assertThat(response.token()).isEqualTo("tok");
    }

    @Test
    void shareUrlKeepsPortAndDropsTrailingSlash() {
        properties.getShare().setBaseUrl("http://localhost:5173/");
        assertThat(service.buildShareUrl("xyz")).isEqualTo("http://localhost:5173/share/xyz");

        properties.getShare().setBaseUrl("clipnotes.local//");
        assertThat(service.buildShareUrl("xyz")).isEqualTo("clipnotes.local/share/xyz");
    }

    @Test
    void createShareWithoutStoreIsUnavailable() {
        InsightService withoutStore = newService(null);

        assertThatThrownBy(() -> withoutStore.createShare("24h"))
                .isInstanceOf(ShareUnavailableException.class);
        assertThatThrownBy(() -> withoutStore.getSharedSnapshot("abc", null))
                .isInstanceOf(ShareUnavailableException.class);
    }

    @Test
    void createShareWithoutBaseUrlIsUnavailable() {
        properties.getShare().setBaseUrl("  ");

        assertThatThrownBy(() -> service.createShare("24h"))
                .isInstanceOf(ShareUnavailableException.class);
        verify(shareStore, never()).createShare(any(), anyMap(), any());
    }

    @Test
    void sharedSnapshotServesLiveDataAndWritesBack() {
        source.add(NOW.minus(Duration.ofHours(2)), event("intrusion", "high"));
        when(shareStore.getShare("tok")).thenReturn(share(InsightWindow.LAST_24_HOURS, Map.of()));

        InsightSnapshot snapshot = service.getSharedSnapshot("tok", null);

        assertThat(snapshot.severityTotals().high()).isEqualTo(1);
        verify(shareStore).updatePayload(eq("tok"), anyMap(), eq(NOW.plusSeconds(60)));
    }

    @Test
    void sharedSnapshotAcceptsMatchingWindow() {
        when(shareStore.getShare("tok")).thenReturn(share(InsightWindow.LAST_7_DAYS, Map.of()));

        InsightSnapshot snapshot = service.getSharedSnapshot("tok", " 7D ");

        assertThat(snapshot.window()).isEqualTo(InsightWindow.LAST_7_DAYS);
    }

    @Test
    void sharedSnapshotRejectsWindowMismatch() {
        when(shareStore.getShare("tok")).thenReturn(share(InsightWindow.LAST_24_HOURS, Map.of()));

        assertThatThrownBy(() -> service.getSharedSnapshot("tok", "7d"))
                .isInstanceOf(InvalidWindowException.class)
                .satisfies(ex -> assertThat(((InvalidWindowException) ex).getBody().getDetail()).contains("does not match"));
        assertThatThrownBy(() -> service.getSharedSnapshot("tok", "30d"))
                .isInstanceOf(InvalidWindowException.class);
        assertThatThrownBy(() -> service.getSharedSnapshot("tok", "  "))
                .isInstanceOf(InvalidWindowException.class);
        assertThat(source.queries()).isZero();
    }

    @Test
    void unknownShareTokenPropagates() {
        when(shareStore.getShare("nope")).thenThrow(new ShareTokenNotFoundException());

        assertThatThrownBy(() -> service.getSharedSnapshot("nope", null))
                .isInstanceOf(ShareTokenNotFoundException.class);
    }

    @Test
    void sharedSnapshotFallsBackToPersistedPayload() {
        source.add(NOW.minus(Duration.ofHours(2)), event("intrusion", "high"));
        InsightSnapshot persisted = service.buildSnapshot(InsightWindow.LAST_24_HOURS);
        Map<String, Object> payload = objectMapper.convertValue(persisted, MAP_TYPE);
        when(shareStore.getShare("tok")).thenReturn(share(InsightWindow.LAST_24_HOURS, payload));
        source.failWith(new DataAccessResourceFailureException("database unavailable"));

        InsightSnapshot snapshot = service.getSharedSnapshot("tok", "24h");

        assertThat(snapshot.summary()).isEqualTo(persisted.summary());
        assertThat(snapshot.severityTotals()).isEqualTo(persisted.severityTotals());
        assertThat(snapshot.generatedAt()).isEqualTo(NOW);
        assertThat(snapshot.series()).hasSize(24);
        verify(shareStore, never()).updatePayload(any(), anyMap(), any());
    }

    @Test
    void unparseablePayloadRethrowsLiveFailure() {
        when(shareStore.getShare("tok")).thenReturn(share(InsightWindow.LAST_24_HOURS, Map.of("generatedAt", "yesterday")));
        DataAccessResourceFailureException failure = new DataAccessResourceFailureException("database unavailable");
        source.failWith(failure);

        assertThatThrownBy(() -> service.getSharedSnapshot("tok", null)).isSameAs(failure);
        assertThat(failure.getSuppressed()).isNotEmpty();
    }

    @Test
    void incompletePayloadRethrowsLiveFailure() {
        when(shareStore.getShare("tok")).thenReturn(share(InsightWindow.LAST_24_HOURS, Map.of("summary", "partial")));
        DataAccessResourceFailureException failure = new DataAccessResourceFailureException("database unavailable");
        source.failWith(failure);

        assertThatThrownBy(() -> service.getSharedSnapshot("tok", null)).isSameAs(failure);
    }

    @Test
    void writeBackFailureIsIgnored() {
        when(shareStore.getShare("tok")).thenReturn(share(InsightWindow.LAST_24_HOURS, Map.of()));
        doThrow(new DataAccessResourceFailureException("read-only"))
                .when(shareStore).updatePayload(eq("tok"), anyMap(), any());

        InsightSnapshot snapshot = service.getSharedSnapshot("tok", null);

        assertThat(snapshot.window()).isEqualTo(InsightWindow.LAST_24_HOURS);
    }

    private InsightService newService(InsightShareStore store) {
        InsightAggregator aggregator = new InsightAggregator(source, clock);
        return new InsightService(aggregator, new SummaryGenerator(), cache, store, objectMapper, properties);
    }

    private static InsightShare share(InsightWindow window, Map<String, Object> payload) {
        return new InsightShare("hash", window, payload, NOW.minus(Duration.ofDays(1)));
    }
}
