package com.example.clipnotes_backend.service;

import com.example.clipnotes_backend.config.MetricsProperties;
import com.example.clipnotes_backend.dto.metrics.DailyMetricsBucket;
import com.example.clipnotes_backend.dto.metrics.HourlyMetricsBucket;
import com.example.clipnotes_backend.dto.metrics.MetricsResponse;
import com.example.clipnotes_backend.model.RequestCount;
import com.example.clipnotes_backend.repository.AnalysisResultRepository;
import com.example.clipnotes_backend.repository.ClipRepository;
import com.example.clipnotes_backend.repository.RequestCountRepository;
import com.example.clipnotes_backend.service.insight.InvalidWindowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Aggregates clip, analysis and request usage for the dashboard. All day and hour boundaries are UTC.
 */
@Service
public class MetricsService {
    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsService.class);
    private static final String WINDOW_DETAIL = "Invalid window parameter; expected '12h', '24h', or '7d'.";

    private final ClipRepository clipRepository;
    private final AnalysisResultRepository analysisResultRepository;
    private final RequestCountRepository requestCountRepository;
    private final MetricsProperties properties;
    private final Clock clock;

    public MetricsService(ClipRepository clipRepository,
                          AnalysisResultRepository analysisResultRepository,
                          RequestCountRepository requestCountRepository,
                          MetricsProperties properties,
                          Clock clock) {
        this.clipRepository = clipRepository;
        this.analysisResultRepository = analysisResultRepository;
        this.requestCountRepository = requestCountRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Builds the usage metrics.
     *
     * @param window lookback for the average latency: {@code 12h}, {@code 24h} or {@code 7d}; {@code 24h} when null.
     * @return current metrics.
     * @throws InvalidWindowException for any other window value.
     */
    @Transactional(readOnly = true)
    public MetricsResponse getMetrics(String window) {
        Duration lookback = resolveWindow(window);
        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);

        long totalClips = clipRepository.count();
        long totalAnalyses = analysisResultRepository.count();
        Double average = analysisResultRepository.averageLatencySince(now.minus(lookback));
        double avgLatencyMs = average != null ? average : 0.0;
        Double errorRate = totalAnalyses == 0 ? null : (double) analysisResultRepository.countFailed() / totalAnalyses;

        LocalDate startDay = today.minusDays(Math.max(1, properties.getDailyWindow()) - 1L);
        Instant startHour = now.minus(Duration.ofHours(Math.max(1, properties.getHourlyWindow()) - 1L))
                .truncatedTo(ChronoUnit.HOURS);
        Instant dayStart = startDay.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant since = dayStart.isBefore(startHour) ? dayStart : startHour;
        List<Instant> created = analysisResultRepository.findCreatedAtSince(since);

        List<DailyMetricsBucket> perDay = dailyBuckets(startDay, today, dayStart, created);
        List<HourlyMetricsBucket> perHour = hourlyBuckets(startHour, now, created);
        long requestsToday = requestCountRepository.findById(today).map(RequestCount::getRequests).orElse(0L);
        int clipsToday = perDay.stream()
                .filter(bucket -> bucket.date().equals(today))
                .mapToInt(DailyMetricsBucket::analyses)
                .sum();
        boolean latencyFlag = avgLatencyMs > 0.0 && avgLatencyMs >= properties.getLatencyWarningThresholdMs();

        if (latencyFlag) {
            LOGGER.warn("MetricsService latency above threshold avgLatencyMs={} thresholdMs={}",
                    avgLatencyMs, properties.getLatencyWarningThresholdMs());
        }
        LOGGER.debug("MetricsService metrics built clips={} analyses={} requestsToday={}", totalClips, totalAnalyses, requestsToday);
        return new MetricsResponse(now, totalClips, totalAnalyses, avgLatencyMs, requestsToday, clipsToday,
                perHour, perDay, latencyFlag, errorRate);
    }

    static Duration resolveWindow(String window) {
        if (window == null) {
            return Duration.ofHours(24);
        }
        switch (window) {
            case "12h":
                return Duration.ofHours(12);
            case "24h":
                return Duration.ofHours(24);
            case "7d":
                return Duration.ofDays(7);
            default:
                throw new InvalidWindowException(window, WINDOW_DETAIL);
        }
    }

    private List<DailyMetricsBucket> dailyBuckets(LocalDate startDay, LocalDate today, Instant dayStart, List<Instant> created) {
        Map<LocalDate, Long> requests = new HashMap<>();
        for (RequestCount row : requestCountRepository.findByRequestDateGreaterThanEqual(startDay)) {
            requests.put(row.getRequestDate(), row.getRequests());
        }
        Map<LocalDate, Integer> analyses = new HashMap<>();
        for (Instant createdAt : created) {
            if (!createdAt.isBefore(dayStart)) {
                analyses.merge(LocalDate.ofInstant(createdAt, ZoneOffset.UTC), 1, Integer::sum);
            }
        }

        TreeSet<LocalDate> days = new TreeSet<>();
        requests.forEach((day, count) -> {
            if (count > 0) {
                days.add(day);
            }
        });
        days.addAll(analyses.keySet());

        List<DailyMetricsBucket> buckets = new ArrayList<>();
        for (LocalDate day : days) {
            if (day.isBefore(startDay) || day.isAfter(today)) {
                continue;
            }
            buckets.add(new DailyMetricsBucket(day, requests.getOrDefault(day, 0L), analyses.getOrDefault(day, 0)));
        }
        return buckets;
    }

    private List<HourlyMetricsBucket> hourlyBuckets(Instant startHour, Instant now, List<Instant> created) {
        Map<Instant, Integer> counts = new HashMap<>();
        for (Instant createdAt : created) {
            if (!createdAt.isBefore(startHour)) {
                counts.merge(createdAt.truncatedTo(ChronoUnit.HOURS), 1, Integer::sum);
            }
        }

        List<HourlyMetricsBucket> buckets = new ArrayList<>();
        for (int offset = 0; offset < Math.max(1, properties.getHourlyWindow()); offset++) {
            Instant bucketStart = startHour.plus(Duration.ofHours(offset));
            if (bucketStart.isAfter(now)) {
                break;
            }
            int count = counts.getOrDefault(bucketStart, 0);
            if (count > 0) {
                buckets.add(new HourlyMetricsBucket(bucketStart, count));
            }
        }
        return buckets;
    }
}
