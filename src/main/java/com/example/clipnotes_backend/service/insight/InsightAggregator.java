package com.example.clipnotes_backend.service.insight;

import com.example.clipnotes_backend.dto.insight.InsightDelta;
import com.example.clipnotes_backend.dto.insight.SeriesBucket;
import com.example.clipnotes_backend.dto.insight.SeverityTotals;
import com.example.clipnotes_backend.dto.insight.TopLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Buckets stored analyses into severity statistics for a window and compares them with the
 * preceding window of equal length.
 */
@Service
public class InsightAggregator {
    private static final Logger LOGGER = LoggerFactory.getLogger(InsightAggregator.class);
    private static final int TOP_LABEL_LIMIT = 5;
    private static final int MAX_LABEL_LENGTH = 80;
    private static final String UNKNOWN_LABEL = "unknown";

    private final AnalysisRecordSource recordSource;
    private final Clock clock;

    public InsightAggregator(AnalysisRecordSource recordSource, Clock clock) {
        this.recordSource = recordSource;
        this.clock = clock;
    }

    /**
     * Aggregates the window ending at the current clock instant.
     *
     * @param window validated window.
     * @return fresh statistics.
     */
    public AggregatedInsights aggregate(InsightWindow window) {
        return aggregate(window, clock.instant());
    }

    /**
     * Aggregates the window ending at {@code now}.
     *
     * @param window validated window.
     * @param now    reference instant; determines the bucket edges.
     * @return fresh statistics.
     */
    public AggregatedInsights aggregate(InsightWindow window, Instant now) {
        List<Instant> edges = window.bucketEdges(now);
        Instant firstEdge = edges.get(0);

        List<AnalysisRecord> current = recordSource.findCreatedBetween(firstEdge, null);
        List<AnalysisRecord> previous = recordSource.findCreatedBetween(firstEdge.minus(window.duration()), firstEdge);

        Map<Instant, BucketTally> buckets = new LinkedHashMap<>();
        for (Instant edge : edges) {
            buckets.put(edge, new BucketTally());
        }
        SeverityTally totals = new SeverityTally();
        Map<String, LabelTally> labels = new HashMap<>();
        int analyses = 0;
        int highAnalyses = 0;

        for (AnalysisRecord record : current) {
            Instant createdAt = record.createdAt();
            if (createdAt.isBefore(firstEdge) || createdAt.isAfter(now)) {
                continue;
            }
            analyses++;
            // null when the truncated timestamp is not one of the edges; still counted above
            BucketTally bucket = buckets.get(window.truncate(createdAt));

            boolean sawHigh = false;
            for (AnalysisEvent event : record.events()) {
                Optional<Severity> normalized = Severity.normalize(event.severity());
                if (normalized.isEmpty()) {
                    continue;
                }
                Severity severity = normalized.get();
                totals.add(severity);
                if (bucket != null) {
                    bucket.severity.add(severity);
                }
                String label = sanitizeLabel(event.label());
                labels.computeIfAbsent(label.toLowerCase(Locale.ROOT), key -> new LabelTally(label)).add(severity);
                sawHigh |= severity == Severity.HIGH;
            }
            if (sawHigh) {
                highAnalyses++;
            }
            if (bucket != null) {
                bucket.total++;
            }
        }

        List<SeriesBucket> series = new ArrayList<>(buckets.size());
        buckets.forEach((edge, tally) -> series.add(new SeriesBucket(edge, tally.total, tally.severity.toTotals())));

        int previousAnalyses = previous.size();
        int previousHigh = countHighSeverity(previous);
        InsightDelta delta = null;
        if (analyses > 0 || previousAnalyses > 0) {
            delta = new InsightDelta(analyses - previousAnalyses, highAnalyses - previousHigh);
        }

        SeverityTotals severityTotals = totals.toTotals();
        LOGGER.info("InsightAggregator aggregate window={} analyses={} events={} previousAnalyses={}",
                window, analyses, severityTotals.total(), previousAnalyses);
        return new AggregatedInsights(window, now, severityTotals, series, topLabels(labels),
                analyses, highAnalyses, delta);
    }

    private static List<TopLabel> topLabels(Map<String, LabelTally> labels) {
        return labels.values().stream()
                .sorted(Comparator.comparingInt((LabelTally tally) -> tally.count).reversed()
                        .thenComparing(tally -> tally.label))
                .limit(TOP_LABEL_LIMIT)
                .map(tally -> new TopLabel(tally.label, tally.count,
                        tally.count > 0 ? tally.weight / (double) tally.count : null))
                .toList();
    }

    private static int countHighSeverity(List<AnalysisRecord> records) {
        int total = 0;
        for (AnalysisRecord record : records) {
            boolean high = record.events().stream()
                    .anyMatch(event -> Severity.normalize(event.severity()).orElse(null) == Severity.HIGH);
            if (high) {
                total++;
            }
        }
        return total;
    }

    static String sanitizeLabel(String raw) {
        String value = raw == null ? "" : raw.strip();
        if (value.isEmpty()) {
            value = UNKNOWN_LABEL;
        }
        String normalized = titleCase(value);
        if (normalized.length() <= MAX_LABEL_LENGTH) {
            return normalized;
        }
        return normalized.substring(0, MAX_LABEL_LENGTH).stripTrailing();
    }

    /**
     * Upper-cases the first letter of every run of letters and lower-cases the rest.
     */
    static String titleCase(String value) {
        StringBuilder builder = new StringBuilder(value.length());
        boolean previousLetter = false;
        int i = 0;
        while (i < value.length()) {
            int cp = value.codePointAt(i);
            if (Character.isLetter(cp)) {
                builder.appendCodePoint(previousLetter ? Character.toLowerCase(cp) : Character.toTitleCase(cp));
                previousLetter = true;
            } else {
                builder.appendCodePoint(cp);
                previousLetter = false;
            }
            i += Character.charCount(cp);
        }
        return builder.toString();
    }

    private static final class SeverityTally {
        private int low;
        private int medium;
        private int high;

        void add(Severity severity) {
            switch (severity) {
                case LOW -> low++;
                case MEDIUM -> medium++;
                case HIGH -> high++;
            }
        }

        SeverityTotals toTotals() {
            return new SeverityTotals(low, medium, high);
        }
    }

    private static final class BucketTally {
        private final SeverityTally severity = new SeverityTally();
        private int total;
    }

    private static final class LabelTally {
        private final String label;
        private int count;
        private double weight;

        LabelTally(String label) {
            this.label = label;
        }

        void add(Severity severity) {
            count++;
            weight += severity.weight();
        }
    }
}
