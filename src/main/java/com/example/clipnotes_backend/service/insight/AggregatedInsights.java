package com.example.clipnotes_backend.service.insight;

import com.example.clipnotes_backend.dto.insight.InsightDelta;
import com.example.clipnotes_backend.dto.insight.SeriesBucket;
import com.example.clipnotes_backend.dto.insight.SeverityTotals;
import com.example.clipnotes_backend.dto.insight.TopLabel;

import java.time.Instant;
import java.util.List;

/**
 * Statistics for one window, built fresh on every cache miss and never persisted.
 */
public record AggregatedInsights(InsightWindow window,
                                 Instant generatedAt,
                                 SeverityTotals severityTotals,
                                 List<SeriesBucket> series,
                                 List<TopLabel> topLabels,
                                 int analyses,
                                 int highSeverityAnalyses,
                                 InsightDelta delta) {
    public AggregatedInsights {
        series = List.copyOf(series);
        topLabels = List.copyOf(topLabels);
    }
}
