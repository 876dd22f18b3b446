package com.example.clipnotes_backend.service.insight;

import com.example.clipnotes_backend.dto.insight.InsightDelta;
import com.example.clipnotes_backend.dto.insight.SeverityTotals;
import com.example.clipnotes_backend.dto.insight.TopLabel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Produces deterministic narrative summaries from aggregated statistics without calling a model.
 */
@Component
public class SummaryGenerator {
    static final String NO_EVENTS = "No significant events were detected in the selected window.";
    private static final int MAX_NAMED_LABELS = 3;

    public String buildFallback(AggregatedInsights aggregated) {
        SeverityTotals totals = aggregated.severityTotals();
        int totalEvents = totals.total();
        if (totalEvents == 0) {
            return NO_EVENTS;
        }

        List<String> parts = new ArrayList<>();
        parts.add(totalEvents + " notable moments were recorded over " + aggregated.window().phrase() + ".");

        if (totals.high() > 0) {
            parts.add("High-severity events occurred " + totals.high() + " time(s), alongside "
                    + totals.medium() + " medium and " + totals.low() + " low severity occurrences.");
        } else {
            parts.add("Most activity remained low impact (" + totals.low() + " low, "
                    + totals.medium() + " medium severity).");
        }

        parts.add(formatTopLabels(aggregated.topLabels()));
        parts.add(formatDelta(aggregated.delta()));

        return String.join(" ", parts.stream().map(String::strip).filter(part -> !part.isEmpty()).toList());
    }

    private static String formatTopLabels(List<TopLabel> topLabels) {
        List<String> names = topLabels.stream().limit(MAX_NAMED_LABELS).map(TopLabel::label).toList();
        if (names.isEmpty()) {
            return "";
        }
        if (names.size() == 1) {
            return "Dominant activity: " + names.get(0) + ".";
        }
        String head = String.join(", ", names.subList(0, names.size() - 1));
        return "Dominant activity: " + head + ", and " + names.get(names.size() - 1) + ".";
    }

    private static String formatDelta(InsightDelta delta) {
        if (delta == null) {
            return "";
        }
        List<String> parts = new ArrayList<>(2);
        if (delta.analyses() != 0) {
            String trend = delta.analyses() > 0 ? "increased" : "decreased";
            parts.add("Total analyses " + trend + " by " + Math.abs(delta.analyses()) + " compared to the prior window.");
        }
        if (delta.highSeverity() != 0) {
            String trend = delta.highSeverity() > 0 ? "rose" : "fell";
            parts.add("High-severity incidents " + trend + " by " + Math.abs(delta.highSeverity()) + ".");
        }
        return String.join(" ", parts);
    }
}
