package com.example.clipnotes_backend.service.insight;

import com.example.clipnotes_backend.model.AnalysisResult;
import com.example.clipnotes_backend.repository.AnalysisResultRepository;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads analysis records from the {@code analysis_result} table.
 */
@Component
public class JpaAnalysisRecordSource implements AnalysisRecordSource {
    private final AnalysisResultRepository analysisResultRepository;

    public JpaAnalysisRecordSource(AnalysisResultRepository analysisResultRepository) {
        this.analysisResultRepository = analysisResultRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<AnalysisRecord> findCreatedBetween(Instant since, @Nullable Instant until) {
        List<AnalysisResult> rows = until == null
                ? analysisResultRepository.findByCreatedAtGreaterThanEqualOrderByCreatedAtAsc(since)
                : analysisResultRepository.findByCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByCreatedAtAsc(since, until);
        return rows.stream().map(JpaAnalysisRecordSource::toRecord).toList();
    }

    private static AnalysisRecord toRecord(AnalysisResult row) {
        List<Map<String, Object>> moments = row.getMoments() == null ? List.of() : row.getMoments();
        List<AnalysisEvent> events = moments.stream()
                .filter(Objects::nonNull)
                .map(moment -> new AnalysisEvent(asString(moment.get("label")), asString(moment.get("severity"))))
                .toList();
        return new AnalysisRecord(row.getClip().getId(), row.getCreatedAt(), events);
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
