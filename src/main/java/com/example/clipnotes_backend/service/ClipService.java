package com.example.clipnotes_backend.service;

import com.example.clipnotes_backend.dto.web.AnalysisResponse;
import com.example.clipnotes_backend.dto.web.AnalysisSaveRequest;
import com.example.clipnotes_backend.dto.web.MomentDTO;
import com.example.clipnotes_backend.model.AnalysisResult;
import com.example.clipnotes_backend.model.Clip;
import com.example.clipnotes_backend.repository.AnalysisResultRepository;
import com.example.clipnotes_backend.repository.ClipRepository;
import com.example.clipnotes_backend.util.ClipStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Registers clips and stores their analyses; the analyses feed the insight aggregator.
 */
@Service
public class ClipService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ClipService.class);
    static final int MAX_LIST_LIMIT = 100;

    private final ClipRepository clipRepository;
    private final AnalysisResultRepository analysisResultRepository;
    private final Clock clock;

    public ClipService(ClipRepository clipRepository, AnalysisResultRepository analysisResultRepository, Clock clock) {
        this.clipRepository = clipRepository;
        this.analysisResultRepository = analysisResultRepository;
        this.clock = clock;
    }

    @Transactional
    public Clip register(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "FILENAME_REQUIRED");
        }
        Clip clip = clipRepository.save(new Clip(filename.strip()));
        LOGGER.info("ClipService register clip={} filename={}", clip.getId(), clip.getFilename());
        return clip;
    }

    /**
     * Lists the most recently registered clips.
     *
     * @param limit requested size, clamped to 1..100.
     * @return clips, newest first.
     */
    @Transactional(readOnly = true)
    public List<Clip> listRecent(int limit) {
        int size = Math.max(1, Math.min(MAX_LIST_LIMIT, limit));
        return clipRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, size));
    }

    @Transactional(readOnly = true)
    public Clip get(UUID clipId) {
        return clipRepository.findById(clipId).orElseThrow(() -> new ClipNotFoundException(clipId));
    }

    /**
     * Stores an analysis for the clip and marks the clip ready, or failed when the run reported an error.
     *
     * @param clipId  clip identifier.
     * @param request analysis payload.
     * @return stored analysis.
     */
    @Transactional
    public AnalysisResponse saveAnalysis(UUID clipId, AnalysisSaveRequest request) {
        Clip clip = get(clipId);
        List<MomentDTO> moments = request.moments() == null ? List.of() : request.moments();
        for (MomentDTO moment : moments) {
            if (moment.endS() < moment.startS()) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "MOMENT_RANGE_INVALID");
            }
        }

        Instant now = clock.instant();
        AnalysisResult result = new AnalysisResult(clip, now);
        result.setSummary(request.summary());
        result.setMoments(moments.stream().map(ClipService::toJson).toList());
        result.setPrompt(request.prompt());
        result.setLatencyMs(request.latencyMs());
        result.setErrorCode(blankToNull(request.errorCode()));
        result.setErrorMessage(blankToNull(request.errorMessage()));
        analysisResultRepository.save(result);

        boolean failed = result.getErrorCode() != null || result.getErrorMessage() != null;
        clip.setStatus(failed ? ClipStatus.FAILED : ClipStatus.READY);
        clip.setLastAnalysisAt(now);
        clip.setLatencyMs(request.latencyMs());
        clipRepository.save(clip);

        if (failed) {
            LOGGER.warn("ClipService analysis failed clip={} errorCode={}", clipId, result.getErrorCode());
        } else {
            LOGGER.info("ClipService analysis saved clip={} moments={} latencyMs={}", clipId, moments.size(), request.latencyMs());
        }
        return toResponse(result);
    }

    @Transactional(readOnly = true)
    public Optional<AnalysisResponse> latestAnalysis(UUID clipId) {
        Clip clip = get(clipId);
        return analysisResultRepository.findFirstByClipOrderByCreatedAtDesc(clip).map(ClipService::toResponse);
    }

    private static Map<String, Object> toJson(MomentDTO moment) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("startS", moment.startS());
        json.put("endS", moment.endS());
        json.put("label", moment.label().strip());
        json.put("severity", moment.severity());
        return json;
    }

    private static AnalysisResponse toResponse(AnalysisResult result) {
        List<MomentDTO> moments = result.getMoments() == null ? List.of() : result.getMoments().stream()
                .map(m -> new MomentDTO(asDouble(m.get("startS")), asDouble(m.get("endS")),
                        Objects.toString(m.get("label"), null), Objects.toString(m.get("severity"), null)))
                .toList();
        return new AnalysisResponse(result.getId(), result.getClip().getId(), result.getSummary(), moments,
                result.getPrompt(), result.getLatencyMs(), result.getErrorCode(), result.getErrorMessage(),
                result.getCreatedAt());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }

    private static Double asDouble(Object value) {
        return value instanceof Number number ? number.doubleValue() : null;
    }
}
