package com.example.clipnotes_backend.controller;

import com.example.clipnotes_backend.dto.web.AnalysisResponse;
import com.example.clipnotes_backend.dto.web.AnalysisSaveRequest;
import com.example.clipnotes_backend.dto.web.ClipCreateRequest;
import com.example.clipnotes_backend.dto.web.ClipResponse;
import com.example.clipnotes_backend.service.ClipService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * Clip registration and analysis storage.
 */
@RestController
@RequestMapping("/v1/clips")
public class ClipController {
    private final ClipService clipService;

    public ClipController(ClipService clipService) {
        this.clipService = clipService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ClipResponse register(@Valid @RequestBody ClipCreateRequest request) {
        return ClipResponse.from(clipService.register(request.filename()));
    }

    @GetMapping
    public List<ClipResponse> list(@RequestParam(defaultValue = "25") int limit) {
        return clipService.listRecent(limit).stream().map(ClipResponse::from).toList();
    }

    @GetMapping("/{clipId}")
    public ClipResponse get(@PathVariable UUID clipId) {
        return ClipResponse.from(clipService.get(clipId));
    }

    @PostMapping("/{clipId}/analysis")
    @ResponseStatus(HttpStatus.CREATED)
    public AnalysisResponse saveAnalysis(@PathVariable UUID clipId, @Valid @RequestBody AnalysisSaveRequest request) {
        return clipService.saveAnalysis(clipId, request);
    }

    @GetMapping("/{clipId}/analysis")
    public AnalysisResponse latestAnalysis(@PathVariable UUID clipId) {
        return clipService.latestAnalysis(clipId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "ANALYSIS_NOT_FOUND"));
    }
}
