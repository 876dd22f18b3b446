package com.example.clipnotes_backend.controller;

import com.example.clipnotes_backend.dto.metrics.MetricsResponse;
import com.example.clipnotes_backend.service.MetricsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/metrics")
public class MetricsController {
    private final MetricsService metricsService;

    public MetricsController(MetricsService metricsService) {
        this.metricsService = metricsService;
    }

    @Operation(summary = "Usage totals, latency and per-hour/per-day activity")
    @ApiResponse(responseCode = "200", description = "Current usage metrics")
    @ApiResponse(responseCode = "400", description = "Window other than 12h, 24h or 7d")
    @GetMapping
    public MetricsResponse metrics(@RequestParam(required = false) String window) {
        return metricsService.getMetrics(window);
    }
}
