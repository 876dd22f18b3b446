package com.example.clipnotes_backend.controller;

import com.example.clipnotes_backend.dto.insight.InsightSnapshot;
import com.example.clipnotes_backend.dto.insight.InsightWindowRequest;
import com.example.clipnotes_backend.dto.insight.ShareResponse;
import com.example.clipnotes_backend.service.insight.InsightService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

/**
 * Insight snapshots and read-only share links.
 */
@RestController
@RequestMapping("/v1/insights")
public class InsightController {
    private static final String DEFAULT_WINDOW = "24h";

    private final InsightService insightService;

    public InsightController(InsightService insightService) {
        this.insightService = insightService;
    }

    /**
     * Returns the snapshot for a window.
     *
     * @param window {@code 24h} or {@code 7d}; {@code 24h} when absent.
     * @return cached or freshly built snapshot.
     */
    @Operation(summary = "Aggregated severity statistics and narrative summary for a window")
    @ApiResponse(responseCode = "200", description = "Cached or freshly built snapshot")
    @ApiResponse(responseCode = "400", description = "Unsupported window")
    @GetMapping
    public ResponseEntity<InsightSnapshot> snapshot(@RequestParam(required = false) String window) {
        // only an absent parameter defaults; an empty one is validated and rejected
        return cached(insightService.getSnapshot(window != null ? window : DEFAULT_WINDOW));
    }

    @Operation(summary = "Drop the cached snapshot for a window and rebuild it")
    @PostMapping("/regenerate")
    public ResponseEntity<InsightSnapshot> regenerate(@RequestBody(required = false) InsightWindowRequest body) {
        String window = body != null ? body.windowOrDefault() : DEFAULT_WINDOW;
        return cached(insightService.regenerateSnapshot(window));
    }

    @Operation(summary = "Issue a read-only share link for a window")
    @ApiResponse(responseCode = "200", description = "Share token and public URL")
    @ApiResponse(responseCode = "503", description = "Sharing is disabled or not configured")
    @PostMapping("/share")
    public ShareResponse share(@RequestBody(required = false) InsightWindowRequest body) {
        String window = body != null ? body.windowOrDefault() : DEFAULT_WINDOW;
        return insightService.createShare(window);
    }

    /**
     * Resolves a share token to its snapshot.
     *
     * @param token  plaintext share token.
     * @param window optional assertion of the token's window.
     * @return live snapshot, or the last persisted one when the live build fails.
     */
    @ApiResponse(responseCode = "404", description = "Unknown share token")
    @GetMapping("/share/{token}")
    public ResponseEntity<InsightSnapshot> shared(@PathVariable String token,
                                                  @RequestParam(required = false) String window) {
        return cached(insightService.getSharedSnapshot(token, window));
    }

    private ResponseEntity<InsightSnapshot> cached(InsightSnapshot snapshot) {
        int ttl = insightService.cacheTtlSeconds();
        CacheControl cacheControl = ttl <= 0
                ? CacheControl.noStore()
                : CacheControl.maxAge(Duration.ofSeconds(ttl)).cachePublic();
        return ResponseEntity.ok().cacheControl(cacheControl).body(snapshot);
    }
}
