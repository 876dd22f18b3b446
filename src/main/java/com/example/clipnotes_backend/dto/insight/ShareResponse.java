package com.example.clipnotes_backend.dto.insight;

import com.example.clipnotes_backend.service.insight.InsightWindow;

import java.time.Instant;

/**
 * Result of a share request. The plaintext token appears only here.
 */
public record ShareResponse(String token,
                            String url,
                            InsightWindow window,
                            Instant generatedAt,
                            Instant cacheExpiresAt) {
}
