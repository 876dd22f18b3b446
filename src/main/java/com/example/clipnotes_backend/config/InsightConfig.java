package com.example.clipnotes_backend.config;

import com.example.clipnotes_backend.dto.insight.InsightSnapshot;
import com.example.clipnotes_backend.repository.InsightShareRepository;
import com.example.clipnotes_backend.service.insight.InsightCache;
import com.example.clipnotes_backend.service.insight.InsightShareStore;
import com.example.clipnotes_backend.service.insight.JpaInsightShareStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Builds the process-scoped snapshot cache and, unless disabled, the share store used by
 * {@link com.example.clipnotes_backend.service.insight.InsightService}.
 */
@Configuration
public class InsightConfig {

    @Bean
    public InsightCache<InsightSnapshot> insightSnapshotCache(InsightProperties properties, Clock clock) {
        return new InsightCache<>(properties.getCacheTtlSeconds(), clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "insights.share", name = "enabled", havingValue = "true", matchIfMissing = true)
    public InsightShareStore insightShareStore(InsightShareRepository shareRepository, InsightProperties properties, Clock clock) {
        return new JpaInsightShareStore(shareRepository, properties.getShare().getTokenSalt(), clock);
    }
}
