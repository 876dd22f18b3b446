package com.example.clipnotes_backend.config;

import com.example.clipnotes_backend.service.insight.InsightShareStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator insightShareHealth(ObjectProvider<InsightShareStore> shareStore, InsightProperties properties) {
        return () -> {
            String baseUrl = properties.getShare().getBaseUrl();
            boolean configured = shareStore.getIfAvailable() != null && baseUrl != null && !baseUrl.isBlank();
            // disabled sharing is reported, never DOWN
            return Health.up()
                    .withDetail("share", configured ? "configured" : "disabled")
                    .withDetail("cacheTtlSeconds", properties.getCacheTtlSeconds())
                    .build();
        };
    }
}
