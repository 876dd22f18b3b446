package com.example.clipnotes_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties({InsightProperties.class, CorsProperties.class, MetricsProperties.class})
public class AppPropertiesConfig {
}
