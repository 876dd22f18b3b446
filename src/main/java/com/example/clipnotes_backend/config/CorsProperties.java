package com.example.clipnotes_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "clipnotes.cors")
public class CorsProperties {
    private List<String> allowedOriginPatterns = new ArrayList<>(List.of("http://localhost:*"));

    public List<String> getAllowedOriginPatterns() { return allowedOriginPatterns; }
    public void setAllowedOriginPatterns(List<String> allowedOriginPatterns) { this.allowedOriginPatterns = allowedOriginPatterns; }
}
