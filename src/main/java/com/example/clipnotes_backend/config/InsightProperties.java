package com.example.clipnotes_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configures snapshot caching and share-link issuance for the insight endpoints.
 */
@ConfigurationProperties(prefix = "insights")
public class InsightProperties {

    private int cacheTtlSeconds = 60;
    private Share share = new Share();

    public int getCacheTtlSeconds() {
        return cacheTtlSeconds;
    }

    public void setCacheTtlSeconds(int cacheTtlSeconds) {
        this.cacheTtlSeconds = cacheTtlSeconds;
    }

    public Share getShare() {
        return share;
    }

    public void setShare(Share share) {
        this.share = share;
    }

    public static class Share {
        private boolean enabled = true;
        private String tokenSalt;
        private String baseUrl = "http://localhost:5173";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getTokenSalt() {
            return tokenSalt;
        }

        public void setTokenSalt(String tokenSalt) {
            this.tokenSalt = tokenSalt;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }
}
