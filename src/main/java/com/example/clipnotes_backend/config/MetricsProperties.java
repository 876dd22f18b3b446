package com.example.clipnotes_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configures the usage metrics endpoint and the API request counter.
 */
@ConfigurationProperties(prefix = "clipnotes.metrics")
public class MetricsProperties {

    private boolean requestCounting = true;
    private long latencyWarningThresholdMs = 5000;
    private int hourlyWindow = 12;
    private int dailyWindow = 7;

    public boolean isRequestCounting() {
        return requestCounting;
    }

    public void setRequestCounting(boolean requestCounting) {
        this.requestCounting = requestCounting;
    }

    public long getLatencyWarningThresholdMs() {
        return latencyWarningThresholdMs;
    }

    public void setLatencyWarningThresholdMs(long latencyWarningThresholdMs) {
        this.latencyWarningThresholdMs = latencyWarningThresholdMs;
    }

    /**
     * Returns how many hourly buckets, ending with the current hour, the breakdown covers.
     */
    public int getHourlyWindow() {
        return hourlyWindow;
    }

    public void setHourlyWindow(int hourlyWindow) {
        this.hourlyWindow = hourlyWindow;
    }

    public int getDailyWindow() {
        return dailyWindow;
    }

    public void setDailyWindow(int dailyWindow) {
        this.dailyWindow = dailyWindow;
    }
}
