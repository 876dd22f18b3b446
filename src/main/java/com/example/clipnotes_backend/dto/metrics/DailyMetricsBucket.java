package com.example.clipnotes_backend.dto.metrics;

import java.time.LocalDate;

public record DailyMetricsBucket(LocalDate date, long requests, int analyses) {
}
