package com.example.clipnotes_backend.service;

import com.example.clipnotes_backend.model.RequestCount;
import com.example.clipnotes_backend.repository.RequestCountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Keeps one request counter row per UTC day.
 */
@Service
public class RequestCountService {
    private static final Logger LOGGER = LoggerFactory.getLogger(RequestCountService.class);

    private final RequestCountRepository repository;
    private final Clock clock;

    public RequestCountService(RequestCountRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Counts one request against today's row, creating the row on the first request of the day.
     */
    public void recordRequest() {
        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        if (repository.increment(today, now) > 0) {
            return;
        }
        try {
            repository.saveAndFlush(new RequestCount(today, 1, now));
            LOGGER.debug("RequestCountService day opened date={}", today);
        } catch (DataIntegrityViolationException e) {
            // a concurrent request created the row first
            repository.increment(today, now);
        }
    }

    public long requestsOn(LocalDate day) {
        return repository.findById(day).map(RequestCount::getRequests).orElse(0L);
    }
}
