package com.example.clipnotes_backend.config;

import com.example.clipnotes_backend.service.RequestCountService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Counts every {@code /v1} API call towards today's request total. Preflight requests are not counted.
 */
public class RequestCounterFilter extends OncePerRequestFilter {
    private static final Logger LOGGER = LoggerFactory.getLogger(RequestCounterFilter.class);
    static final String API_PREFIX = "/v1";

    private final RequestCountService requestCountService;

    public RequestCounterFilter(RequestCountService requestCountService) {
        this.requestCountService = requestCountService;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !(path.equals(API_PREFIX) || path.startsWith(API_PREFIX + "/"));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        try {
            filterChain.doFilter(request, response);
        } finally {
            try {
                requestCountService.recordRequest();
            } catch (RuntimeException e) {
                LOGGER.warn("RequestCounterFilter count failed path={} error={}", request.getRequestURI(), e.toString());
            }
        }
    }
}
