package com.example.clipnotes_backend.config;

import com.example.clipnotes_backend.service.RequestCountService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    @ConditionalOnProperty(prefix = "clipnotes.metrics", name = "request-counting", havingValue = "true", matchIfMissing = true)
    public FilterRegistrationBean<RequestCounterFilter> requestCounterFilter(RequestCountService requestCountService) {
        FilterRegistrationBean<RequestCounterFilter> registration =
                new FilterRegistrationBean<>(new RequestCounterFilter(requestCountService));
        registration.addUrlPatterns("/v1/*");
        registration.setName("requestCounterFilter");
        return registration;
    }
}
