package com.nevis.dataroom.config;

import com.nevis.dataroom.infra.InMemoryRpmRateLimiter;
import com.nevis.dataroom.infra.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("chatLimiter")
    public RateLimiter chatLimiter(SummaryProperties summaryProperties) {
        return new InMemoryRpmRateLimiter(summaryProperties.requestsPerMinute());
    }
}
