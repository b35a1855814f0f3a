package com.prediction.market.exchange.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prediction.market.exchange.ratelimit.AccountRateLimiter;
import com.prediction.market.exchange.ratelimit.RateLimitFilter;

/**
 * API rate limiting, on unless {@code exchange.rate-limit.enabled=false}.
 */
@Configuration
@ConditionalOnProperty(prefix = "exchange.rate-limit", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RateLimitConfig {

    @Bean
    public AccountRateLimiter accountRateLimiter(ExchangeProperties properties) {
        ExchangeProperties.RateLimit limit = properties.getRateLimit();
        return new AccountRateLimiter(limit.getLimitForPeriod(), limit.getRefreshPeriod());
    }

    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilter(AccountRateLimiter accountRateLimiter,
            ExchangeProperties properties, ObjectMapper objectMapper) {
        FilterRegistrationBean<RateLimitFilter> registration = new FilterRegistrationBean<>(
            new RateLimitFilter(accountRateLimiter, properties.getRateLimit().getExemptedPaths(), objectMapper));
        registration.addUrlPatterns("/api/*");
        return registration;
    }
}
