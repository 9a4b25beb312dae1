/**
 * Configuration for upstream source rate limiters
 * - Keeps the per-store fan-out within provider quotas
 * - A call that finds no permit fails fast and counts as a rate-limited source call
 */
package net.findmyaisle.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class AppRateLimiterConfig {
    private static final Logger logger = LoggerFactory.getLogger(AppRateLimiterConfig.class);

    /**
     * Rate limiter for the Sonar answer API
     * - Waits up to one refresh period for a permit so a full fan-out is smoothed, not rejected
     *
     * @param requestsPerSecond permits per second from {@code sources.sonar.requests-per-second}
     * @return Configured rate limiter instance
     */
    @Bean
    public RateLimiter sonarRateLimiter(@Value("${sources.sonar.requests-per-second:5}") int requestsPerSecond) {
        RateLimiter rateLimiter = RateLimiter.of("sonarSourceRateLimiter", perSecond(requestsPerSecond));
        logger.info("Sonar rate limiter initialized with limit of {} requests/second", requestsPerSecond);
        return rateLimiter;
    }

    /**
     * Rate limiter for the Serper shopping API
     *
     * @param requestsPerSecond permits per second from {@code sources.serper.requests-per-second}
     * @return Configured rate limiter instance
     */
    @Bean
    public RateLimiter serperRateLimiter(@Value("${sources.serper.requests-per-second:5}") int requestsPerSecond) {
        RateLimiter rateLimiter = RateLimiter.of("serperSourceRateLimiter", perSecond(requestsPerSecond));
        logger.info("Serper rate limiter initialized with limit of {} requests/second", requestsPerSecond);
        return rateLimiter;
    }

    private static RateLimiterConfig perSecond(int requestsPerSecond) {
        return RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, requestsPerSecond))
                .timeoutDuration(Duration.ofSeconds(1))
                .build();
    }
}
