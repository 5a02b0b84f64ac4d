package com.mintledger.api.filter;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.mintledger.config.RateLimitProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * One Resilience4j limiter per client IP, held in a bounded Caffeine cache.
 * A limiter idle for a whole refresh period has its full budget back, so dropping it loses nothing.
 */
@Component
public class ClientRateLimiters {

    private final RateLimiterConfig config;
    private final Cache<String, RateLimiter> limiters;

    @Autowired
    public ClientRateLimiters(RateLimitProperties properties) {
        this(properties, Ticker.systemTicker());
    }

    ClientRateLimiters(RateLimitProperties properties, Ticker ticker) {
        this.config = RateLimiterConfig.custom()
                .limitRefreshPeriod(properties.getRefreshPeriod())
                .limitForPeriod(Math.max(1, properties.getLimitForPeriod()))
                .timeoutDuration(Duration.ZERO)
                .build();
        this.limiters = Caffeine.newBuilder()
                .expireAfterAccess(properties.getRefreshPeriod())
                .maximumSize(Math.max(1, properties.getMaxTrackedClients()))
                .ticker(ticker)
                .build();
    }

    public RateLimiter forClient(String clientIp) {
        return limiters.get(clientIp, ip -> RateLimiter.of(ip, config));
    }

    /** Limiters currently held, after pending evictions. */
    public long trackedClients() {
        limiters.cleanUp();
        return limiters.estimatedSize();
    }
}
