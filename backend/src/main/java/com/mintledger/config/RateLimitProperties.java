package com.mintledger.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Per-client-IP request budget for /api/**. Default 100 requests per 15 minutes.
 */
@ConfigurationProperties(prefix = "mintledger.rate-limit")
@NoArgsConstructor
@Getter
@Setter
public class RateLimitProperties {

    private boolean enabled = true;

    private int limitForPeriod = 100;

    private Duration refreshPeriod = Duration.ofMinutes(15);

    /** Upper bound on client IPs tracked at once; least recently seen are dropped first. */
    private int maxTrackedClients = 10_000;
}
