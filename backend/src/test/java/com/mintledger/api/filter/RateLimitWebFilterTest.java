package com.mintledger.api.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mintledger.config.RateLimitProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitWebFilterTest {

    private final AtomicInteger passed = new AtomicInteger();
    private final WebFilterChain chain = exchange -> {
        passed.incrementAndGet();
        return Mono.empty();
    };

    private RateLimitProperties properties;
    private RateLimitWebFilter filter;

    @BeforeEach
    void setUp() {
        properties = new RateLimitProperties();
        properties.setLimitForPeriod(1);
        filter = new RateLimitWebFilter(
                new ClientRateLimiters(properties), properties, new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    @Test
    @DisplayName("request over the per-IP budget gets 429 RATE_LIMITED without reaching the handler")
    void rejectsOverBudget() {
        MockServerWebExchange first = exchange("/api/nfts/stats/event", "10.0.0.1");
        MockServerWebExchange second = exchange("/api/nfts/stats/event", "10.0.0.1");

        filter.filter(first, chain).block();
        filter.filter(second, chain).block();

        assertThat(passed.get()).isEqualTo(1);
        assertThat(second.getResponse().getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(second.getResponse().getBodyAsString().block())
                .contains("\"error\":\"RATE_LIMITED\"")
                .contains("Too many requests from this IP, please try again later.");
    }

    @Test
    @DisplayName("budgets are tracked per client IP")
    void separateBudgetPerIp() {
        filter.filter(exchange("/api/health", "10.0.0.1"), chain).block();
        filter.filter(exchange("/api/health", "10.0.0.2"), chain).block();

        assertThat(passed.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("paths outside /api/ are not limited")
    void ignoresNonApiPaths() {
        filter.filter(exchange("/", "10.0.0.1"), chain).block();
        filter.filter(exchange("/", "10.0.0.1"), chain).block();

        assertThat(passed.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("disabled limiter lets everything through")
    void disabled() {
        properties.setEnabled(false);

        filter.filter(exchange("/api/health", "10.0.0.1"), chain).block();
        filter.filter(exchange("/api/health", "10.0.0.1"), chain).block();

        assertThat(passed.get()).isEqualTo(2);
    }

    private static MockServerWebExchange exchange(String path, String ip) {
        return MockServerWebExchange.from(MockServerHttpRequest.get(path)
                .remoteAddress(new InetSocketAddress(ip, 40000)));
    }
}
