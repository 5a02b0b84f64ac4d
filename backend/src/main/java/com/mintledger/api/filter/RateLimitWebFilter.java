package com.mintledger.api.filter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mintledger.api.dto.ErrorBody;
import com.mintledger.config.RateLimitProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Per-client-IP request budget on /api/**. Over budget: 429 with an ErrorBody, no waiting.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
@Slf4j
public class RateLimitWebFilter implements WebFilter {

    public static final String RATE_LIMITED = "RATE_LIMITED";
    static final String API_PREFIX = "/api/";
    static final String MESSAGE = "Too many requests from this IP, please try again later.";

    private final ClientRateLimiters clientRateLimiters;
    private final RateLimitProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!properties.isEnabled() || !exchange.getRequest().getURI().getRawPath().startsWith(API_PREFIX)) {
            return chain.filter(exchange);
        }
        String clientIp = ClientAddresses.of(exchange.getRequest());
        RateLimiter limiter = clientRateLimiters.forClient(clientIp);
        if (limiter.acquirePermission()) {
            return chain.filter(exchange);
        }
        log.warn("Rate limit exceeded for {}", clientIp);
        return reject(exchange.getResponse());
    }

    private Mono<Void> reject(ServerHttpResponse response) {
        response.setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(ErrorBody.of(RATE_LIMITED, MESSAGE));
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }
        DataBuffer buffer = response.bufferFactory().wrap(body);
        return response.writeWith(Mono.just(buffer));
    }
}
