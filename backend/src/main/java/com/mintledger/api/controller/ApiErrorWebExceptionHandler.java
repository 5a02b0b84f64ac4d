package com.mintledger.api.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mintledger.api.dto.ErrorBody;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.reactive.error.ErrorWebExceptionHandler;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Status errors raised outside controller methods (unmatched route, wrong method, unsupported media type)
 * get the same ErrorBody envelope as the rest of the API. Anything else falls through to Boot's handler.
 */
@Component
@Order(-2)
@RequiredArgsConstructor
@Slf4j
public class ApiErrorWebExceptionHandler implements ErrorWebExceptionHandler {

    static final List<String> AVAILABLE_ROUTES = List.of(
            "GET /",
            "GET /api/health",
            "POST /api/nfts",
            "GET /api/nfts/:walletAddress",
            "GET /api/nfts/stats/event");

    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
        ServerHttpResponse response = exchange.getResponse();
        if (!(ex instanceof ResponseStatusException statusException) || response.isCommitted()) {
            return Mono.error(ex);
        }
        log.debug("{} {} -> {}", exchange.getRequest().getMethod(),
                exchange.getRequest().getURI().getRawPath(), statusException.getStatusCode());

        ErrorBody body = statusException.getStatusCode().value() == HttpStatus.NOT_FOUND.value()
                ? ErrorBody.routeNotFound(AVAILABLE_ROUTES)
                : ErrorBody.of(ErrorBody.codeFor(statusException.getStatusCode()),
                        ApiExceptionHandler.reasonOf(statusException));

        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }
        response.setStatusCode(statusException.getStatusCode());
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        DataBuffer buffer = response.bufferFactory().wrap(bytes);
        return response.writeWith(Mono.just(buffer));
    }
}
