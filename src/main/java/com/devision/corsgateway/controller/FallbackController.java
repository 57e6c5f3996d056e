package com.devision.corsgateway.controller;

import com.devision.corsgateway.filter.ProxyLoggingFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.gateway.support.ServerWebExchangeUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fallback Controller
 *
 * Answers proxied requests when the backend cannot be reached or the circuit is open.
 */
@Slf4j
@RestController
@RequestMapping("/fallback")
public class FallbackController {

    @RequestMapping("/backend")
    public Mono<ResponseEntity<Map<String, Object>>> backendFallback(ServerWebExchange exchange) {
        Throwable cause = exchange.getAttribute(ServerWebExchangeUtils.CIRCUITBREAKER_EXECUTION_EXCEPTION_ATTR);
        String requestId = exchange.getAttribute(ProxyLoggingFilter.REQUEST_ID_ATTR);
        String details = cause != null && cause.getMessage() != null
                ? cause.getMessage()
                : "Backend unavailable";

        log.error("[{}] Proxy error: {}", requestId, details);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", "Gateway Proxy Error");
        body.put("message", "Failed to proxy request to backend");
        body.put("requestId", requestId);
        body.put("details", details);
        body.put("timestamp", Instant.now().toString());

        return Mono.just(ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body));
    }
}
