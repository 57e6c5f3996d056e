package com.devision.corsgateway.filter;

/*
 * ============================================================================
 * RATE LIMITING FILTER - CODE FLOW
 * ============================================================================
 *
 *   REQUEST COMES IN
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 1. Resolve the rate limit key       │
 *   │    - Authenticated API key, or      │
 *   │    - Client IP (X-Forwarded-For)    │
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 2. Increment counter in Redis       │
 *   │    Key: "rate_limit:{key}"          │
 *   │    TTL: window (default 15 min)     │
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 3. Check if limit exceeded          │
 *   │    - Default 1000 per window        │
 *   └─────────────────────────────────────┘
 *         │ YES → 429 Too Many Requests
 *         │ NO
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 4. Add rate limit headers           │
 *   │    - X-RateLimit-Limit              │
 *   │    - X-RateLimit-Remaining          │
 *   │    - X-RateLimit-Reset              │
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   FORWARD TO BACKEND
 *
 * If Redis is unavailable the request is let through.
 * ============================================================================
 */

import com.devision.corsgateway.config.GatewayProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.core.Ordered;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Rate Limiting Filter
 *
 * Fixed-window request counting per API key (or per client IP when no key was presented),
 * stored in Redis so that several gateway instances share the same budget.
 */
@Slf4j
@Component
public class RateLimitingFilter implements GlobalFilter, Ordered {

    static final String RATE_LIMIT_KEY_PREFIX = "rate_limit:";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final int maxRequests;
    private final Duration window;

    public RateLimitingFilter(ReactiveRedisTemplate<String, String> redisTemplate,
                              ObjectMapper objectMapper,
                              GatewayProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.enabled = properties.getRateLimit().isEnabled();
        this.maxRequests = properties.getRateLimit().getMaxRequests();
        this.window = properties.getRateLimit().getWindow();
        log.info("RateLimitingFilter {} ({} requests per {}s)",
                enabled ? "enabled" : "disabled", maxRequests, window.getSeconds());
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        if (!enabled) {
            return chain.filter(exchange);
        }

        String key = rateLimitKey(exchange);
        String redisKey = RATE_LIMIT_KEY_PREFIX + key;

        return redisTemplate.opsForValue()
                .increment(redisKey)
                .flatMap(count -> {
                    if (count == 1) {
                        return redisTemplate.expire(redisKey, window).thenReturn(count);
                    }
                    return Mono.just(count);
                })
                .map(Optional::of)
                .defaultIfEmpty(Optional.<Long>empty())
                .onErrorResume(e -> {
                    log.error("Rate limiting check failed: {}", e.getMessage());
                    return Mono.just(Optional.<Long>empty());
                })
                .flatMap(count -> {
                    if (count.isEmpty()) {
                        return chain.filter(exchange);
                    }
                    if (count.get() > maxRequests) {
                        log.warn("Rate limit exceeded for {}", key);
                        return tooManyRequests(exchange);
                    }

                    HttpHeaders headers = exchange.getResponse().getHeaders();
                    headers.add(GatewayHeaders.RATE_LIMIT_LIMIT, String.valueOf(maxRequests));
                    headers.add(GatewayHeaders.RATE_LIMIT_REMAINING,
                            String.valueOf(Math.max(0, maxRequests - count.get())));
                    headers.add(GatewayHeaders.RATE_LIMIT_RESET, Instant.now().plus(window).toString());
                    return chain.filter(exchange);
                });
    }

    private Mono<Void> tooManyRequests(ServerWebExchange exchange) {
        long retryAfter = window.getSeconds();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", "Rate Limit Exceeded");
        body.put("message", "Too many requests. Limit: " + maxRequests + " per " + retryAfter + " seconds");
        body.put("retryAfter", retryAfter);

        exchange.getResponse().setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        exchange.getResponse().getHeaders().set(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
        try {
            byte[] bytes = objectMapper.writeValueAsBytes(body);
            DataBuffer buffer = exchange.getResponse().bufferFactory().wrap(bytes);
            return exchange.getResponse().writeWith(Mono.just(buffer));
        } catch (JsonProcessingException e) {
            log.error("Error serializing rate limit response", e);
            return exchange.getResponse().setComplete();
        }
    }

    private String rateLimitKey(ServerWebExchange exchange) {
        return GatewayCaller.from(exchange)
                .map(GatewayCaller::apiKey)
                .orElseGet(() -> getClientIp(exchange));
    }

    private String getClientIp(ServerWebExchange exchange) {
        String forwardedFor = exchange.getRequest().getHeaders().getFirst("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isEmpty()) {
            return forwardedFor.split(",")[0].trim();
        }

        var remoteAddress = exchange.getRequest().getRemoteAddress();
        return remoteAddress != null && remoteAddress.getAddress() != null
                ? remoteAddress.getAddress().getHostAddress()
                : "unknown";
    }

    @Override
    public int getOrder() {
        return -100;
    }
}
