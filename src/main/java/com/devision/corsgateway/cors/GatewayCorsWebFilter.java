package com.devision.corsgateway.cors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.cors.reactive.CorsConfigurationSource;
import org.springframework.web.cors.reactive.CorsProcessor;
import org.springframework.web.cors.reactive.CorsUtils;
import org.springframework.web.cors.reactive.DefaultCorsProcessor;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CORS Web Filter
 *
 * Works like Spring's CorsWebFilter, but a rejected origin gets a JSON error body along with the
 * 403, so browser applications can tell a CORS rejection from other failures.
 *
 * Flow:
 * 1. Resolve the CORS configuration for the request's origin
 * 2. Let the CORS processor add the response headers (or set 403)
 * 3. Rejected: write the JSON error. Preflight: answer directly. Otherwise continue the chain
 */
@Slf4j
public class GatewayCorsWebFilter implements WebFilter {

    private final CorsConfigurationSource configSource;
    private final CorsProcessor processor;
    private final ObjectMapper objectMapper;

    public GatewayCorsWebFilter(CorsConfigurationSource configSource, ObjectMapper objectMapper) {
        this(configSource, new DefaultCorsProcessor(), objectMapper);
    }

    public GatewayCorsWebFilter(CorsConfigurationSource configSource, CorsProcessor processor,
                                ObjectMapper objectMapper) {
        this.configSource = configSource;
        this.processor = processor;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        boolean valid = processor.process(configSource.getCorsConfiguration(exchange), exchange);

        if (!valid) {
            return rejected(exchange, request.getHeaders().getFirst(HttpHeaders.ORIGIN));
        }
        if (CorsUtils.isPreFlightRequest(request)) {
            return Mono.empty();
        }
        return chain.filter(exchange);
    }

    private Mono<Void> rejected(ServerWebExchange exchange, String origin) {
        log.warn("CORS request rejected for origin {} on {}", origin, exchange.getRequest().getPath());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", "CORS Error");
        body.put("message", "Origin " + origin + " is not allowed by the gateway's CORS policy");
        body.put("origin", origin);

        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        try {
            byte[] bytes = objectMapper.writeValueAsBytes(body);
            DataBuffer buffer = exchange.getResponse().bufferFactory().wrap(bytes);
            return exchange.getResponse().writeWith(Mono.just(buffer));
        } catch (JsonProcessingException e) {
            log.error("Error serializing CORS rejection response", e);
            return exchange.getResponse().setComplete();
        }
    }
}
