package com.devision.corsgateway.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.reactive.error.ErrorWebExceptionHandler;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global Exception Handler for the gateway
 *
 * Every error leaves the gateway as {@code {success:false, error, message, ...}} JSON.
 */
@Slf4j
@Component
@Order(-2)
public class GlobalExceptionHandler implements ErrorWebExceptionHandler {

    static final List<String> AVAILABLE_ENDPOINTS = List.of(
            "GET /health",
            "GET /gateway/info",
            "GET /gateway/stats",
            "GET /gateway/logs",
            "GET /gateway/domains",
            "POST /gateway/register-domain",
            "DELETE /gateway/domains",
            "POST /gateway/generate-key (dev only)",
            "GET /gateway/templates",
            "POST /gateway/templates/{name}/invoke",
            "ALL /api/** (proxied to backend)"
    );

    private final ObjectMapper objectMapper;

    public GlobalExceptionHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
        if (exchange.getResponse().isCommitted()) {
            return Mono.error(ex);
        }

        HttpStatus status;
        Map<String, Object> errorResponse = new LinkedHashMap<>();
        errorResponse.put("success", false);

        if (ex instanceof UnauthorizedException ue) {
            status = HttpStatus.UNAUTHORIZED;
            errorResponse.put("error", ue.getError());
            errorResponse.put("message", ue.getMessage());
            errorResponse.put("origin", ue.getOrigin() != null ? ue.getOrigin() : "unknown");
        } else if (ex instanceof ResponseStatusException rse) {
            status = HttpStatus.valueOf(rse.getStatusCode().value());
            if (status == HttpStatus.NOT_FOUND) {
                errorResponse.put("error", "Not Found");
                errorResponse.put("message", "API endpoint not found");
                errorResponse.put("availableEndpoints", AVAILABLE_ENDPOINTS);
            } else {
                errorResponse.put("error", status.getReasonPhrase());
                errorResponse.put("message", rse.getReason() != null ? rse.getReason() : status.getReasonPhrase());
            }
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            errorResponse.put("error", "Internal Server Error");
            errorResponse.put("message", ex.getMessage() != null ? ex.getMessage() : "An unexpected error occurred");
            log.error("Unhandled exception in gateway", ex);
        }

        errorResponse.put("path", exchange.getRequest().getURI().getPath());
        errorResponse.put("timestamp", Instant.now().toString());

        exchange.getResponse().setStatusCode(status);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        exchange.getResponse().getHeaders().remove(HttpHeaders.CONTENT_LENGTH);

        try {
            byte[] bytes = objectMapper.writeValueAsBytes(errorResponse);
            DataBuffer buffer = exchange.getResponse().bufferFactory().wrap(bytes);
            return exchange.getResponse().writeWith(Mono.just(buffer));
        } catch (JsonProcessingException e) {
            log.error("Error serializing error response", e);
            return exchange.getResponse().setComplete();
        }
    }
}
