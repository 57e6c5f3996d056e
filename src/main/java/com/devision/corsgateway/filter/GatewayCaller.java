package com.devision.corsgateway.filter;

import org.springframework.web.server.ServerWebExchange;

import java.util.Optional;

/**
 * Caller identity established by {@link ApiKeyAuthFilter}, stored as an exchange attribute.
 */
public record GatewayCaller(String apiKey, String origin, String clientDomain, String appName) {

    public static final String ATTRIBUTE = GatewayCaller.class.getName();

    public static Optional<GatewayCaller> from(ServerWebExchange exchange) {
        return Optional.ofNullable(exchange.getAttribute(ATTRIBUTE));
    }
}
