package com.devision.corsgateway.config;

import org.springframework.cloud.gateway.route.RouteLocator;
import org.springframework.cloud.gateway.route.builder.RouteLocatorBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Route Configuration for the gateway
 *
 * Everything under /api is relayed unchanged to the configured backend. Backend failures
 * trip the circuit breaker and are answered by {@code FallbackController}.
 */
@Configuration
public class RouteConfig {

    public static final String BACKEND_ROUTE_ID = "backend-proxy";

    private final GatewayProperties properties;

    public RouteConfig(GatewayProperties properties) {
        this.properties = properties;
    }

    @Bean
    public RouteLocator backendRouteLocator(RouteLocatorBuilder builder) {
        return builder.routes()
                .route(BACKEND_ROUTE_ID, r -> r
                        .path("/api", "/api/**")
                        .filters(f -> f
                                .circuitBreaker(c -> c
                                        .setName("backendCircuitBreaker")
                                        .setFallbackUri("forward:/fallback/backend")))
                        .uri(properties.getBackendUrl()))
                .build();
    }
}
