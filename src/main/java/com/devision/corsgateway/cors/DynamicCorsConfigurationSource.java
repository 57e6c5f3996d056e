package com.devision.corsgateway.cors;

import org.springframework.http.HttpHeaders;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsConfigurationSource;
import org.springframework.web.server.ServerWebExchange;

import java.util.List;

/**
 * Builds the CORS configuration per request, so origins registered at runtime are honoured
 * without restarting the gateway.
 *
 * A rejected origin gets a configuration that allows nothing, which makes the CORS processor
 * answer 403.
 */
public class DynamicCorsConfigurationSource implements CorsConfigurationSource {

    static final List<String> ALLOWED_METHODS = List.of("GET", "POST", "PUT", "DELETE", "OPTIONS");

    static final List<String> ALLOWED_HEADERS = List.of(
            "Content-Type",
            "Authorization",
            "X-API-Key",
            "X-Client-Domain",
            "X-Request-ID"
    );

    static final List<String> EXPOSED_HEADERS = List.of(
            "X-Gateway-Request-ID",
            "X-Gateway-Duration",
            "X-Proxied-From",
            "X-RateLimit-Limit",
            "X-RateLimit-Remaining",
            "X-RateLimit-Reset"
    );

    private final OriginPolicy originPolicy;

    public DynamicCorsConfigurationSource(OriginPolicy originPolicy) {
        this.originPolicy = originPolicy;
    }

    @Override
    public CorsConfiguration getCorsConfiguration(ServerWebExchange exchange) {
        String origin = exchange.getRequest().getHeaders().getFirst(HttpHeaders.ORIGIN);

        CorsConfiguration config = new CorsConfiguration();
        config.setAllowedMethods(ALLOWED_METHODS);
        config.setAllowedHeaders(ALLOWED_HEADERS);
        config.setExposedHeaders(EXPOSED_HEADERS);
        config.setAllowCredentials(true);
        config.setMaxAge(3600L);

        if (origin != null && originPolicy.isAllowed(origin)) {
            config.setAllowedOrigins(List.of(origin));
        } else {
            config.setAllowedOrigins(List.of());
        }
        return config;
    }
}
