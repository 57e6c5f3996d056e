package com.devision.corsgateway.filter;

import com.devision.corsgateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Gateway Headers Filter
 *
 * Tells the backend who the original caller was. The backend only trusts the gateway's own
 * origin, so the browser origin and API key travel in X-Gateway-* headers.
 * X-Forwarded-* headers are added by Spring Cloud Gateway itself.
 */
@Slf4j
@Component
public class GatewayHeadersFilter implements GlobalFilter, Ordered {

    private final String userAgent;

    public GatewayHeadersFilter(GatewayProperties properties) {
        this.userAgent = "API-Gateway-SDK/" + properties.getVersion();
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String origin = request.getHeaders().getOrigin();
        String apiKey = request.getHeaders().getFirst(GatewayHeaders.API_KEY);
        String clientDomain = request.getHeaders().getFirst(GatewayHeaders.CLIENT_DOMAIN);

        ServerHttpRequest modifiedRequest = request.mutate()
                .headers(headers -> {
                    headers.set(HttpHeaders.USER_AGENT, userAgent);
                    headers.set(GatewayHeaders.GATEWAY_ORIGIN, origin != null ? origin : "unknown");
                    headers.set(GatewayHeaders.GATEWAY_API_KEY, apiKey != null ? apiKey : "none");
                    headers.set(GatewayHeaders.GATEWAY_CLIENT_DOMAIN,
                            clientDomain != null ? clientDomain : origin != null ? origin : "unknown");
                })
                .build();

        log.debug("Adding gateway headers to request: {}", request.getPath());

        return chain.filter(exchange.mutate().request(modifiedRequest).build());
    }

    @Override
    public int getOrder() {
        return -40;
    }
}
