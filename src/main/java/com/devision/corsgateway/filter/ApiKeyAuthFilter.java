package com.devision.corsgateway.filter;

import com.devision.corsgateway.cors.DomainRegistry;
import com.devision.corsgateway.cors.OriginPolicy;
import com.devision.corsgateway.exception.UnauthorizedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * API Key Filter for proxied requests
 *
 * Flow:
 * 1. Configured origin → pass, no key needed
 * 2. Origin matches a domain pattern → pass, no key needed
 * 3. No X-API-Key header → 401 Authentication Required
 * 4. Unknown key → 401 Invalid API Key
 * 5. Valid key → register the origin (first time only) and pass
 *
 * The authenticated caller is stored under {@link GatewayCaller#ATTRIBUTE}.
 */
@Slf4j
@Component
public class ApiKeyAuthFilter implements GlobalFilter, Ordered {

    private final OriginPolicy originPolicy;
    private final DomainRegistry domainRegistry;

    public ApiKeyAuthFilter(OriginPolicy originPolicy, DomainRegistry domainRegistry) {
        this.originPolicy = originPolicy;
        this.domainRegistry = domainRegistry;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String origin = request.getHeaders().getOrigin();
        String apiKey = request.getHeaders().getFirst(GatewayHeaders.API_KEY);
        String clientDomain = request.getHeaders().getFirst(GatewayHeaders.CLIENT_DOMAIN);

        if (originPolicy.isConfigured(origin)) {
            log.debug("Pre-configured origin authenticated: {}", origin);
            return chain.filter(exchange);
        }

        if (originPolicy.matchesPattern(origin)) {
            log.debug("Pattern-matched origin authenticated: {}", origin);
            return chain.filter(exchange);
        }

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Authentication failed: no API key provided for origin {}", origin);
            return Mono.error(new UnauthorizedException("Authentication Required",
                    "API key is required for this origin", origin));
        }

        if (!domainRegistry.isValidApiKey(apiKey)) {
            log.warn("Authentication failed: invalid API key for origin {}", origin);
            return Mono.error(new UnauthorizedException("Invalid API Key",
                    "The provided API key is not valid", origin));
        }

        if (origin != null && !domainRegistry.isRegistered(origin)) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("userAgent", request.getHeaders().getFirst(HttpHeaders.USER_AGENT));
            metadata.put("firstSeen", Instant.now().toString());
            metadata.put("clientDomain", clientDomain);
            domainRegistry.register(origin, apiKey, metadata);
        }

        GatewayCaller caller = new GatewayCaller(apiKey, origin, clientDomain, domainRegistry.appName(apiKey));
        exchange.getAttributes().put(GatewayCaller.ATTRIBUTE, caller);

        log.info("Authenticated request: {} {} | App: {} | Origin: {}",
                request.getMethod(), request.getURI().getPath(), caller.appName(), origin);

        return chain.filter(exchange);
    }

    @Override
    public int getOrder() {
        // Before rate limiting, which keys on the authenticated API key
        return -150;
    }
}
