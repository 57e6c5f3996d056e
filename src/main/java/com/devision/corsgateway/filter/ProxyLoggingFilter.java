package com.devision.corsgateway.filter;

import com.devision.corsgateway.config.GatewayProperties;
import com.devision.corsgateway.requestlog.LogEntry;
import com.devision.corsgateway.requestlog.RequestLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.core.Ordered;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Proxy Logging Filter
 *
 * Tags every proxied request with a gateway request id, reports the duration in response
 * headers and appends the call to the {@link RequestLog} used by /gateway/stats and /gateway/logs.
 */
@Slf4j
@Component
public class ProxyLoggingFilter implements GlobalFilter, Ordered {

    public static final String REQUEST_ID_ATTR = ProxyLoggingFilter.class.getName() + ".requestId";
    private static final String REQUEST_TIME_ATTR = ProxyLoggingFilter.class.getName() + ".requestTime";

    private final RequestLog requestLog;
    private final String backendUrl;

    public ProxyLoggingFilter(RequestLog requestLog, GatewayProperties properties) {
        this.requestLog = requestLog;
        this.backendUrl = properties.getBackendUrl();
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String requestId = requestLog.nextRequestId();
        Instant requestTime = Instant.now();

        exchange.getAttributes().put(REQUEST_ID_ATTR, requestId);
        exchange.getAttributes().put(REQUEST_TIME_ATTR, requestTime);

        exchange.getResponse().beforeCommit(() -> {
            exchange.getResponse().getHeaders().set(GatewayHeaders.REQUEST_ID, requestId);
            exchange.getResponse().getHeaders().set(GatewayHeaders.DURATION, elapsed(requestTime) + "ms");
            exchange.getResponse().getHeaders().set(GatewayHeaders.PROXIED_FROM, backendUrl);
            return Mono.empty();
        });

        log.info("[{}] Proxying {} {} to {}{} - Origin: {} - API Key: {}",
                requestId,
                request.getMethod(),
                request.getURI().getPath(),
                backendUrl,
                request.getURI().getPath(),
                request.getHeaders().getOrigin(),
                request.getHeaders().getFirst(GatewayHeaders.API_KEY));

        return chain.filter(exchange)
                .doOnError(e -> {
                    log.error("[{}] Proxy error: {}", requestId, e.getMessage());
                    record(exchange, requestId, requestTime, 500, e.getMessage());
                })
                .then(Mono.fromRunnable(() -> {
                    HttpStatusCode status = exchange.getResponse().getStatusCode();
                    Integer code = status != null ? status.value() : null;
                    log.info("[{}] Response: {} ({}ms)", requestId, code, elapsed(requestTime));
                    record(exchange, requestId, requestTime, code, null);
                }));
    }

    private void record(ServerWebExchange exchange, String requestId, Instant requestTime,
                        Integer status, String error) {
        ServerHttpRequest request = exchange.getRequest();
        requestLog.record(new LogEntry(
                requestId,
                request.getMethod().name(),
                request.getURI().getPath(),
                request.getHeaders().getOrigin(),
                request.getHeaders().getFirst(GatewayHeaders.API_KEY),
                status,
                elapsed(requestTime),
                Instant.now(),
                error));
    }

    private static long elapsed(Instant since) {
        return Instant.now().toEpochMilli() - since.toEpochMilli();
    }

    @Override
    public int getOrder() {
        // After authentication and rate limiting: only admitted requests are proxied
        return -50;
    }
}
