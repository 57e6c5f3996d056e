package com.devision.corsgateway.filter;

import com.devision.corsgateway.config.GatewayProperties;
import org.junit.jupiter.api.Test;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayHeadersFilterTest {

    private final GatewayHeadersFilter filter = new GatewayHeadersFilter(new GatewayProperties());

    private HttpHeaders forwardedHeaders(MockServerHttpRequest request) {
        AtomicReference<ServerWebExchange> forwarded = new AtomicReference<>();
        GatewayFilterChain chain = exchange -> {
            forwarded.set(exchange);
            return Mono.empty();
        };
        StepVerifier.create(filter.filter(MockServerWebExchange.from(request), chain)).verifyComplete();
        return forwarded.get().getRequest().getHeaders();
    }

    @Test
    void forwardsCallerIdentity() {
        HttpHeaders headers = forwardedHeaders(MockServerHttpRequest.get("/api/users")
                .header(HttpHeaders.ORIGIN, "https://partner.io")
                .header(GatewayHeaders.API_KEY, "k1")
                .header(GatewayHeaders.CLIENT_DOMAIN, "partner.io")
                .build());

        assertThat(headers.getFirst(HttpHeaders.USER_AGENT)).isEqualTo("API-Gateway-SDK/1.0.0");
        assertThat(headers.getFirst(GatewayHeaders.GATEWAY_ORIGIN)).isEqualTo("https://partner.io");
        assertThat(headers.getFirst(GatewayHeaders.GATEWAY_API_KEY)).isEqualTo("k1");
        assertThat(headers.getFirst(GatewayHeaders.GATEWAY_CLIENT_DOMAIN)).isEqualTo("partner.io");
    }

    @Test
    void fillsDefaultsForAnonymousCallers() {
        HttpHeaders headers = forwardedHeaders(MockServerHttpRequest.get("/api/users").build());

        assertThat(headers.getFirst(GatewayHeaders.GATEWAY_ORIGIN)).isEqualTo("unknown");
        assertThat(headers.getFirst(GatewayHeaders.GATEWAY_API_KEY)).isEqualTo("none");
        assertThat(headers.getFirst(GatewayHeaders.GATEWAY_CLIENT_DOMAIN)).isEqualTo("unknown");
    }

    @Test
    void clientDomainFallsBackToOrigin() {
        HttpHeaders headers = forwardedHeaders(MockServerHttpRequest.get("/api/users")
                .header(HttpHeaders.ORIGIN, "https://partner.io")
                .build());

        assertThat(headers.getFirst(GatewayHeaders.GATEWAY_CLIENT_DOMAIN)).isEqualTo("https://partner.io");
    }
}
