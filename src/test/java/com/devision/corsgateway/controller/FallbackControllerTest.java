package com.devision.corsgateway.controller;

import com.devision.corsgateway.filter.ProxyLoggingFilter;
import org.junit.jupiter.api.Test;
import org.springframework.cloud.gateway.support.ServerWebExchangeUtils;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class FallbackControllerTest {

    private final FallbackController controller = new FallbackController();

    @Test
    void reportsProxyFailureWithRequestId() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/fallback/backend"));
        exchange.getAttributes().put(ProxyLoggingFilter.REQUEST_ID_ATTR, "req-7-1");
        exchange.getAttributes().put(ServerWebExchangeUtils.CIRCUITBREAKER_EXECUTION_EXCEPTION_ATTR,
                new IllegalStateException("Connection refused"));

        StepVerifier.create(controller.backendFallback(exchange))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
                    assertThat(response.getBody())
                            .containsEntry("success", false)
                            .containsEntry("error", "Gateway Proxy Error")
                            .containsEntry("requestId", "req-7-1")
                            .containsEntry("details", "Connection refused");
                })
                .verifyComplete();
    }

    @Test
    void defaultsDetailsWithoutCause() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/fallback/backend"));

        StepVerifier.create(controller.backendFallback(exchange))
                .assertNext(response -> assertThat(response.getBody()).containsEntry("details", "Backend unavailable"))
                .verifyComplete();
    }
}
