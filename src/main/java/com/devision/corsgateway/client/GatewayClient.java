package com.devision.corsgateway.client;

import com.devision.corsgateway.template.InvocationErrorKind;
import com.devision.corsgateway.template.InvocationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Client for applications that reach their backend through the CORS gateway.
 *
 * Every call carries the application's API key and client domain. Failed calls are retried
 * according to the {@link RetryPolicy}, except authentication failures (401, 403).
 */
@Slf4j
public final class GatewayClient {

    public static final String DEFAULT_GATEWAY_URL = "http://localhost:9000";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    static final String API_KEY_HEADER = "X-API-Key";
    static final String CLIENT_DOMAIN_HEADER = "X-Client-Domain";
    static final String USER_AGENT = "GatewayClient/1.0";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String gatewayUrl;
    private final String apiKey;
    private final String clientDomain;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final List<GatewayClientListener> listeners = new CopyOnWriteArrayList<>();

    private GatewayClient(Builder builder) {
        this.gatewayUrl = stripTrailingSlash(builder.gatewayUrl);
        this.apiKey = builder.apiKey;
        this.clientDomain = builder.clientDomain;
        this.timeout = builder.timeout;
        this.retryPolicy = builder.retryPolicy;
        this.objectMapper = builder.objectMapper != null
                ? builder.objectMapper
                : new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        WebClient.Builder webClientBuilder = builder.webClientBuilder != null
                ? builder.webClientBuilder
                : WebClient.builder();
        this.webClient = webClientBuilder.clone().baseUrl(gatewayUrl).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public void addListener(GatewayClientListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(GatewayClientListener listener) {
        listeners.remove(listener);
    }

    public String getGatewayUrl() {
        return gatewayUrl;
    }

    /**
     * Registers this client's domain with the gateway so its browser origin passes CORS.
     */
    public Mono<JsonNode> registerDomain() {
        if (clientDomain == null || apiKey == null) {
            return Mono.error(new GatewayClientException(null, "Client domain and API key are required to register"));
        }
        ObjectNode metadata = objectMapper.createObjectNode()
                .put("userAgent", USER_AGENT)
                .put("registeredAt", Instant.now().toString());
        ObjectNode body = objectMapper.createObjectNode()
                .put("domain", clientDomain)
                .put("apiKey", apiKey);
        body.set("metadata", metadata);

        return withRetry(() -> call(HttpMethod.POST, "/gateway/register-domain", body))
                .doOnNext(response -> log.info("Domain {} registered with gateway {}", clientDomain, gatewayUrl));
    }

    /**
     * True when the gateway answers its health endpoint with status "healthy". Never fails.
     */
    public Mono<Boolean> healthCheck() {
        return call(HttpMethod.GET, "/health", null)
                .map(response -> "healthy".equals(response.path("status").asText()))
                .onErrorResume(e -> {
                    log.warn("Gateway health check failed: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    /**
     * Sends a request to the backend through the gateway's proxy route, {@code /api{endpoint}}.
     */
    public Mono<JsonNode> request(String endpoint, HttpMethod method, Object body) {
        Objects.requireNonNull(endpoint, "endpoint");
        String path = "/api" + (endpoint.startsWith("/") ? endpoint : "/" + endpoint);
        return withRetry(() -> call(method == null ? HttpMethod.GET : method, path, body));
    }

    public Mono<JsonNode> get(String endpoint) {
        return request(endpoint, HttpMethod.GET, null);
    }

    public Mono<JsonNode> post(String endpoint, Object body) {
        return request(endpoint, HttpMethod.POST, body);
    }

    public Mono<JsonNode> put(String endpoint, Object body) {
        return request(endpoint, HttpMethod.PUT, body);
    }

    public Mono<JsonNode> delete(String endpoint) {
        return request(endpoint, HttpMethod.DELETE, null);
    }

    public Mono<JsonNode> getGatewayInfo() {
        return withRetry(() -> call(HttpMethod.GET, "/gateway/info", null));
    }

    public Mono<JsonNode> getGatewayStats() {
        return withRetry(() -> call(HttpMethod.GET, "/gateway/stats", null));
    }

    /**
     * Invokes a request template. Template errors come back as failed results and are not
     * retried. Results that failed in transport, and calls that never reached the gateway, are
     * retried according to the policy; the last transport failure result is returned once the
     * attempts run out.
     */
    public Mono<InvocationResult> invokeTemplate(String templateName, Map<String, ?> context, Object body) {
        Objects.requireNonNull(templateName, "templateName");
        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("context", context == null ? objectMapper.createObjectNode() : objectMapper.valueToTree(context));
        if (body != null) {
            payload.set("body", body instanceof String text ? TextNode.valueOf(text) : objectMapper.valueToTree(body));
        }
        Map<String, String> uriVariables = Map.of("name", templateName);
        return withRetry(() -> exchange(HttpMethod.POST, "/gateway/templates/{name}/invoke", uriVariables,
                        payload, this::toInvocationResult)
                        .flatMap(result -> result.errorKind() == InvocationErrorKind.TRANSPORT_FAILURE
                                ? Mono.<InvocationResult>error(new TransportFailure(result))
                                : Mono.just(result)))
                .onErrorResume(TransportFailure.class, failure -> Mono.just(failure.result));
    }

    private <T> Mono<T> withRetry(Supplier<Mono<T>> call) {
        return Mono.defer(call).retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
            int failedAttempt = (int) signal.totalRetries() + 1;
            Throwable failure = signal.failure();
            if (!isRetryable(failure) || !retryPolicy.canRetryAfter(failedAttempt)) {
                return Mono.<Long>error(failure);
            }
            Duration delay = retryPolicy.delayBeforeRetry(failedAttempt);
            log.warn("Gateway request failed (attempt {}/{}), retrying in {}ms: {}",
                    failedAttempt, retryPolicy.maxAttempts(), delay.toMillis(), failure.getMessage());
            return Mono.delay(delay);
        })));
    }

    private static boolean isRetryable(Throwable failure) {
        return !(failure instanceof GatewayClientException clientException && clientException.isAuthFailure());
    }

    private Mono<JsonNode> call(HttpMethod method, String path, Object body) {
        return exchange(method, path, Map.of(), body, this::toJson);
    }

    private <T> Mono<T> exchange(HttpMethod method, String path, Map<String, ?> uriVariables, Object body,
                                 Function<ClientResponse, Mono<T>> handler) {
        String url = gatewayUrl + (uriVariables.isEmpty()
                ? path
                : UriComponentsBuilder.fromPath(path).buildAndExpand(uriVariables).toUriString());
        return Mono.defer(() -> {
            long start = System.currentTimeMillis();
            notifyRequest(method.name(), url);

            WebClient.RequestBodySpec request = webClient.method(method)
                    .uri(path, uriVariables)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(headers -> {
                        headers.set("User-Agent", USER_AGENT);
                        if (apiKey != null) {
                            headers.set(API_KEY_HEADER, apiKey);
                        }
                        if (clientDomain != null) {
                            headers.set(CLIENT_DOMAIN_HEADER, clientDomain);
                        }
                    });
            WebClient.RequestHeadersSpec<?> spec = body == null
                    ? request
                    : request.contentType(MediaType.APPLICATION_JSON).bodyValue(body);

            return spec.exchangeToMono(response -> {
                        notifyResponse(method.name(), url, response.statusCode().value(),
                                System.currentTimeMillis() - start);
                        return handler.apply(response);
                    })
                    .timeout(timeout)
                    .onErrorMap(e -> !(e instanceof GatewayClientException), this::toClientException)
                    .doOnError(e -> notifyError(method.name(), url, e));
        });
    }

    private Mono<JsonNode> toJson(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(text -> {
                    JsonNode json = parse(text);
                    if (response.statusCode().isError()) {
                        return Mono.error(new GatewayClientException(status, errorMessage(status, json)));
                    }
                    return Mono.just(json);
                });
    }

    private Mono<InvocationResult> toInvocationResult(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(text -> {
                    try {
                        return Mono.just(objectMapper.readValue(text, InvocationResult.class));
                    } catch (JsonProcessingException e) {
                        return Mono.error(new GatewayClientException(status, errorMessage(status, parse(text))));
                    }
                });
    }

    private JsonNode parse(String text) {
        if (text.isEmpty()) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(text);
        }
    }

    private static String errorMessage(int status, JsonNode body) {
        if (body.hasNonNull("message")) {
            return body.get("message").asText();
        }
        if (body.hasNonNull("error")) {
            return body.get("error").asText();
        }
        if (body.isTextual() && !body.asText().isBlank()) {
            return body.asText();
        }
        return "HTTP " + status;
    }

    private GatewayClientException toClientException(Throwable e) {
        if (e instanceof TimeoutException) {
            return new GatewayClientException("Request timeout after " + timeout.toMillis() + "ms", e);
        }
        return new GatewayClientException(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
    }

    private void notifyRequest(String method, String url) {
        for (GatewayClientListener listener : listeners) {
            try {
                listener.onRequest(method, url);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on request event: {}", listener, e.getMessage());
            }
        }
    }

    private void notifyResponse(String method, String url, int status, long durationMs) {
        for (GatewayClientListener listener : listeners) {
            try {
                listener.onResponse(method, url, status, durationMs);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on response event: {}", listener, e.getMessage());
            }
        }
    }

    private void notifyError(String method, String url, Throwable error) {
        for (GatewayClientListener listener : listeners) {
            try {
                listener.onError(method, url, error);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on error event: {}", listener, e.getMessage());
            }
        }
    }

    /**
     * Carries a transport-failed invocation result through the retry operator.
     */
    private static final class TransportFailure extends RuntimeException {

        private final transient InvocationResult result;

        TransportFailure(InvocationResult result) {
            super(result.error(), null, false, false);
            this.result = result;
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static final class Builder {

        private String gatewayUrl = DEFAULT_GATEWAY_URL;
        private String apiKey;
        private String clientDomain;
        private Duration timeout = DEFAULT_TIMEOUT;
        private RetryPolicy retryPolicy = RetryPolicy.DEFAULT;
        private WebClient.Builder webClientBuilder;
        private ObjectMapper objectMapper;

        private Builder() {
        }

        public Builder gatewayUrl(String gatewayUrl) {
            this.gatewayUrl = Objects.requireNonNull(gatewayUrl, "gatewayUrl");
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder clientDomain(String clientDomain) {
            this.clientDomain = clientDomain;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
            return this;
        }

        public Builder webClientBuilder(WebClient.Builder webClientBuilder) {
            this.webClientBuilder = webClientBuilder;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public GatewayClient build() {
            return new GatewayClient(this);
        }
    }
}
