package com.devision.corsgateway.template;

import com.devision.corsgateway.requestlog.LogEntry;
import com.devision.corsgateway.requestlog.RequestLog;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Invokes request templates: validate, render, call out, record.
 *
 * Every outcome is returned as an {@link InvocationResult}; nothing is thrown to the caller.
 * Retrying is left to the client.
 */
@Slf4j
public class TemplateDispatcher {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    static final String DEFAULT_PROTOCOL = "https";

    private final TemplateValidator validator;
    private final TemplateProcessor processor;
    private final WebClient webClient;
    private final RequestLog requestLog;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final Clock clock;

    public TemplateDispatcher(TemplateValidator validator,
                              TemplateProcessor processor,
                              WebClient webClient,
                              RequestLog requestLog,
                              ObjectMapper objectMapper,
                              Duration timeout,
                              Clock clock) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.processor = Objects.requireNonNull(processor, "processor");
        this.webClient = Objects.requireNonNull(webClient, "webClient");
        this.requestLog = Objects.requireNonNull(requestLog, "requestLog");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public Mono<InvocationResult> invoke(String templateName, InvocationContext context, Object body) {
        return invoke(templateName, context, body, CallerInfo.ANONYMOUS);
    }

    public Mono<InvocationResult> invoke(String templateName, InvocationContext context, Object body,
                                         CallerInfo caller) {
        return Mono.defer(() -> dispatch(templateName, context, body,
                caller == null ? CallerInfo.ANONYMOUS : caller));
    }

    private Mono<InvocationResult> dispatch(String templateName, InvocationContext context, Object body,
                                            CallerInfo caller) {
        long start = clock.millis();

        RequestTemplate rendered;
        URI uri;
        String payload;
        try {
            rendered = processor.render(validator.validate(templateName), context);
            uri = buildUri(rendered);
            payload = serializeBody(templateName, body);
        } catch (TemplateException e) {
            log.warn("Template invocation rejected: {}", e.getMessage());
            return Mono.just(InvocationResult.failure(e.getKind(), e.getMessage(), clock.millis() - start));
        }

        String requestId = requestLog.nextRequestId();
        HttpMethod method = HttpMethod.valueOf(rendered.method().trim().toUpperCase(Locale.ROOT));
        log.info("[{}] Invoking template {}: {} {}", requestId, templateName, method, uri);

        WebClient.RequestBodySpec request = webClient.method(method)
                .uri(uri)
                .headers(headers -> rendered.headers().forEach(headers::set));
        WebClient.RequestHeadersSpec<?> exchange = request;
        if (payload != null) {
            if (!hasHeader(rendered.headers(), HttpHeaders.CONTENT_TYPE)) {
                request = request.contentType(MediaType.APPLICATION_JSON);
            }
            exchange = request.bodyValue(payload);
        }

        return exchange.exchangeToMono(this::toResult)
                .timeout(timeout)
                .map(result -> withDuration(result, clock.millis() - start))
                .onErrorResume(e -> Mono.just(InvocationResult.failure(
                        InvocationErrorKind.TRANSPORT_FAILURE, transportMessage(e), clock.millis() - start)))
                .doOnNext(result -> recordInvocation(requestId, rendered, caller, result));
    }

    /**
     * Reads the whole body regardless of size: the buffers are joined directly instead of going
     * through the string decoder, whose in-memory limit would turn a large answer into an error.
     */
    private Mono<InvocationResult> toResult(ClientResponse response) {
        Map<String, String> headers = new LinkedHashMap<>(response.headers().asHttpHeaders().toSingleValueMap());
        int status = response.statusCode().value();
        Charset charset = response.headers().contentType()
                .map(MediaType::getCharset)
                .orElse(StandardCharsets.UTF_8);
        return DataBufferUtils.join(response.bodyToFlux(DataBuffer.class))
                .map(buffer -> {
                    try {
                        return buffer.toString(charset);
                    } finally {
                        DataBufferUtils.release(buffer);
                    }
                })
                .defaultIfEmpty("")
                .map(text -> InvocationResult.success(status, headers, parseBody(text), 0));
    }

    private JsonNode parseBody(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(text);
        }
    }

    /**
     * Builds {@code protocol://host path}. A query string or fragment written in the path keeps its
     * meaning, and a path that is already percent-encoded is sent as is. Values of the
     * {@code query} map are encoded and appended.
     */
    private URI buildUri(RequestTemplate template) {
        String protocol = template.protocol() == null || template.protocol().isBlank()
                ? DEFAULT_PROTOCOL
                : template.protocol().trim();
        String target = protocol + "://" + template.host().trim() + template.path();
        try {
            UriComponentsBuilder builder = UriComponentsBuilder.newInstance().uriComponents(encoded(target));
            if (template.query() != null) {
                template.query().forEach((name, value) -> builder.queryParam(
                        UriUtils.encodeQueryParam(name, StandardCharsets.UTF_8),
                        UriUtils.encodeQueryParam(value, StandardCharsets.UTF_8)));
            }
            return builder.build(true).toUri();
        } catch (IllegalArgumentException e) {
            throw new TemplateMalformedException(template.name(),
                    "Template \"" + template.name() + "\" produced an invalid URL: " + e.getMessage());
        }
    }

    private static UriComponents encoded(String url) {
        try {
            return UriComponentsBuilder.fromUriString(url).build(true);
        } catch (IllegalArgumentException notYetEncoded) {
            return UriComponentsBuilder.fromUriString(url).build().encode(StandardCharsets.UTF_8);
        }
    }

    private String serializeBody(String templateName, Object body) {
        if (body == null) {
            return null;
        }
        if (body instanceof String text) {
            return text;
        }
        if (body instanceof JsonNode node) {
            if (node.isNull() || node.isMissingNode()) {
                return null;
            }
            if (node.isTextual()) {
                return node.asText();
            }
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new TemplateMalformedException(templateName,
                    "Request body for template \"" + templateName + "\" is not serializable: " + e.getOriginalMessage());
        }
    }

    private void recordInvocation(String requestId, RequestTemplate template, CallerInfo caller,
                                  InvocationResult result) {
        requestLog.record(new LogEntry(
                requestId,
                template.method(),
                template.path(),
                caller.origin(),
                caller.apiKey(),
                result.status(),
                result.duration(),
                clock.instant(),
                result.error()));

        if (result.success()) {
            log.info("[{}] Template {} responded {} ({}ms)", requestId, template.name(), result.status(),
                    result.duration());
        } else {
            log.error("[{}] Template {} failed after {}ms: {}", requestId, template.name(), result.duration(),
                    result.error());
        }
    }

    private String transportMessage(Throwable e) {
        if (e instanceof TimeoutException) {
            return "Request timeout after " + timeout.toMillis() + "ms";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static InvocationResult withDuration(InvocationResult result, long duration) {
        return new InvocationResult(result.success(), result.status(), result.headers(), result.data(),
                duration, result.errorKind(), result.error());
    }

    private static boolean hasHeader(Map<String, String> headers, String name) {
        return headers.keySet().stream().anyMatch(name::equalsIgnoreCase);
    }
}
