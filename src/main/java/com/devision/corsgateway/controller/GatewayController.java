package com.devision.corsgateway.controller;

import com.devision.corsgateway.auth.ApiKeyGenerator;
import com.devision.corsgateway.config.GatewayProperties;
import com.devision.corsgateway.cors.DomainRegistry;
import com.devision.corsgateway.requestlog.RequestLog;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gateway management endpoints: health, configuration, statistics and domain registration.
 */
@RestController
public class GatewayController {

    private final GatewayProperties properties;
    private final DomainRegistry domainRegistry;
    private final RequestLog requestLog;

    public GatewayController(GatewayProperties properties, DomainRegistry domainRegistry, RequestLog requestLog) {
        this.properties = properties;
        this.domainRegistry = domainRegistry;
        this.requestLog = requestLog;
    }

    @GetMapping("/health")
    public Mono<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", "CORS Gateway");
        body.put("version", properties.getVersion());
        body.put("timestamp", Instant.now().toString());
        body.put("environment", properties.getEnvironment());
        body.put("backendUrl", properties.getBackendUrl());
        return Mono.just(body);
    }

    @GetMapping("/gateway/info")
    public Mono<Map<String, Object>> info() {
        Map<String, Object> gateway = new LinkedHashMap<>();
        gateway.put("version", properties.getVersion());
        gateway.put("environment", properties.getEnvironment());
        gateway.put("backendUrl", properties.getBackendUrl());
        gateway.put("allowedOrigins", properties.getAllowedOrigins());
        gateway.put("domainPatterns", properties.getDomainPatterns());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("gateway", gateway);
        body.put("registeredDomains", domainRegistry.describe());
        body.put("stats", requestLog.stats(properties.getLogs().getStatsWindow()));
        return Mono.just(body);
    }

    @GetMapping("/gateway/stats")
    public Mono<Map<String, Object>> stats() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("stats", requestLog.stats(properties.getLogs().getStatsWindow()));
        body.put("timestamp", Instant.now().toString());
        return Mono.just(body);
    }

    @GetMapping("/gateway/logs")
    public Mono<Map<String, Object>> logs(@RequestParam(name = "limit", required = false) String limit) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("logs", requestLog.recentLogs(parseLimit(limit)));
        body.put("timestamp", Instant.now().toString());
        return Mono.just(body);
    }

    @GetMapping("/gateway/domains")
    public Mono<Map<String, Object>> domains() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("configuredOrigins", properties.getAllowedOrigins());
        body.put("domainPatterns", properties.getDomainPatterns());
        body.put("registeredDomains", domainRegistry.describe());
        body.put("timestamp", Instant.now().toString());
        return Mono.just(body);
    }

    @PostMapping("/gateway/register-domain")
    public Mono<ResponseEntity<Map<String, Object>>> registerDomain(@RequestBody RegisterDomainRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();

        if (isBlank(request.domain()) || isBlank(request.apiKey())) {
            body.put("success", false);
            body.put("error", "Missing required fields");
            body.put("message", "Domain and API key are required");
            return Mono.just(ResponseEntity.badRequest().body(body));
        }

        if (!domainRegistry.register(request.domain(), request.apiKey(), request.metadata())) {
            body.put("success", false);
            body.put("error", "Invalid API Key");
            body.put("message", "The provided API key is not valid");
            return Mono.just(ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(body));
        }

        body.put("success", true);
        body.put("message", "Domain registered successfully");
        body.put("domain", request.domain());
        body.put("appName", domainRegistry.appName(request.apiKey()));
        body.put("timestamp", Instant.now().toString());
        return Mono.just(ResponseEntity.ok(body));
    }

    @DeleteMapping("/gateway/domains")
    public Mono<ResponseEntity<Map<String, Object>>> unregisterDomain(@RequestParam("domain") String domain) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (!domainRegistry.unregister(domain)) {
            body.put("success", false);
            body.put("error", "Not Found");
            body.put("message", "Domain is not registered");
            return Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND).body(body));
        }
        body.put("success", true);
        body.put("message", "Domain unregistered successfully");
        body.put("domain", domain);
        return Mono.just(ResponseEntity.ok(body));
    }

    @PostMapping("/gateway/generate-key")
    public Mono<ResponseEntity<Map<String, Object>>> generateKey(
            @RequestBody(required = false) GenerateKeyRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();

        if (!properties.isDevelopment()) {
            body.put("success", false);
            body.put("error", "Forbidden");
            body.put("message", "Key generation is only available in development mode");
            return Mono.just(ResponseEntity.status(HttpStatus.FORBIDDEN).body(body));
        }

        String prefix = request != null ? request.prefix() : null;
        String description = request != null && request.description() != null
                ? request.description()
                : "Generated API key";

        body.put("success", true);
        body.put("apiKey", ApiKeyGenerator.generate(prefix));
        body.put("description", description);
        body.put("timestamp", Instant.now().toString());
        body.put("note", "This key is for development use only");
        return Mono.just(ResponseEntity.ok(body));
    }

    static int parseLimit(String limit) {
        if (limit == null) {
            return RequestLog.DEFAULT_RECENT_LIMIT;
        }
        try {
            int parsed = Integer.parseInt(limit.trim());
            return parsed > 0 ? parsed : RequestLog.DEFAULT_RECENT_LIMIT;
        } catch (NumberFormatException e) {
            return RequestLog.DEFAULT_RECENT_LIMIT;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record RegisterDomainRequest(String domain, String apiKey, Map<String, Object> metadata) {
    }

    public record GenerateKeyRequest(String prefix, String description) {
    }
}
