package com.devision.corsgateway.cors;

import com.devision.corsgateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Origins registered at runtime by clients presenting a valid API key.
 *
 * Registered origins pass the CORS check in addition to the statically configured ones.
 */
@Slf4j
@Component
public class DomainRegistry {

    static final String UNKNOWN_APP = "Unknown";

    private final Map<String, String> apiKeys;
    private final Map<String, RegisteredDomain> domains = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    public DomainRegistry(GatewayProperties properties) {
        this(properties.apiKeyNames(), Clock.systemUTC());
    }

    DomainRegistry(Map<String, String> apiKeys, Clock clock) {
        this.apiKeys = apiKeys == null ? Map.of() : Map.copyOf(apiKeys);
        this.clock = clock;
    }

    /**
     * @return false if the API key is not known; nothing is registered then
     */
    public boolean register(String domain, String apiKey, Map<String, Object> metadata) {
        if (!isValidApiKey(apiKey)) {
            log.warn("Invalid API key for domain: {}", domain);
            return false;
        }
        Map<String, Object> copy = metadata == null ? Map.of() : new LinkedHashMap<>(metadata);
        domains.put(domain, new RegisteredDomain(domain, apiKey, Instant.now(clock), copy));
        log.info("Domain registered: {} ({})", domain, appName(apiKey));
        return true;
    }

    public boolean unregister(String domain) {
        if (domain != null && domains.remove(domain) != null) {
            log.info("Domain unregistered: {}", domain);
            return true;
        }
        return false;
    }

    public boolean isRegistered(String domain) {
        return domain != null && domains.containsKey(domain);
    }

    public Optional<RegisteredDomain> find(String domain) {
        return domain == null ? Optional.empty() : Optional.ofNullable(domains.get(domain));
    }

    public boolean isValidApiKey(String apiKey) {
        return apiKey != null && apiKeys.containsKey(apiKey);
    }

    public String appName(String apiKey) {
        if (apiKey == null) {
            return UNKNOWN_APP;
        }
        return apiKeys.getOrDefault(apiKey, UNKNOWN_APP);
    }

    public int apiKeyCount() {
        return apiKeys.size();
    }

    /**
     * Registered domains keyed by origin, as reported by the management endpoints.
     */
    public Map<String, Map<String, Object>> describe() {
        Map<String, Map<String, Object>> view = new TreeMap<>();
        domains.forEach((domain, info) -> {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("appName", appName(info.apiKey()));
            details.put("registeredAt", info.registeredAt().toString());
            details.put("metadata", info.metadata());
            view.put(domain, details);
        });
        return view;
    }

    public record RegisteredDomain(String domain, String apiKey, Instant registeredAt, Map<String, Object> metadata) {
    }
}
