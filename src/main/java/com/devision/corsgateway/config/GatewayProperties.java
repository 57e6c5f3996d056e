package com.devision.corsgateway.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway settings bound from the {@code gateway.*} namespace.
 *
 * Each Spring profile (default = development, staging, production) supplies its own
 * origins, backend URL and API keys. See application*.yml.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /**
     * Deployment environment name. Key generation is only available in "development".
     */
    private String environment = "development";

    private String version = "1.0.0";

    /**
     * Public URL of this gateway, reported by /gateway/info.
     */
    private String gatewayUrl = "http://localhost:9000";

    /**
     * Backend that every /api/** request is proxied to.
     */
    private String backendUrl = "http://localhost:8000";

    /**
     * Origins that are always allowed and never need an API key.
     */
    private List<String> allowedOrigins = new ArrayList<>();

    /**
     * Wildcard origin patterns, e.g. {@code https://*.company.com}.
     * A {@code *} matches any run of characters without a dot.
     */
    private List<String> domainPatterns = new ArrayList<>();

    /**
     * Keys accepted in the X-API-Key header. Entries with a blank key are ignored.
     */
    private List<ApiKey> apiKeys = new ArrayList<>();

    private RateLimit rateLimit = new RateLimit();

    private Templates templates = new Templates();

    private Logs logs = new Logs();

    public boolean isDevelopment() {
        return "development".equalsIgnoreCase(environment);
    }

    /**
     * API key to application name, skipping unset keys.
     */
    public Map<String, String> apiKeyNames() {
        Map<String, String> names = new LinkedHashMap<>();
        for (ApiKey apiKey : apiKeys) {
            if (apiKey.getKey() != null && !apiKey.getKey().isBlank()) {
                names.put(apiKey.getKey(), apiKey.getAppName() == null ? apiKey.getKey() : apiKey.getAppName());
            }
        }
        return names;
    }

    @Getter
    @Setter
    public static class ApiKey {

        private String key;

        private String appName;
    }

    @Getter
    @Setter
    public static class RateLimit {

        private boolean enabled = true;

        private int maxRequests = 1000;

        private Duration window = Duration.ofMinutes(15);
    }

    @Getter
    @Setter
    public static class Templates {

        /**
         * Application whose manifest decides which templates may be invoked.
         */
        private String applicationId = "app2";

        private String location = "file:config/requests.json";

        /**
         * Manifest resource; {@code {applicationId}} is replaced with the application id.
         */
        private String manifestLocation = "file:../{applicationId}/manifest.json";

        private Duration timeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Logs {

        private int capacity = 1000;

        private Duration statsWindow = Duration.ofHours(1);
    }
}
