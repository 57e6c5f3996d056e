package com.devision.corsgateway.cors;

import com.devision.corsgateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides which browser origins may call the gateway.
 *
 * An origin is allowed when it is configured, registered at runtime, or matches a domain
 * pattern. Requests without an Origin header (curl, server-to-server) are always allowed.
 */
@Slf4j
@Component
public class OriginPolicy {

    private final List<String> allowedOrigins;
    private final List<Pattern> domainPatterns;
    private final DomainRegistry domainRegistry;

    @Autowired
    public OriginPolicy(GatewayProperties properties, DomainRegistry domainRegistry) {
        this(properties.getAllowedOrigins(), properties.getDomainPatterns(), domainRegistry);
    }

    OriginPolicy(List<String> allowedOrigins, List<String> domainPatterns, DomainRegistry domainRegistry) {
        this.allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
        this.domainPatterns = domainPatterns == null ? List.of()
                : domainPatterns.stream().map(OriginPolicy::compile).toList();
        this.domainRegistry = domainRegistry;
    }

    public boolean isAllowed(String origin) {
        if (origin == null || origin.isEmpty()) {
            return true;
        }
        if (isConfigured(origin)) {
            log.debug("CORS allowed for configured origin: {}", origin);
            return true;
        }
        if (domainRegistry.isRegistered(origin)) {
            log.debug("CORS allowed for registered domain: {}", origin);
            return true;
        }
        if (matchesPattern(origin)) {
            log.debug("CORS allowed for pattern-matched domain: {}", origin);
            return true;
        }
        log.warn("CORS blocked for origin: {}", origin);
        return false;
    }

    public boolean isConfigured(String origin) {
        return origin != null && allowedOrigins.contains(origin);
    }

    public boolean matchesPattern(String origin) {
        if (origin == null || origin.isEmpty()) {
            return false;
        }
        return domainPatterns.stream().anyMatch(p -> p.matcher(origin).matches());
    }

    /**
     * {@code *} stands for any run of characters without a dot; everything else is literal.
     */
    static Pattern compile(String wildcard) {
        StringBuilder regex = new StringBuilder();
        int start = 0;
        int star;
        while ((star = wildcard.indexOf('*', start)) >= 0) {
            if (star > start) {
                regex.append(Pattern.quote(wildcard.substring(start, star)));
            }
            regex.append("[^.]*");
            start = star + 1;
        }
        if (start < wildcard.length()) {
            regex.append(Pattern.quote(wildcard.substring(start)));
        }
        return Pattern.compile(regex.toString());
    }
}
