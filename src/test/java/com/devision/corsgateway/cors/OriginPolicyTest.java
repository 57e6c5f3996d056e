package com.devision.corsgateway.cors;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OriginPolicyTest {

    private final DomainRegistry registry = new DomainRegistry(Map.of("k1", "App"), Clock.systemUTC());
    private final OriginPolicy policy = new OriginPolicy(
            List.of("http://localhost:3000"),
            List.of("https://*.company.com", "http://localhost:*"),
            registry);

    @Test
    void allowsConfiguredOrigins() {
        assertThat(policy.isAllowed("http://localhost:3000")).isTrue();
        assertThat(policy.isConfigured("http://localhost:3000")).isTrue();
    }

    @Test
    void allowsPatternMatchedOrigins() {
        assertThat(policy.isAllowed("https://app.company.com")).isTrue();
        assertThat(policy.isAllowed("http://localhost:4200")).isTrue();
    }

    @Test
    void wildcardDoesNotCrossDots() {
        assertThat(policy.matchesPattern("https://a.b.company.com")).isFalse();
        assertThat(policy.matchesPattern("https://app.company.com.evil.io")).isFalse();
    }

    @Test
    void wildcardTextIsLiteralOtherwise() {
        assertThat(OriginPolicy.compile("https://x?.io").matcher("https://x?.io").matches()).isTrue();
        assertThat(OriginPolicy.compile("https://x?.io").matcher("https://x.io").matches()).isFalse();
    }

    @Test
    void allowsRegisteredOriginsOnlyAfterRegistration() {
        assertThat(policy.isAllowed("https://partner.io")).isFalse();

        registry.register("https://partner.io", "k1", null);

        assertThat(policy.isAllowed("https://partner.io")).isTrue();
    }

    @Test
    void missingOriginIsAllowed() {
        assertThat(policy.isAllowed(null)).isTrue();
        assertThat(policy.isAllowed("")).isTrue();
    }
}
