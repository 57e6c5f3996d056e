package com.devision.corsgateway.cors;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DomainRegistryTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private final DomainRegistry registry = new DomainRegistry(
            Map.of("development-key-1", "Development App 1"), clock);

    @Test
    void registersDomainWithValidKey() {
        assertThat(registry.register("https://partner.io", "development-key-1", Map.of("userAgent", "test"))).isTrue();

        assertThat(registry.isRegistered("https://partner.io")).isTrue();
        assertThat(registry.find("https://partner.io")).hasValueSatisfying(domain -> {
            assertThat(domain.apiKey()).isEqualTo("development-key-1");
            assertThat(domain.registeredAt()).isEqualTo(clock.instant());
        });

        Map<String, Object> details = registry.describe().get("https://partner.io");
        assertThat(details).containsEntry("appName", "Development App 1")
                .containsEntry("registeredAt", "2024-05-01T10:00:00Z")
                .containsEntry("metadata", Map.of("userAgent", "test"));
    }

    @Test
    void rejectsUnknownKey() {
        assertThat(registry.register("https://evil.io", "stolen", null)).isFalse();
        assertThat(registry.isRegistered("https://evil.io")).isFalse();
        assertThat(registry.isValidApiKey(null)).isFalse();
    }

    @Test
    void unregistersOnlyKnownDomains() {
        registry.register("https://partner.io", "development-key-1", null);

        assertThat(registry.unregister("https://partner.io")).isTrue();
        assertThat(registry.unregister("https://partner.io")).isFalse();
        assertThat(registry.describe()).isEmpty();
    }

    @Test
    void unknownKeyHasUnknownAppName() {
        assertThat(registry.appName("development-key-1")).isEqualTo("Development App 1");
        assertThat(registry.appName("other")).isEqualTo("Unknown");
        assertThat(registry.apiKeyCount()).isEqualTo(1);
    }
}
