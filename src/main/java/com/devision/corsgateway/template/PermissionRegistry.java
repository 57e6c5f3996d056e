package com.devision.corsgateway.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Templates an application has declared in its manifest.
 *
 * Manifest shape: {@code { "product": { "<product>": { "requests": { "<template>": {...} } } } }}.
 * Only declared names may be invoked, even when the template exists in the {@link TemplateStore}.
 */
@Slf4j
public class PermissionRegistry {

    static final String APPLICATION_ID_TOKEN = "{applicationId}";

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final String manifestLocation;

    private volatile String applicationId;
    private volatile Map<String, PermissionEntry> entries = Map.of();

    public PermissionRegistry(ObjectMapper objectMapper, ResourceLoader resourceLoader, String manifestLocation) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.resourceLoader = Objects.requireNonNull(resourceLoader, "resourceLoader");
        this.manifestLocation = Objects.requireNonNull(manifestLocation, "manifestLocation");
    }

    public synchronized void load(String appId) {
        Objects.requireNonNull(appId, "appId");
        this.applicationId = appId;
        this.entries = Map.of();

        Resource manifest = resourceLoader.getResource(manifestLocation.replace(APPLICATION_ID_TOKEN, appId));
        if (!manifest.exists()) {
            log.warn("No manifest.json found for {} at {}", appId, manifest.getDescription());
            return;
        }

        try (InputStream in = manifest.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            JsonNode products = root == null ? null : root.get("product");
            Map<String, PermissionEntry> declared = new LinkedHashMap<>();
            int productCount = 0;
            if (products != null && products.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> it = products.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> product = it.next();
                    productCount++;
                    JsonNode requests = product.getValue().get("requests");
                    if (requests == null || !requests.isObject()) {
                        continue;
                    }
                    requests.fieldNames().forEachRemaining(templateName ->
                            declared.put(templateName,
                                    new PermissionEntry(appId, templateName, product.getKey(), true)));
                }
            }
            entries = Map.copyOf(declared);
            log.info("Loaded manifest permissions for {} products ({} templates) from {}",
                    productCount, entries.size(), manifest.getDescription());
        } catch (IOException e) {
            log.warn("Error loading manifest for {}: {}", appId, e.getMessage());
        }
    }

    public boolean isDeclared(String templateName) {
        return templateName != null && entries.containsKey(templateName);
    }

    public Optional<PermissionEntry> entry(String templateName) {
        return templateName == null ? Optional.empty() : Optional.ofNullable(entries.get(templateName));
    }

    public List<String> declaredNames() {
        return entries.keySet().stream().sorted().toList();
    }

    public String applicationId() {
        return applicationId;
    }
}
