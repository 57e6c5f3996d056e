package com.devision.corsgateway.template;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Holds the request templates configured for this gateway, keyed by template name.
 *
 * The source is a JSON object of {@code name -> {method, protocol?, host, path?, headers?, query?}}.
 * A missing or unreadable source leaves the store empty; every lookup then misses.
 */
@Slf4j
public class TemplateStore {

    private static final TypeReference<LinkedHashMap<String, RequestTemplate>> TEMPLATE_MAP =
            new TypeReference<>() {
            };

    private final ObjectMapper objectMapper;
    private final Resource source;

    private volatile Map<String, RequestTemplate> templates = Map.of();
    private volatile boolean loaded;

    public TemplateStore(ObjectMapper objectMapper, Resource source) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Reads the configuration source. Only the first call has an effect.
     */
    public synchronized void load() {
        if (loaded) {
            return;
        }
        loaded = true;

        if (!source.exists()) {
            log.warn("No request templates found at {}", source.getDescription());
            return;
        }

        try (InputStream in = source.getInputStream()) {
            Map<String, RequestTemplate> parsed = objectMapper.readValue(in, TEMPLATE_MAP);
            Map<String, RequestTemplate> named = new LinkedHashMap<>();
            if (parsed != null) {
                parsed.forEach((name, template) -> {
                    if (template != null) {
                        named.put(name, template.withName(name));
                    }
                });
            }
            templates = Map.copyOf(named);
            log.info("Loaded {} request templates from {}", templates.size(), source.getDescription());
        } catch (IOException e) {
            log.warn("Error loading request templates from {}: {}", source.getDescription(), e.getMessage());
        }
    }

    public Optional<RequestTemplate> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(templates.get(name));
    }

    public List<String> names() {
        return templates.keySet().stream().sorted().toList();
    }

    public int size() {
        return templates.size();
    }
}
