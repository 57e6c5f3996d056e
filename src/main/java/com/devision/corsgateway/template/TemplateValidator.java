package com.devision.corsgateway.template;

import java.util.List;
import java.util.Objects;

/**
 * Decides whether a template may be invoked by the active application.
 */
public class TemplateValidator {

    private final TemplateStore templateStore;
    private final PermissionRegistry permissionRegistry;

    public TemplateValidator(TemplateStore templateStore, PermissionRegistry permissionRegistry) {
        this.templateStore = Objects.requireNonNull(templateStore, "templateStore");
        this.permissionRegistry = Objects.requireNonNull(permissionRegistry, "permissionRegistry");
    }

    /**
     * @return the stored template
     * @throws TemplateNotFoundException    if no template has this name
     * @throws TemplateNotDeclaredException if the application manifest does not declare it
     * @throws TemplateMalformedException   if the method or host is missing
     */
    public RequestTemplate validate(String templateName) {
        RequestTemplate template = templateStore.get(templateName)
                .orElseThrow(() -> new TemplateNotFoundException(templateName));

        if (!permissionRegistry.isDeclared(templateName)) {
            throw new TemplateNotDeclaredException(templateName);
        }
        if (isBlank(template.method())) {
            throw TemplateMalformedException.missingField(templateName, "method");
        }
        if (isBlank(template.host())) {
            throw TemplateMalformedException.missingField(templateName, "host");
        }
        return template;
    }

    public TemplateListing listing() {
        List<String> configured = templateStore.names();
        List<String> declared = permissionRegistry.declaredNames();
        List<String> valid = configured.stream()
                .filter(permissionRegistry::isDeclared)
                .toList();
        return new TemplateListing(configured, declared, valid);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
