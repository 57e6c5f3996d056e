package com.devision.corsgateway.template;

import java.util.List;

/**
 * @param configured templates present in the store
 * @param declared   templates declared in the application manifest
 * @param valid      templates that are both configured and declared
 */
public record TemplateListing(List<String> configured, List<String> declared, List<String> valid) {
}
