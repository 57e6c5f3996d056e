package com.devision.corsgateway.template;

/**
 * "Application {@code applicationId} may invoke template {@code templateName}", as declared
 * under one of the application's products.
 */
public record PermissionEntry(String applicationId, String templateName, String product, boolean declared) {
}
