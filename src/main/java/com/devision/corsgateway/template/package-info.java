/**
 * Template-based request proxying.
 *
 * <p>A caller names a {@link com.devision.corsgateway.template.RequestTemplate} and supplies an
 * {@link com.devision.corsgateway.template.InvocationContext}. The
 * {@link com.devision.corsgateway.template.TemplateDispatcher} checks the name against the
 * {@link com.devision.corsgateway.template.TemplateStore} and the application's
 * {@link com.devision.corsgateway.template.PermissionRegistry}, fills the placeholders and performs
 * the call.
 */
package com.devision.corsgateway.template;
