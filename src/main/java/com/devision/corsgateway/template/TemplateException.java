package com.devision.corsgateway.template;

/**
 * Base class for template lookup and validation failures.
 */
public abstract class TemplateException extends RuntimeException {

    private final String templateName;

    protected TemplateException(String templateName, String message) {
        super(message);
        this.templateName = templateName;
    }

    public String getTemplateName() {
        return templateName;
    }

    public abstract InvocationErrorKind getKind();
}
