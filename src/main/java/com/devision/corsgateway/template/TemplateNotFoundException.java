package com.devision.corsgateway.template;

public class TemplateNotFoundException extends TemplateException {

    public TemplateNotFoundException(String templateName) {
        super(templateName, "Template \"" + templateName + "\" not found in request templates");
    }

    @Override
    public InvocationErrorKind getKind() {
        return InvocationErrorKind.TEMPLATE_NOT_FOUND;
    }
}
