package com.buildnotify.exception.template;

public class TemplateNotFoundException extends RuntimeException {

    private final String templateName;

    public TemplateNotFoundException(String templateName, String location, Throwable cause) {
        super("template '" + templateName + "' not found in " + location, cause);
        this.templateName = templateName;
    }

    public String getTemplateName() { return templateName; }
}
