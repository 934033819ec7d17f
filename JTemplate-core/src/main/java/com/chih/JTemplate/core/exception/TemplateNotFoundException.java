package com.chih.JTemplate.core.exception;

public class TemplateNotFoundException extends JTemplateException {
    public TemplateNotFoundException(String origin) {
        super("Template not found: " + origin);
    }

    public TemplateNotFoundException(String origin, Throwable cause) {
        super("Failed to load template: " + origin, cause);
    }
}
