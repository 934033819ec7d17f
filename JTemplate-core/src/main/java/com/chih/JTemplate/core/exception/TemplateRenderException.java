package com.chih.JTemplate.core.exception;

public class TemplateRenderException extends JTemplateException {
    public TemplateRenderException(String templateId, Throwable cause) {
        super("Failed to render template: " + templateId, cause);
    }
}
