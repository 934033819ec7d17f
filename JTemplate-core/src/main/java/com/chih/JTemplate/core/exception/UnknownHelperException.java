package com.chih.JTemplate.core.exception;

/**
 * 表达式引用了未注册的 Helper
 */
public class UnknownHelperException extends JTemplateException {

    private final String helperName;

    public UnknownHelperException(String helperName) {
        this(helperName, "Unknown helper: " + helperName);
    }

    protected UnknownHelperException(String helperName, String message) {
        super(message);
        this.helperName = helperName;
    }

    protected UnknownHelperException(String helperName, String message, Throwable cause) {
        super(message, cause);
        this.helperName = helperName;
    }

    public String getHelperName() {
        return helperName;
    }
}
