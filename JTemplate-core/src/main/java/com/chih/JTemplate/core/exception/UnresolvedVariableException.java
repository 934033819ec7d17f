package com.chih.JTemplate.core.exception;

import java.util.List;

/**
 * 严格模式下，审计发现模板引用了未提供的变量
 */
public class UnresolvedVariableException extends JTemplateException {

    private final List<String> missingNames;

    public UnresolvedVariableException(List<String> missingNames) {
        super("Unresolved template variables: " + missingNames);
        this.missingNames = List.copyOf(missingNames);
    }

    public List<String> getMissingNames() {
        return missingNames;
    }
}
