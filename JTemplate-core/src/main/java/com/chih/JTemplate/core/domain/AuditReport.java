package com.chih.JTemplate.core.domain;

import java.util.List;

/**
 * 变量审计报告
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public final class AuditReport {

    /**
     * 模板中以普通变量形式引用的顶层名称（按首次出现排序）
     */
    private final List<String> referencedNames;

    /**
     * 其中未在根作用域中提供的名称
     */
    private final List<String> missingNames;

    public AuditReport(List<String> referencedNames, List<String> missingNames) {
        this.referencedNames = List.copyOf(referencedNames);
        this.missingNames = List.copyOf(missingNames);
    }

    public List<String> getReferencedNames() {
        return referencedNames;
    }

    public List<String> getMissingNames() {
        return missingNames;
    }

    public boolean isValid() {
        return missingNames.isEmpty();
    }

    @Override
    public String toString() {
        return "AuditReport{referencedNames=" + referencedNames + ", missingNames=" + missingNames + '}';
    }
}
