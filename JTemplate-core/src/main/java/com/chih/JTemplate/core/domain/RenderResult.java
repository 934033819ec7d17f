package com.chih.JTemplate.core.domain;

import java.util.List;

/**
 * 渲染结果
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public final class RenderResult {

    private final String output;

    /**
     * 审计发现的缺失顶层变量（未审计时为空）
     */
    private final List<String> missingNames;

    /**
     * 渲染过程中未能解析的变量路径
     */
    private final List<String> warnings;

    public RenderResult(String output, List<String> missingNames, List<String> warnings) {
        this.output = output;
        this.missingNames = List.copyOf(missingNames);
        this.warnings = List.copyOf(warnings);
    }

    public String getOutput() {
        return output;
    }

    public List<String> getMissingNames() {
        return missingNames;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean hasMissingNames() {
        return !missingNames.isEmpty();
    }

    @Override
    public String toString() {
        return "RenderResult{" +
                "outputLength=" + (output != null ? output.length() : 0) +
                ", missingNames=" + missingNames +
                ", warnings=" + warnings +
                '}';
    }
}
