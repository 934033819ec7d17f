package com.chih.JTemplate.core.engine;

import com.chih.JTemplate.core.domain.EscapingContext;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 单次渲染的可变状态，不跨调用共享
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
final class RenderContext {

    private final String templateId;
    private final EscapingContext escapingContext;
    private final Set<String> warnings = new LinkedHashSet<>();

    RenderContext(String templateId, EscapingContext escapingContext) {
        this.templateId = templateId;
        this.escapingContext = escapingContext;
    }

    String getTemplateId() {
        return templateId;
    }

    EscapingContext getEscapingContext() {
        return escapingContext;
    }

    void warnUnresolved(String path) {
        warnings.add(path);
    }

    List<String> getWarnings() {
        return new ArrayList<>(warnings);
    }
}
