package com.chih.JTemplate.core.engine;

import com.chih.JTemplate.core.domain.Template;
import com.chih.JTemplate.core.parse.Node;

import java.util.List;

/**
 * 编译后的模板：原始模板 + 语法树
 * <p>
 * 不可变，可以缓存并在多个线程中重复渲染。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public final class CompiledTemplate {

    private final Template template;
    private final List<Node> nodes;

    CompiledTemplate(Template template, List<Node> nodes) {
        this.template = template;
        this.nodes = List.copyOf(nodes);
    }

    public Template getTemplate() {
        return template;
    }

    public List<Node> getNodes() {
        return nodes;
    }

    public String getOrigin() {
        return template.getOrigin();
    }

    public String displayName() {
        return template.displayName();
    }
}
