package com.chih.JTemplate.core.engine;

import com.chih.JTemplate.core.domain.Undefined;
import com.chih.JTemplate.core.parse.Condition;
import com.chih.JTemplate.core.parse.Expression;
import com.chih.JTemplate.core.parse.Node;
import com.chih.JTemplate.core.support.ContextEscaper;
import com.chih.JTemplate.core.support.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 指令执行器：对语法树做一次递归遍历，输出渲染结果
 * <p>
 * 条件块在当前作用域内选择分支；循环块为每个元素压入一层子作用域；
 * 替换点的值（包括 Helper 返回值）按当前转义上下文转义，{@code {{{ }}}} 除外。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
final class DirectiveProcessor {

    private static final Logger log = LoggerFactory.getLogger(DirectiveProcessor.class);

    private final HelperRegistry helpers;

    DirectiveProcessor(HelperRegistry helpers) {
        this.helpers = helpers;
    }

    String process(List<Node> nodes, Scope scope, RenderContext context) {
        StringBuilder out = new StringBuilder();
        render(nodes, scope, context, out);
        return out.toString();
    }

    private void render(List<Node> nodes, Scope scope, RenderContext context, StringBuilder out) {
        for (Node node : nodes) {
            if (node instanceof Node.Text) {
                out.append(((Node.Text) node).getText());
            } else if (node instanceof Node.Substitution) {
                substitute((Node.Substitution) node, scope, context, out);
            } else if (node instanceof Node.If) {
                Node.If block = (Node.If) node;
                List<Node> branch = test(block.getCondition(), scope) ? block.getThenNodes() : block.getElseNodes();
                render(branch, scope, context, out);
            } else if (node instanceof Node.Each) {
                iterate((Node.Each) node, scope, context, out);
            } else {
                throw new IllegalStateException("Unsupported node: " + node);
            }
        }
    }

    private void substitute(Node.Substitution substitution, Scope scope, RenderContext context, StringBuilder out) {
        Expression expression = substitution.getExpression();
        Object value = evaluate(expression, scope);
        if (Undefined.isUndefined(value)) {
            if (expression instanceof Expression.Path) {
                String path = ((Expression.Path) expression).getText();
                log.debug("Unresolved variable '{}' in {}", path, context.getTemplateId());
                context.warnUnresolved(path);
            }
            return;
        }
        if (substitution.isRaw()) {
            out.append(Values.stringify(value));
        } else {
            out.append(ContextEscaper.escape(value, context.getEscapingContext()));
        }
    }

    private void iterate(Node.Each block, Scope scope, RenderContext context, StringBuilder out) {
        Object source = evaluate(block.getSource(), scope);
        if (!(source instanceof List)) {
            return;
        }
        List<?> items = (List<?>) source;
        int size = items.size();
        for (int i = 0; i < size; i++) {
            render(block.getBodyNodes(), scope.child(items.get(i), i, size), context, out);
        }
    }

    private boolean test(Condition condition, Scope scope) {
        if (condition instanceof Condition.Not) {
            return !test(((Condition.Not) condition).getInner(), scope);
        }
        return Values.isTruthy(evaluate(((Condition.Test) condition).getExpression(), scope));
    }

    private Object evaluate(Expression expression, Scope scope) {
        if (expression instanceof Expression.Literal) {
            return ((Expression.Literal) expression).getValue();
        }
        if (expression instanceof Expression.Path) {
            return VariableResolver.resolvePath((Expression.Path) expression, scope);
        }
        Expression.HelperCall call = (Expression.HelperCall) expression;
        List<Object> args = new ArrayList<>(call.getArguments().size());
        for (Expression argument : call.getArguments()) {
            args.add(evaluate(argument, scope));
        }
        return helpers.invoke(call.getName(), args);
    }
}
