package com.chih.JTemplate.core.engine;

import com.chih.JTemplate.core.domain.AuditReport;
import com.chih.JTemplate.core.exception.TemplateSyntaxException;
import com.chih.JTemplate.core.parse.Expression;
import com.chih.JTemplate.core.parse.ExpressionParser;
import com.chih.JTemplate.core.parse.Token;
import com.chih.JTemplate.core.parse.TemplateTokenizer;
import com.chih.JTemplate.core.parse.TokenType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 变量审计：找出模板以普通变量形式引用、但绑定中没有提供的顶层名称
 * <p>
 * 只检查替换点中单独出现的路径；Helper 调用、字面量、条件和循环目标不参与审计，
 * this、@index 等循环内名称也会被跳过。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public final class VariableAuditor {

    private VariableAuditor() {
    }

    /**
     * @param text     模板原文
     * @param bindings 根作用域绑定，可为 null
     * @return 审计报告
     * @throws TemplateSyntaxException 模板无法切分或表达式非法
     */
    public static AuditReport audit(String text, Map<String, ?> bindings) {
        Set<String> referenced = new LinkedHashSet<>();
        for (Token token : TemplateTokenizer.tokenize(text)) {
            if (token.getType() != TokenType.SUBSTITUTION && token.getType() != TokenType.RAW_SUBSTITUTION) {
                continue;
            }
            Expression expression;
            try {
                expression = ExpressionParser.parse(token.getContent());
            } catch (TemplateSyntaxException e) {
                throw new TemplateSyntaxException(e.getMessage(), token.getLine(), token.getColumn());
            }
            if (expression instanceof Expression.Path) {
                Expression.Path path = (Expression.Path) expression;
                if (!path.isLoopLocal()) {
                    referenced.add(path.getHead());
                }
            }
        }

        List<String> missing = new ArrayList<>();
        for (String name : referenced) {
            if (bindings == null || !bindings.containsKey(name)) {
                missing.add(name);
            }
        }
        return new AuditReport(new ArrayList<>(referenced), missing);
    }
}
