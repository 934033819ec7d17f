package com.chih.JTemplate.core.parse;

import com.chih.JTemplate.core.exception.TemplateSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * 递归下降的模板解析器
 * <p>
 * 输入 {@link TemplateTokenizer} 产生的扁平 Token 流，按块的开闭深度构建语法树。
 * 每个块只消费属于自己的结束标签，所以同类块嵌套（if 里套 if）、
 * 以及循环体内的条件块都能找到正确的结束位置。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
public final class TemplateParser {

    private final List<Token> tokens;
    private int cursor;

    private TemplateParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * 解析模板文本为节点序列
     *
     * @param text 模板原文
     * @return 顶层节点列表（不可变）
     * @throws TemplateSyntaxException 块未闭合、未匹配、嵌套错误或表达式非法
     */
    public static List<Node> parse(String text) {
        TemplateParser parser = new TemplateParser(TemplateTokenizer.tokenize(text));
        List<Node> nodes = parser.parseSequence();
        if (parser.hasNext()) {
            Token stray = parser.peek();
            if (stray.getType() == TokenType.ELSE) {
                throw error("{{else}} outside of {{#if}}", stray);
            }
            throw error("Unexpected " + stray.describe() + " without a matching opening block", stray);
        }
        return List.copyOf(nodes);
    }

    /**
     * 解析一段连续内容，遇到 else / 结束标签时停下，由外层块决定是否合法
     */
    private List<Node> parseSequence() {
        List<Node> nodes = new ArrayList<>();
        while (hasNext()) {
            Token token = peek();
            switch (token.getType()) {
                case TEXT:
                    cursor++;
                    nodes.add(new Node.Text(token.getContent()));
                    break;
                case SUBSTITUTION:
                case RAW_SUBSTITUTION:
                    cursor++;
                    nodes.add(new Node.Substitution(expression(token),
                            token.getType() == TokenType.RAW_SUBSTITUTION));
                    break;
                case IF_OPEN:
                    cursor++;
                    nodes.add(parseIf(token));
                    break;
                case EACH_OPEN:
                    cursor++;
                    nodes.add(parseEach(token));
                    break;
                default:
                    return nodes;
            }
        }
        return nodes;
    }

    private Node parseIf(Token opener) {
        Condition condition;
        try {
            condition = ExpressionParser.parseCondition(opener.getContent());
        } catch (TemplateSyntaxException e) {
            throw error(e.getMessage(), opener);
        }

        List<Node> thenNodes = parseSequence();
        List<Node> elseNodes = List.of();

        Token closer = next(opener);
        if (closer.getType() == TokenType.ELSE) {
            elseNodes = parseSequence();
            closer = next(opener);
            if (closer.getType() == TokenType.ELSE) {
                throw error("Duplicate {{else}} in " + opener.describe() + " opened at line " + opener.getLine(), closer);
            }
        }
        if (closer.getType() != TokenType.IF_CLOSE) {
            throw error("Expected {{/if}} to close " + opener.describe() + " opened at line "
                    + opener.getLine() + " but found " + closer.describe(), closer);
        }
        return new Node.If(condition, thenNodes, elseNodes);
    }

    private Node parseEach(Token opener) {
        Expression source = expression(opener);
        List<Node> body = parseSequence();

        Token closer = next(opener);
        if (closer.getType() == TokenType.ELSE) {
            throw error("{{else}} is only allowed inside {{#if}}", closer);
        }
        if (closer.getType() != TokenType.EACH_CLOSE) {
            throw error("Expected {{/each}} to close " + opener.describe() + " opened at line "
                    + opener.getLine() + " but found " + closer.describe(), closer);
        }
        return new Node.Each(source, body);
    }

    private static Expression expression(Token token) {
        try {
            return ExpressionParser.parse(token.getContent());
        } catch (TemplateSyntaxException e) {
            throw error(e.getMessage(), token);
        }
    }

    private boolean hasNext() {
        return cursor < tokens.size();
    }

    private Token peek() {
        return tokens.get(cursor);
    }

    /**
     * 取下一个 Token；已到末尾说明 opener 没有闭合
     */
    private Token next(Token opener) {
        if (!hasNext()) {
            throw error("Unterminated " + opener.describe(), opener);
        }
        return tokens.get(cursor++);
    }

    private static TemplateSyntaxException error(String message, Token token) {
        return new TemplateSyntaxException(message, token.getLine(), token.getColumn());
    }
}
