package com.chih.JTemplate.core.parse;

import com.chih.JTemplate.core.exception.TemplateSyntaxException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 模板词法分析器
 * <p>
 * 把模板文本切分为扁平的 Token 流：文本、替换、原样替换以及块标签。
 * 这里只识别标签的种类，块的配对由 {@link TemplateParser} 负责。
 * </p>
 *
 * <h3>支持的标签：</h3>
 * <pre>{@code
 * {{ expr }}          转义替换
 * {{{ expr }}}        原样替换
 * {{! expr }}         原样替换（旧写法，等同于三重花括号）
 * {{#if cond}}        条件开始
 * {{else}}            条件分支
 * {{/if}}             条件结束
 * {{#each expr}}      循环开始
 * {{/each}}           循环结束
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
public final class TemplateTokenizer {

    private static final String OPEN = "{{";
    private static final String CLOSE = "}}";
    private static final String RAW_OPEN = "{{{";
    private static final String RAW_CLOSE = "}}}";

    private final String text;
    private final int[] lineStarts;

    private TemplateTokenizer(String text) {
        this.text = text;
        this.lineStarts = computeLineStarts(text);
    }

    /**
     * 切分模板文本
     *
     * @param text 模板原文，不能为 null
     * @return Token 列表，按出现顺序排列
     * @throws TemplateSyntaxException 标签未闭合、表达式为空或块关键字未知
     */
    public static List<Token> tokenize(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Template text cannot be null");
        }
        return new TemplateTokenizer(text).run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        int pos = 0;
        int length = text.length();

        while (pos < length) {
            int open = text.indexOf(OPEN, pos);
            if (open < 0) {
                tokens.add(textToken(pos, length));
                break;
            }
            if (open > pos) {
                tokens.add(textToken(pos, open));
            }

            boolean raw = text.startsWith(RAW_OPEN, open);
            String closer = raw ? RAW_CLOSE : CLOSE;
            int contentStart = open + (raw ? RAW_OPEN.length() : OPEN.length());
            int close = text.indexOf(closer, contentStart);
            if (close < 0) {
                throw syntaxError("Unterminated tag, expected '" + closer + "'", open);
            }

            String content = text.substring(contentStart, close).trim();
            tokens.add(classify(content, raw, open));
            pos = close + closer.length();
        }
        return tokens;
    }

    private Token textToken(int start, int end) {
        int[] position = position(start);
        return new Token(TokenType.TEXT, text.substring(start, end), position[0], position[1]);
    }

    private Token classify(String content, boolean raw, int offset) {
        int[] position = position(offset);
        int line = position[0];
        int column = position[1];

        if (content.isEmpty()) {
            throw syntaxError("Empty expression", offset);
        }

        char first = content.charAt(0);
        if (first == '#' || first == '/' || "else".equals(content)) {
            if (raw) {
                throw syntaxError("Block tags cannot use triple braces: {{{" + content + "}}}", offset);
            }
        }

        if (first == '#') {
            String keyword = keyword(content.substring(1));
            String argument = content.substring(1 + keyword.length()).trim();
            TokenType type;
            if ("if".equals(keyword)) {
                type = TokenType.IF_OPEN;
            } else if ("each".equals(keyword)) {
                type = TokenType.EACH_OPEN;
            } else {
                throw syntaxError("Unknown block tag '#" + keyword + "'", offset);
            }
            if (argument.isEmpty()) {
                throw syntaxError("{{#" + keyword + "}} requires an expression", offset);
            }
            return new Token(type, argument, line, column);
        }

        if (first == '/') {
            String keyword = content.substring(1).trim();
            TokenType type;
            if ("if".equals(keyword)) {
                type = TokenType.IF_CLOSE;
            } else if ("each".equals(keyword)) {
                type = TokenType.EACH_CLOSE;
            } else {
                throw syntaxError("Unknown closing tag '/" + keyword + "'", offset);
            }
            return new Token(type, "", line, column);
        }

        if ("else".equals(content)) {
            return new Token(TokenType.ELSE, "", line, column);
        }

        if (first == '!' && !raw) {
            String expression = content.substring(1).trim();
            if (expression.isEmpty()) {
                throw syntaxError("Empty expression", offset);
            }
            return new Token(TokenType.RAW_SUBSTITUTION, expression, line, column);
        }

        return new Token(raw ? TokenType.RAW_SUBSTITUTION : TokenType.SUBSTITUTION, content, line, column);
    }

    private static String keyword(String afterHash) {
        int end = 0;
        while (end < afterHash.length() && !Character.isWhitespace(afterHash.charAt(end))) {
            end++;
        }
        return afterHash.substring(0, end);
    }

    private TemplateSyntaxException syntaxError(String message, int offset) {
        int[] position = position(offset);
        return new TemplateSyntaxException(message, position[0], position[1]);
    }

    /**
     * 偏移量换算为 [行, 列]，均从 1 开始
     */
    private int[] position(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        int lineIndex = index >= 0 ? index : -index - 2;
        return new int[]{lineIndex + 1, offset - lineStarts[lineIndex] + 1};
    }

    private static int[] computeLineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }
}
