package com.chih.JTemplate.core.parse;

import java.util.Objects;

/**
 * 词法单元
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
public final class Token {

    private final TokenType type;

    /**
     * TEXT 为原文；标签为去掉关键字后的表达式部分
     */
    private final String content;

    /**
     * 起始行与列，均从 1 开始
     */
    private final int line;
    private final int column;

    public Token(TokenType type, String content, int line, int column) {
        this.type = type;
        this.content = content;
        this.line = line;
        this.column = column;
    }

    public TokenType getType() {
        return type;
    }

    public String getContent() {
        return content;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * 还原成模板中的写法，用于错误信息
     */
    public String describe() {
        switch (type) {
            case TEXT:
                return "text";
            case SUBSTITUTION:
                return "{{" + content + "}}";
            case RAW_SUBSTITUTION:
                return "{{{" + content + "}}}";
            case IF_OPEN:
                return "{{#if " + content + "}}";
            case ELSE:
                return "{{else}}";
            case IF_CLOSE:
                return "{{/if}}";
            case EACH_OPEN:
                return "{{#each " + content + "}}";
            case EACH_CLOSE:
                return "{{/each}}";
            default:
                throw new IllegalStateException("Unknown token type: " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Token that = (Token) o;
        return type == that.type && line == that.line && column == that.column
                && Objects.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, content, line, column);
    }

    @Override
    public String toString() {
        return "Token{" + type + " '" + content + "' at " + line + ":" + column + '}';
    }
}
