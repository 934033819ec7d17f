package com.chih.JTemplate.core.exception;

/**
 * 模板语法错误：标签未闭合、块未匹配或嵌套错误、表达式非法。
 * <p>
 * 该异常会中止整次渲染，不返回任何部分输出。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
public class TemplateSyntaxException extends JTemplateException {

    private final int line;
    private final int column;

    public TemplateSyntaxException(String message, int line, int column) {
        super(message + " (line " + line + ", column " + column + ")");
        this.line = line;
        this.column = column;
    }

    /**
     * 表达式内部的错误，无法定位到行列时使用
     */
    public TemplateSyntaxException(String message) {
        super(message);
        this.line = -1;
        this.column = -1;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
