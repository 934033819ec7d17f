package com.chih.JTemplate.core.parse;

import com.chih.JTemplate.core.exception.TemplateSyntaxException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 表达式解析器
 * <p>
 * 语法：
 * <pre>{@code
 * expression := call | argument
 * call       := NAME argument+            (空格分隔的多个词)
 * argument   := literal | path | '(' NAME argument* ')'
 * literal    := 'text' | "text" | number | true | false | null
 * path       := segment ('.' segment)*
 * }</pre>
 * 路径中不会出现空格，因此 {@code {{helper a.b.c}}} 是以 a.b.c 为参数的调用；
 * 单个词永远是路径或字面量。零参数调用和嵌套调用使用括号形式 {@code (name ...)}。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
public final class ExpressionParser {

    private static final Pattern HELPER_NAME = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$-]*");
    private static final Pattern PATH_SEGMENT = Pattern.compile("[@A-Za-z_$][A-Za-z0-9_$-]*|\\d+");
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");

    private enum LexemeType { WORD, STRING, LPAREN, RPAREN }

    private static final class Lexeme {
        private final LexemeType type;
        private final String text;

        Lexeme(LexemeType type, String text) {
            this.type = type;
            this.text = text;
        }
    }

    private final String source;
    private final List<Lexeme> lexemes;
    private int cursor;

    private ExpressionParser(String source) {
        this.source = source;
        this.lexemes = lex(source);
    }

    /**
     * 解析替换点或循环目标中的表达式
     *
     * @throws TemplateSyntaxException 表达式非法（不带行列信息，由调用方补充）
     */
    public static Expression parse(String source) {
        return new ExpressionParser(source).parseExpression();
    }

    /**
     * 解析 {{#if}} 条件：前导 ! 表示取反，可以叠加
     */
    public static Condition parseCondition(String source) {
        String trimmed = source == null ? "" : source.trim();
        if (trimmed.startsWith("!")) {
            String inner = trimmed.substring(1).trim();
            if (inner.isEmpty()) {
                throw new TemplateSyntaxException("Negation '!' must be followed by a condition");
            }
            return new Condition.Not(parseCondition(inner));
        }
        return new Condition.Test(parse(trimmed));
    }

    private Expression parseExpression() {
        if (lexemes.isEmpty()) {
            throw new TemplateSyntaxException("Empty expression");
        }

        Expression expression;
        Lexeme first = lexemes.get(0);
        if (first.type == LexemeType.WORD && lexemes.size() > 1) {
            cursor = 1;
            String name = helperName(first.text);
            List<Expression> arguments = new ArrayList<>();
            while (cursor < lexemes.size()) {
                arguments.add(parseArgument());
            }
            expression = new Expression.HelperCall(name, arguments);
        } else {
            expression = parseArgument();
        }

        if (cursor < lexemes.size()) {
            throw new TemplateSyntaxException("Unexpected '" + lexemes.get(cursor).text + "' in expression: " + source);
        }
        return expression;
    }

    private Expression parseArgument() {
        Lexeme lexeme = lexemes.get(cursor++);
        switch (lexeme.type) {
            case STRING:
                return new Expression.Literal(lexeme.text);
            case WORD:
                return wordToExpression(lexeme.text);
            case LPAREN:
                return parseParenthesizedCall();
            default:
                throw new TemplateSyntaxException("Unbalanced ')' in expression: " + source);
        }
    }

    private Expression parseParenthesizedCall() {
        if (cursor >= lexemes.size() || lexemes.get(cursor).type != LexemeType.WORD) {
            throw new TemplateSyntaxException("Expected helper name after '(' in expression: " + source);
        }
        String name = helperName(lexemes.get(cursor++).text);
        List<Expression> arguments = new ArrayList<>();
        while (cursor < lexemes.size() && lexemes.get(cursor).type != LexemeType.RPAREN) {
            arguments.add(parseArgument());
        }
        if (cursor >= lexemes.size()) {
            throw new TemplateSyntaxException("Missing ')' in expression: " + source);
        }
        cursor++;
        return new Expression.HelperCall(name, arguments);
    }

    private String helperName(String word) {
        if (!HELPER_NAME.matcher(word).matches() || isKeywordLiteral(word)) {
            throw new TemplateSyntaxException("'" + word + "' is not a valid helper name in expression: " + source);
        }
        return word;
    }

    private Expression wordToExpression(String word) {
        switch (word) {
            case "true":
                return new Expression.Literal(Boolean.TRUE);
            case "false":
                return new Expression.Literal(Boolean.FALSE);
            case "null":
                return new Expression.Literal(null);
            default:
                break;
        }
        if (DECIMAL.matcher(word).matches()) {
            return new Expression.Literal(parseNumber(word));
        }

        List<String> segments = Arrays.asList(word.split("\\.", -1));
        for (String segment : segments) {
            if (!PATH_SEGMENT.matcher(segment).matches()) {
                throw new TemplateSyntaxException("Invalid variable path '" + word + "'");
            }
        }
        return new Expression.Path(segments);
    }

    private static boolean isKeywordLiteral(String word) {
        return "true".equals(word) || "false".equals(word) || "null".equals(word);
    }

    private static Number parseNumber(String word) {
        if (INTEGER.matcher(word).matches()) {
            try {
                long value = Long.parseLong(word);
                if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                    return (int) value;
                }
                return value;
            } catch (NumberFormatException e) {
                return Double.parseDouble(word);
            }
        }
        return Double.parseDouble(word);
    }

    private static List<Lexeme> lex(String source) {
        List<Lexeme> result = new ArrayList<>();
        int i = 0;
        int length = source.length();
        while (i < length) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                result.add(new Lexeme(LexemeType.LPAREN, "("));
                i++;
            } else if (c == ')') {
                result.add(new Lexeme(LexemeType.RPAREN, ")"));
                i++;
            } else if (c == '\'' || c == '"') {
                int end = source.indexOf(c, i + 1);
                if (end < 0) {
                    throw new TemplateSyntaxException("Unterminated string literal in expression: " + source);
                }
                result.add(new Lexeme(LexemeType.STRING, source.substring(i + 1, end)));
                i = end + 1;
            } else {
                int start = i;
                while (i < length && !Character.isWhitespace(source.charAt(i))
                        && source.charAt(i) != '(' && source.charAt(i) != ')') {
                    i++;
                }
                result.add(new Lexeme(LexemeType.WORD, source.substring(start, i)));
            }
        }
        return result;
    }
}
