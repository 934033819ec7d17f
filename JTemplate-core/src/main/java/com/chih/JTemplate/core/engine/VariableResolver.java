package com.chih.JTemplate.core.engine;

import com.chih.JTemplate.core.domain.Undefined;
import com.chih.JTemplate.core.parse.Expression;
import com.chih.JTemplate.core.parse.ExpressionParser;

import java.util.List;
import java.util.Map;

/**
 * 变量解析器：字面量直接返回，点分路径沿作用域链解析
 * <p>
 * 路径首段先在最内层作用域查找，找不到再查外层；后续各段依次访问 Map 的 key
 * 或 List 的下标（以及 length）。任何一步取不到值都返回 {@link Undefined#INSTANCE}，不抛异常。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public final class VariableResolver {

    private static final String LENGTH = "length";

    private VariableResolver() {
    }

    /**
     * 解析路径或字面量文本
     *
     * @param pathOrLiteral 例如 {@code user.name}、{@code 'api'}、{@code 42}
     * @param scope         当前作用域
     * @return 解析结果或 {@link Undefined#INSTANCE}
     * @throws IllegalArgumentException 文本是一个 Helper 调用
     */
    public static Object resolve(String pathOrLiteral, Scope scope) {
        Expression expression = ExpressionParser.parse(pathOrLiteral);
        if (expression instanceof Expression.Literal) {
            return ((Expression.Literal) expression).getValue();
        }
        if (expression instanceof Expression.Path) {
            return resolvePath((Expression.Path) expression, scope);
        }
        throw new IllegalArgumentException("Not a variable path or literal: " + pathOrLiteral);
    }

    public static Object resolvePath(Expression.Path path, Scope scope) {
        List<String> segments = path.getSegments();
        Object value = scope.lookup(segments.get(0));
        for (int i = 1; i < segments.size(); i++) {
            value = step(value, segments.get(i));
            if (Undefined.isUndefined(value)) {
                return value;
            }
        }
        return value;
    }

    private static Object step(Object current, String segment) {
        if (current == null || Undefined.isUndefined(current)) {
            return Undefined.INSTANCE;
        }
        if (current instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) current;
            return map.containsKey(segment) ? map.get(segment) : Undefined.INSTANCE;
        }
        if (current instanceof List) {
            List<?> list = (List<?>) current;
            if (LENGTH.equals(segment)) {
                return list.size();
            }
            int index = toIndex(segment);
            return index >= 0 && index < list.size() ? list.get(index) : Undefined.INSTANCE;
        }
        if (current instanceof String && LENGTH.equals(segment)) {
            return ((String) current).length();
        }
        return Undefined.INSTANCE;
    }

    private static int toIndex(String segment) {
        if (segment.isEmpty() || !segment.chars().allMatch(Character::isDigit)) {
            return -1;
        }
        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
