package com.chih.JTemplate.core.support;

import com.chih.JTemplate.core.domain.Undefined;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 绑定值的公共语义：真值判断、相等、比较与字符串化
 * <p>
 * 绑定值只有以下几种：String、Number、Boolean、null、List、Map。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public final class Values {

    private static final ObjectMapper JSON_MAPPER = TemplateObjectMapperFactory.createJsonMapper();

    private Values() {
    }

    /**
     * 真值规则：null、未定义、false、空字符串、数字 0 / NaN、空列表为假，其余为真
     */
    public static boolean isTruthy(Object value) {
        if (value == null || Undefined.isUndefined(value)) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return !((String) value).isEmpty();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return d != 0.0 && !Double.isNaN(d);
        }
        if (value instanceof Number) {
            return toBigDecimal((Number) value).signum() != 0;
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        return true;
    }

    /**
     * 严格相等：不做类型转换，但不同数字类型按数值比较（1 与 1.0 相等）
     */
    public static boolean strictEquals(Object left, Object right) {
        Object a = normalize(left);
        Object b = normalize(right);
        if (a instanceof Number && b instanceof Number) {
            Number x = (Number) a;
            Number y = (Number) b;
            if (isNaN(x) || isNaN(y)) {
                return false;
            }
            return compareNumbers(x, y) == 0;
        }
        return Objects.equals(a, b);
    }

    /**
     * 比较两个同类值（都是数字或都是字符串）
     *
     * @return 负数、0、正数；类型不可比较时返回 null
     */
    public static Integer compare(Object left, Object right) {
        Object a = normalize(left);
        Object b = normalize(right);
        if (a instanceof Number && b instanceof Number) {
            Number x = (Number) a;
            Number y = (Number) b;
            if (isNaN(x) || isNaN(y)) {
                return null;
            }
            return compareNumbers(x, y);
        }
        if (a instanceof String && b instanceof String) {
            return ((String) a).compareTo((String) b);
        }
        return null;
    }

    /**
     * 转成输出字符串：null / 未定义为空串，整数值的浮点数不带 .0，
     * 列表按逗号连接，Map 输出为 JSON
     */
    public static String stringify(Object value) {
        if (value == null || Undefined.isUndefined(value)) {
            return "";
        }
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return String.valueOf(d);
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).stripTrailingZeros().toPlainString();
        }
        if (value instanceof List) {
            return ((List<?>) value).stream().map(Values::stringify).collect(Collectors.joining(","));
        }
        if (value instanceof Map<?, ?>) {
            try {
                return JSON_MAPPER.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Cannot render map value as JSON", e);
            }
        }
        return String.valueOf(value);
    }

    /**
     * 未定义统一视为 null，Helper 和比较逻辑看不到 {@link Undefined}
     */
    public static Object normalize(Object value) {
        return Undefined.isUndefined(value) ? null : value;
    }

    public static String kindOf(Object value) {
        Object v = normalize(value);
        if (v == null) {
            return "null";
        }
        if (v instanceof String) {
            return "string";
        }
        if (v instanceof Number) {
            return "number";
        }
        if (v instanceof Boolean) {
            return "boolean";
        }
        if (v instanceof List<?>) {
            return "list";
        }
        if (v instanceof Map<?, ?>) {
            return "map";
        }
        return v.getClass().getSimpleName();
    }

    private static int compareNumbers(Number x, Number y) {
        if (isInfinite(x) || isInfinite(y)) {
            return Double.compare(x.doubleValue(), y.doubleValue());
        }
        return toBigDecimal(x).compareTo(toBigDecimal(y));
    }

    private static boolean isInfinite(Number n) {
        return (n instanceof Double || n instanceof Float) && Double.isInfinite(n.doubleValue());
    }

    private static boolean isNaN(Number n) {
        return (n instanceof Double || n instanceof Float) && Double.isNaN(n.doubleValue());
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal) {
            return (BigDecimal) n;
        }
        if (n instanceof Double || n instanceof Float) {
            return BigDecimal.valueOf(n.doubleValue());
        }
        return new BigDecimal(n.toString());
    }
}
