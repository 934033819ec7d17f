package com.chih.JTemplate.core.impl;

import com.chih.JTemplate.core.domain.EscapingContext;
import com.chih.JTemplate.core.exception.HelperContractException;
import com.chih.JTemplate.core.spi.Helper;
import com.chih.JTemplate.core.spi.HelperProvider;
import com.chih.JTemplate.core.support.ContextEscaper;
import com.chih.JTemplate.core.support.Values;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.IntPredicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * 内置 Helper
 * <p>
 * 每个 Helper 同时注册规范名称和旧版别名（如 equals / eq）。
 * </p>
 *
 * <h3>分组：</h3>
 * <ul>
 *   <li>比较：equals、notEquals、lessThan、greaterThan、lessOrEqual、greaterOrEqual</li>
 *   <li>逻辑：and、or、not</li>
 *   <li>集合：includes、join</li>
 *   <li>大小写：capitalize、lowercase、uppercase</li>
 *   <li>默认值：default</li>
 *   <li>转义：escapeMarkup、escapeScript、escapeShell、escapeStructuredLiteral、escapeUrl、escapeFor、safeString</li>
 * </ul>
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public class BuiltinHelpers implements HelperProvider {

    private static final String DEFAULT_SEPARATOR = ", ";

    private final Map<String, Helper> helpers;

    public BuiltinHelpers() {
        Map<String, Helper> map = new LinkedHashMap<>();

        register(map, exactly(2, "equals", args -> Values.strictEquals(args.get(0), args.get(1))), "eq");
        register(map, exactly(2, "notEquals", args -> !Values.strictEquals(args.get(0), args.get(1))), "ne");
        register(map, ordering("lessThan", c -> c < 0), "lt");
        register(map, ordering("greaterThan", c -> c > 0), "gt");
        register(map, ordering("lessOrEqual", c -> c <= 0), "lte");
        register(map, ordering("greaterOrEqual", c -> c >= 0), "gte");

        map.put("and", args -> args.stream().allMatch(Values::isTruthy));
        map.put("or", args -> args.stream().anyMatch(Values::isTruthy));
        map.put("not", exactly(1, "not", args -> !Values.isTruthy(args.get(0))));

        map.put("includes", exactly(2, "includes", BuiltinHelpers::includes));
        map.put("join", between(1, 2, "join", BuiltinHelpers::join));

        map.put("capitalize", exactly(1, "capitalize", args -> transform("capitalize", args.get(0),
                s -> s.isEmpty() ? s : s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1))));
        map.put("lowercase", exactly(1, "lowercase", args -> transform("lowercase", args.get(0),
                s -> s.toLowerCase(Locale.ROOT))));
        map.put("uppercase", exactly(1, "uppercase", args -> transform("uppercase", args.get(0),
                s -> s.toUpperCase(Locale.ROOT))));

        map.put("default", exactly(2, "default", args -> Values.isTruthy(args.get(0)) ? args.get(0) : args.get(1)));

        register(map, escaping("escapeMarkup", EscapingContext.MARKUP), "escapeHtml");
        register(map, escaping("escapeScript", EscapingContext.SCRIPT), "escapeJs");
        map.put("escapeShell", escaping("escapeShell", EscapingContext.SHELL));
        register(map, escaping("escapeStructuredLiteral", EscapingContext.STRUCTURED_LITERAL), "escapeJson");
        map.put("escapeUrl", escaping("escapeUrl", EscapingContext.URL));
        map.put("escapeFor", exactly(2, "escapeFor",
                args -> ContextEscaper.escape(args.get(1), contextArgument("escapeFor", args.get(0)))));
        map.put("safeString", between(1, 2, "safeString", args -> ContextEscaper.escape(args.get(0),
                args.size() > 1 ? contextArgument("safeString", args.get(1)) : EscapingContext.MARKUP)));

        this.helpers = Collections.unmodifiableMap(map);
    }

    @Override
    public Map<String, Helper> helpers() {
        return helpers;
    }

    private static void register(Map<String, Helper> map, NamedHelper helper, String alias) {
        map.put(helper.getName(), helper);
        map.put(alias, helper);
    }

    private static Object includes(List<Object> args) {
        Object list = args.get(0);
        if (list == null) {
            return false;
        }
        if (!(list instanceof List)) {
            throw new HelperContractException("includes", "first argument must be a list, got " + Values.kindOf(list));
        }
        return ((List<?>) list).stream().anyMatch(item -> Values.strictEquals(item, args.get(1)));
    }

    private static Object join(List<Object> args) {
        Object list = args.get(0);
        if (list == null) {
            return null;
        }
        if (!(list instanceof List)) {
            throw new HelperContractException("join", "first argument must be a list, got " + Values.kindOf(list));
        }
        String separator = DEFAULT_SEPARATOR;
        if (args.size() > 1) {
            if (!(args.get(1) instanceof String)) {
                throw new HelperContractException("join", "separator must be a string, got " + Values.kindOf(args.get(1)));
            }
            separator = (String) args.get(1);
        }
        return ((List<?>) list).stream().map(Values::stringify).collect(Collectors.joining(separator));
    }

    private static Object transform(String name, Object value, UnaryOperator<String> fn) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw new HelperContractException(name, "argument must be a string, got " + Values.kindOf(value));
        }
        return fn.apply((String) value);
    }

    private static EscapingContext contextArgument(String name, Object value) {
        if (!(value instanceof String)) {
            throw new HelperContractException(name, "context must be a string, got " + Values.kindOf(value));
        }
        return EscapingContext.fromName((String) value);
    }

    private static NamedHelper ordering(String name, IntPredicate test) {
        return exactly(2, name, args -> {
            Integer result = Values.compare(args.get(0), args.get(1));
            if (result == null) {
                throw new HelperContractException(name, "cannot compare " + Values.kindOf(args.get(0))
                        + " with " + Values.kindOf(args.get(1)));
            }
            return test.test(result);
        });
    }

    private static NamedHelper escaping(String name, EscapingContext context) {
        return exactly(1, name, args -> ContextEscaper.escape(args.get(0), context));
    }

    private static NamedHelper exactly(int arity, String name, Helper body) {
        return between(arity, arity, name, body);
    }

    private static NamedHelper between(int min, int max, String name, Helper body) {
        return new NamedHelper(name, args -> {
            if (args.size() < min || args.size() > max) {
                String expected = min == max ? String.valueOf(min) : min + ".." + max;
                throw new HelperContractException(name, "expected " + expected + " argument(s), got " + args.size());
            }
            return body.apply(args);
        });
    }

    /**
     * 带名称的 Helper，名称用于错误信息和别名注册
     */
    private static final class NamedHelper implements Helper {

        private final String name;
        private final Helper body;

        NamedHelper(String name, Helper body) {
            this.name = name;
            this.body = body;
        }

        String getName() {
            return name;
        }

        @Override
        public Object apply(List<Object> args) {
            return body.apply(args);
        }
    }
}
