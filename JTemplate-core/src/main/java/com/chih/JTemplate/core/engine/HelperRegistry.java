package com.chih.JTemplate.core.engine;

import com.chih.JTemplate.core.domain.Undefined;
import com.chih.JTemplate.core.exception.HelperContractException;
import com.chih.JTemplate.core.exception.JTemplateException;
import com.chih.JTemplate.core.exception.UnknownHelperException;
import com.chih.JTemplate.core.impl.BuiltinHelpers;
import com.chih.JTemplate.core.spi.Helper;
import com.chih.JTemplate.core.spi.HelperProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Helper 注册表
 * <p>
 * 通过 {@link #builder()} 一次性构建，构建完成后不可修改，可以在多个线程间共享。
 * 调用 Helper 时只传入已解析的参数：未定义值转为 null，List / Map 包装为只读视图，
 * Helper 无法修改调用方的绑定数据。
 * </p>
 *
 * <pre>{@code
 * HelperRegistry registry = HelperRegistry.builder()
 *         .withBuiltins()
 *         .register("shout", args -> args.get(0) + "!")
 *         .build();
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public final class HelperRegistry {

    private static final Logger log = LoggerFactory.getLogger(HelperRegistry.class);

    private static final Pattern NAME = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$-]*");

    private final Map<String, Helper> helpers;

    private HelperRegistry(Map<String, Helper> helpers) {
        this.helpers = Collections.unmodifiableMap(new LinkedHashMap<>(helpers));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 只包含内置 Helper 的注册表
     */
    public static HelperRegistry withBuiltins() {
        return builder().withBuiltins().build();
    }

    public boolean contains(String name) {
        return helpers.containsKey(name);
    }

    /**
     * @return 已注册的名称（含别名），按注册顺序
     */
    public Set<String> names() {
        return helpers.keySet();
    }

    /**
     * 调用 Helper
     *
     * @param name Helper 名称
     * @param args 已解析的参数
     * @return Helper 返回值
     * @throws UnknownHelperException  名称未注册
     * @throws HelperContractException 参数数量或类型不符
     */
    public Object invoke(String name, List<?> args) {
        Helper helper = helpers.get(name);
        if (helper == null) {
            throw new UnknownHelperException(name);
        }

        List<Object> safeArgs = new ArrayList<>(args.size());
        for (Object arg : args) {
            safeArgs.add(readOnly(arg));
        }

        try {
            return helper.apply(Collections.unmodifiableList(safeArgs));
        } catch (JTemplateException e) {
            throw e;
        } catch (ClassCastException | IllegalArgumentException | UnsupportedOperationException e) {
            throw new HelperContractException(name, e.getMessage(), e);
        }
    }

    private static Object readOnly(Object value) {
        if (Undefined.isUndefined(value)) {
            return null;
        }
        if (value instanceof List) {
            return Collections.unmodifiableList((List<?>) value);
        }
        if (value instanceof Map) {
            return Collections.unmodifiableMap((Map<?, ?>) value);
        }
        return value;
    }

    public static final class Builder {

        private final Map<String, Helper> helpers = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 注册一个 Helper，同名时后注册的覆盖先注册的
         */
        public Builder register(String name, Helper helper) {
            if (name == null || !NAME.matcher(name).matches()) {
                throw new IllegalArgumentException("Invalid helper name: " + name);
            }
            if (helper == null) {
                throw new IllegalArgumentException("Helper cannot be null: " + name);
            }
            if (helpers.put(name, helper) != null) {
                log.debug("Helper '{}' overridden", name);
            }
            return this;
        }

        public Builder registerAll(HelperProvider provider) {
            if (provider == null) {
                throw new IllegalArgumentException("HelperProvider cannot be null");
            }
            provider.helpers().forEach(this::register);
            return this;
        }

        public Builder withBuiltins() {
            return registerAll(new BuiltinHelpers());
        }

        public HelperRegistry build() {
            log.debug("Helper registry built with {} helpers", helpers.size());
            return new HelperRegistry(helpers);
        }
    }
}
