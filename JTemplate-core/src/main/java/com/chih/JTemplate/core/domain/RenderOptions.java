package com.chih.JTemplate.core.domain;

import java.util.Objects;

/**
 * 渲染选项
 * <p>
 * 不可变；{@code withXxx} 方法返回修改后的副本。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
public final class RenderOptions {

    private static final RenderOptions DEFAULTS = new RenderOptions(null, null, false);

    /**
     * 显式指定的转义上下文，为 null 时根据来源推断
     */
    private final EscapingContext context;

    /**
     * 内联模板的来源标识，仅用于上下文推断
     */
    private final String origin;

    /**
     * 严格模式：渲染前审计，缺失变量直接失败
     */
    private final boolean strict;

    public RenderOptions(EscapingContext context, String origin, boolean strict) {
        this.context = context;
        this.origin = origin;
        this.strict = strict;
    }

    public static RenderOptions defaults() {
        return DEFAULTS;
    }

    public static RenderOptions context(EscapingContext context) {
        return new RenderOptions(context, null, false);
    }

    public static RenderOptions context(String contextName) {
        return context(EscapingContext.fromName(contextName));
    }

    public static RenderOptions origin(String origin) {
        return new RenderOptions(null, origin, false);
    }

    public RenderOptions withContext(EscapingContext newContext) {
        return new RenderOptions(newContext, origin, strict);
    }

    public RenderOptions withOrigin(String newOrigin) {
        return new RenderOptions(context, newOrigin, strict);
    }

    public RenderOptions withStrict(boolean newStrict) {
        return new RenderOptions(context, origin, newStrict);
    }

    public EscapingContext getContext() {
        return context;
    }

    public String getOrigin() {
        return origin;
    }

    public boolean isStrict() {
        return strict;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RenderOptions that = (RenderOptions) o;
        return strict == that.strict && context == that.context && Objects.equals(origin, that.origin);
    }

    @Override
    public int hashCode() {
        return Objects.hash(context, origin, strict);
    }

    @Override
    public String toString() {
        return "RenderOptions{" +
                "context=" + context +
                ", origin='" + origin + '\'' +
                ", strict=" + strict +
                '}';
    }
}
