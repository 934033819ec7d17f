package com.chih.JTemplate.core.domain;

import java.util.Objects;

/**
 * 模板：不可变的原始文本 + 可选的来源标识
 * <p>
 * 来源标识（通常是文件路径）只用于推断转义上下文和缓存，不参与渲染。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
public final class Template {

    private final String text;
    private final String origin;

    public Template(String text, String origin) {
        if (text == null) {
            throw new IllegalArgumentException("Template text cannot be null");
        }
        this.text = text;
        this.origin = origin;
    }

    /**
     * 内联模板，无来源标识
     */
    public static Template of(String text) {
        return new Template(text, null);
    }

    public static Template fromOrigin(String origin, String text) {
        return new Template(text, Objects.requireNonNull(origin, "origin"));
    }

    public String getText() {
        return text;
    }

    public String getOrigin() {
        return origin;
    }

    public boolean hasOrigin() {
        return origin != null && !origin.isBlank();
    }

    /**
     * 用于日志与监控的标识
     */
    public String displayName() {
        return hasOrigin() ? origin : "<inline>";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Template that = (Template) o;
        return text.equals(that.text) && Objects.equals(origin, that.origin);
    }

    @Override
    public int hashCode() {
        return 31 * text.hashCode() + Objects.hashCode(origin);
    }

    @Override
    public String toString() {
        return "Template{origin='" + origin + "', length=" + text.length() + '}';
    }
}
