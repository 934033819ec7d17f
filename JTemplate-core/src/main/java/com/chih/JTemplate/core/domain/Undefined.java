package com.chih.JTemplate.core.domain;

/**
 * 变量解析失败的标记值，与 null（显式提供的空值）区分开
 */
public enum Undefined {
    INSTANCE;

    public static boolean isUndefined(Object value) {
        return value == INSTANCE;
    }

    @Override
    public String toString() {
        return "undefined";
    }
}
