package com.chih.JTemplate.core.engine;

import com.chih.JTemplate.core.domain.Undefined;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 绑定环境中的一层作用域
 * <p>
 * 根作用域保存调用方传入的绑定；每次循环迭代压入一层子作用域，
 * 只包含 this、@index、@first、@last，并通过 parent 指针访问外层。
 * 作用域创建后不可修改，迭代结束后直接丢弃。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public final class Scope {

    public static final String THIS = "this";
    public static final String INDEX = "@index";
    public static final String FIRST = "@first";
    public static final String LAST = "@last";

    private final Map<String, Object> values;
    private final Scope parent;

    private Scope(Map<String, Object> values, Scope parent) {
        this.values = values;
        this.parent = parent;
    }

    /**
     * 根作用域，对绑定做一次浅拷贝（允许 null 值）
     */
    public static Scope root(Map<String, ?> bindings) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (bindings != null) {
            copy.putAll(bindings);
        }
        return new Scope(Collections.unmodifiableMap(copy), null);
    }

    /**
     * 为一次循环迭代创建子作用域
     *
     * @param item  当前元素
     * @param index 从 0 开始的下标
     * @param size  列表长度
     */
    public Scope child(Object item, int index, int size) {
        Map<String, Object> loop = new LinkedHashMap<>(4);
        loop.put(THIS, item);
        loop.put(INDEX, index);
        loop.put(FIRST, index == 0);
        loop.put(LAST, index == size - 1);
        return new Scope(Collections.unmodifiableMap(loop), this);
    }

    /**
     * 从当前层开始逐层向外查找名称
     *
     * @return 找到的值（可能为 null）；找不到返回 {@link Undefined#INSTANCE}
     */
    public Object lookup(String name) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            if (scope.values.containsKey(name)) {
                return scope.values.get(name);
            }
        }
        return Undefined.INSTANCE;
    }

    Scope getParent() {
        return parent;
    }

    boolean isRoot() {
        return parent == null;
    }

    /**
     * 当前层的只读视图
     */
    Map<String, Object> getValues() {
        return values;
    }
}
