package com.chih.JTemplate.core.domain;

import com.chih.JTemplate.core.exception.EscapingContextException;

import java.util.Locale;
import java.util.Set;

/**
 * 转义上下文：输出目标语法决定了替换值的编码方式
 * <p>
 * 一次渲染只有一个生效的上下文；{@link #RAW} 只能通过 {@code {{{ }}}} 在替换点显式使用。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
public enum EscapingContext {

    MARKUP("markup", "html"),
    SCRIPT("script", "js", "javascript"),
    SHELL("shell", "bash", "shell-command"),
    STRUCTURED_LITERAL("structured-literal", "json"),
    URL("url"),
    RAW("raw", "none");

    private final String canonicalName;
    private final Set<String> aliases;

    EscapingContext(String canonicalName, String... aliases) {
        this.canonicalName = canonicalName;
        this.aliases = Set.of(aliases);
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    /**
     * 按名称解析上下文（大小写不敏感，支持别名）
     *
     * @param name 上下文名称，如 html / js / shell / json / url / raw
     * @return 对应的上下文
     * @throws EscapingContextException 名称为空或不受支持
     */
    public static EscapingContext fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new EscapingContextException("Escaping context name cannot be empty");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (EscapingContext context : values()) {
            if (context.canonicalName.equals(normalized)
                    || context.aliases.contains(normalized)
                    || context.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return context;
            }
        }
        throw new EscapingContextException("Unsupported escaping context: " + name);
    }
}
