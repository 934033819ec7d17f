package com.chih.JTemplate.core.support;

import com.chih.JTemplate.core.domain.EscapingContext;

import java.util.Locale;

/**
 * 根据模板来源（文件路径）推断转义上下文
 * <p>
 * 规则按顺序匹配，末尾的 {@code .template} 后缀会先被去掉：
 * <ol>
 *   <li>.sh / .bash，或文件名包含 script → shell</li>
 *   <li>.js / .mjs / .ts → script</li>
 *   <li>.json → structured-literal</li>
 *   <li>.html / .htm → markup</li>
 *   <li>文件名包含 wrangler 或 .toml → shell</li>
 *   <li>其余 → markup</li>
 * </ol>
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public final class ContextDetector {

    private static final String TEMPLATE_SUFFIX = ".template";

    private ContextDetector() {
    }

    public static EscapingContext detect(String origin) {
        if (origin == null || origin.isBlank()) {
            return EscapingContext.MARKUP;
        }

        String filename = filename(origin).toLowerCase(Locale.ROOT);
        if (filename.endsWith(TEMPLATE_SUFFIX) && filename.length() > TEMPLATE_SUFFIX.length()) {
            filename = filename.substring(0, filename.length() - TEMPLATE_SUFFIX.length());
        }
        String ext = extension(filename);

        if (ext.equals(".sh") || ext.equals(".bash") || filename.contains("script")) {
            return EscapingContext.SHELL;
        }
        if (ext.equals(".js") || ext.equals(".mjs") || ext.equals(".ts")) {
            return EscapingContext.SCRIPT;
        }
        if (ext.equals(".json")) {
            return EscapingContext.STRUCTURED_LITERAL;
        }
        if (ext.equals(".html") || ext.equals(".htm")) {
            return EscapingContext.MARKUP;
        }
        if (filename.contains("wrangler") || filename.contains(".toml")) {
            return EscapingContext.SHELL;
        }
        return EscapingContext.MARKUP;
    }

    private static String filename(String origin) {
        int lastSlash = Math.max(origin.lastIndexOf('/'), origin.lastIndexOf('\\'));
        return lastSlash >= 0 ? origin.substring(lastSlash + 1) : origin;
    }

    private static String extension(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(dot) : "";
    }
}
