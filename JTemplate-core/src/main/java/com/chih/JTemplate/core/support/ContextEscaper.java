package com.chih.JTemplate.core.support;

import com.chih.JTemplate.core.domain.EscapingContext;
import com.chih.JTemplate.core.domain.Undefined;
import com.fasterxml.jackson.core.io.JsonStringEncoder;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * 按输出目标语法转义字符串
 * <p>
 * 所有方法都是纯函数，线程安全。null 与未定义值转义为空串。
 * </p>
 *
 * <table>
 *   <caption>转义规则</caption>
 *   <tr><td>markup</td><td>{@code & < > " ' / ` =} 替换为实体</td></tr>
 *   <tr><td>script</td><td>反斜杠、引号、控制字符以及 U+2028 / U+2029 加反斜杠</td></tr>
 *   <tr><td>shell</td><td>整体包进单引号，内部单引号写成 {@code '\''}</td></tr>
 *   <tr><td>structured-literal</td><td>JSON 字符串编码，不带外层引号</td></tr>
 *   <tr><td>url</td><td>URL 组件百分号编码</td></tr>
 *   <tr><td>raw</td><td>原样输出</td></tr>
 * </table>
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public final class ContextEscaper {

    private ContextEscaper() {
    }

    /**
     * 按上下文转义任意绑定值
     *
     * @param value   绑定值，先按 {@link Values#stringify(Object)} 转成字符串
     * @param context 转义上下文，不能为 null
     * @return 转义后的字符串
     */
    public static String escape(Object value, EscapingContext context) {
        if (context == null) {
            throw new IllegalArgumentException("Escaping context cannot be null");
        }
        if (value == null || Undefined.isUndefined(value)) {
            return "";
        }
        String str = Values.stringify(value);
        switch (context) {
            case MARKUP:
                return escapeMarkup(str);
            case SCRIPT:
                return escapeScript(str);
            case SHELL:
                return escapeShell(str);
            case STRUCTURED_LITERAL:
                return escapeStructuredLiteral(str);
            case URL:
                return escapeUrl(str);
            case RAW:
                return str;
            default:
                throw new IllegalArgumentException("Unsupported escaping context: " + context);
        }
    }

    public static String escapeMarkup(String str) {
        StringBuilder sb = new StringBuilder(str.length() + 16);
        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            switch (c) {
                case '&':
                    sb.append("&amp;");
                    break;
                case '<':
                    sb.append("&lt;");
                    break;
                case '>':
                    sb.append("&gt;");
                    break;
                case '"':
                    sb.append("&quot;");
                    break;
                case '\'':
                    sb.append("&#39;");
                    break;
                case '/':
                    sb.append("&#x2F;");
                    break;
                case '`':
                    sb.append("&#x60;");
                    break;
                case '=':
                    sb.append("&#x3D;");
                    break;
                default:
                    sb.append(c);
                    break;
            }
        }
        return sb.toString();
    }

    public static String escapeScript(String str) {
        StringBuilder sb = new StringBuilder(str.length() + 16);
        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            switch (c) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '"':
                    sb.append("\\\"");
                    break;
                case '\'':
                    sb.append("\\'");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                case '\b':
                    sb.append("\\b");
                    break;
                case '\f':
                    sb.append("\\f");
                    break;
                case '\u000B':
                    sb.append("\\v");
                    break;
                // \0 后面紧跟数字会被当成八进制转义，NUL 一律输出为 Unicode 转义
                case '\0':
                    sb.append("\\u0000");
                    break;
                // 这两个码点在很多脚本环境里会被当成换行，直接结束语句
                case '\u2028':
                    sb.append("\\u2028");
                    break;
                case '\u2029':
                    sb.append("\\u2029");
                    break;
                default:
                    sb.append(c);
                    break;
            }
        }
        return sb.toString();
    }

    public static String escapeShell(String str) {
        if (str.isEmpty()) {
            return "''";
        }
        return "'" + str.replace("'", "'\\''") + "'";
    }

    /**
     * 模板里的替换点已经自带引号，这里只输出 JSON 字符串内部的内容
     */
    public static String escapeStructuredLiteral(String str) {
        return new String(JsonStringEncoder.getInstance().quoteAsString(str));
    }

    /**
     * 与 encodeURIComponent 一致：保留 {@code A-Z a-z 0-9 - _ . ! ~ * ' ( )}，空格编码为 %20
     */
    public static String escapeUrl(String str) {
        return URLEncoder.encode(str, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%21", "!")
                .replace("%27", "'")
                .replace("%28", "(")
                .replace("%29", ")")
                .replace("%7E", "~");
    }
}
