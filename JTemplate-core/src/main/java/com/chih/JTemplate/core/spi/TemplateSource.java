package com.chih.JTemplate.core.spi;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;

/**
 * 模板来源接口 (SPI)
 * <p>
 * 负责把来源标识（通常是路径）解析成模板原文。渲染核心本身不做任何 I/O，
 * 读取文件、Classpath 或 Spring Resource 都由实现类完成。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public interface TemplateSource {

    /**
     * 读取模板原文
     *
     * @param origin 来源标识
     * @return 模板原文；不存在时返回 null
     * @throws IOException 读取失败
     */
    String read(String origin) throws IOException;

    /**
     * 列出可用模板（以 .template 结尾的文件）
     *
     * @return 模板名称（相对路径）-> 来源标识
     */
    default Map<String, String> listTemplates() throws IOException {
        return Collections.emptyMap();
    }
}
