package com.chih.JTemplate.core.support;

import com.chih.JTemplate.core.exception.BindingsParseException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 绑定文件解析器
 * <p>
 * 把 YAML / JSON 格式的配置文件解析为渲染用的绑定 Map，
 * 值类型与模板约定一致：String、Number、Boolean、null、List、Map。
 * </p>
 *
 * <h3>示例：</h3>
 * <pre>{@code
 * # project.yaml
 * projectName: purair
 * features:
 *   - api
 *   - monitoring
 * deploy:
 *   region: eu-west-1
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public class BindingsParser {

    private static final Logger log = LoggerFactory.getLogger(BindingsParser.class);

    private static final Set<String> YAML_EXTENSIONS = Set.of(".yaml", ".yml");
    private static final Set<String> JSON_EXTENSIONS = Set.of(".json");

    /**
     * 最大文件大小限制（10MB），绑定文件通常只有几 KB
     */
    private static final int MAX_FILE_SIZE = 10 * 1024 * 1024;

    private static final ObjectMapper YAML_MAPPER = TemplateObjectMapperFactory.createYamlMapper();
    private static final ObjectMapper JSON_MAPPER = TemplateObjectMapperFactory.createJsonMapper();

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    /**
     * 判断文件是否为支持的绑定格式（大小写不敏感）
     */
    public static boolean isSupportedFile(String filename) {
        if (filename == null) {
            return false;
        }
        String ext = extension(filename);
        return YAML_EXTENSIONS.contains(ext) || JSON_EXTENSIONS.contains(ext);
    }

    /**
     * 解析输入流为绑定 Map
     *
     * @param is       输入流，调用方负责关闭
     * @param filename 文件名，用于判断格式
     * @return 保持文件中键顺序的绑定 Map；空文档返回空 Map
     * @throws IllegalArgumentException 参数为空或格式不受支持
     * @throws BindingsParseException   内容无法解析或文件过大
     */
    public static Map<String, Object> parse(InputStream is, String filename) {
        if (is == null) {
            throw new IllegalArgumentException("InputStream cannot be null");
        }
        if (filename == null || filename.trim().isEmpty()) {
            throw new IllegalArgumentException("Filename cannot be null or empty");
        }
        if (!isSupportedFile(filename)) {
            throw new IllegalArgumentException("Unsupported bindings file type: " + filename
                    + ". Supported types: " + YAML_EXTENSIONS + ", " + JSON_EXTENSIONS);
        }

        try {
            String content = TemplateResource.readLimited(is, filename, MAX_FILE_SIZE);
            content = TemplateResource.normalizeContent(content);
            if (content.isBlank()) {
                return Collections.emptyMap();
            }
            ObjectMapper mapper = JSON_EXTENSIONS.contains(extension(filename)) ? JSON_MAPPER : YAML_MAPPER;
            Map<String, Object> bindings = mapper.readValue(content, MAP_TYPE);
            return bindings != null ? bindings : Collections.emptyMap();
        } catch (IOException e) {
            log.error("Failed to parse bindings file: {}. Error: {}", filename, e.getMessage(), e);
            throw new BindingsParseException(filename, e);
        }
    }

    private static String extension(String filename) {
        String lower = filename.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        return dot >= 0 ? lower.substring(dot) : "";
    }
}
