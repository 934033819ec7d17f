package com.chih.JTemplate.core.impl;

import com.chih.JTemplate.core.spi.TemplateSource;
import com.chih.JTemplate.core.support.TemplateResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * 基于文件系统的模板源
 * <p>
 * 特性：
 * 1. 绝对路径直接读取，相对路径相对于模板根目录解析
 * 2. 文件系统中不存在时回退到 Classpath（只读）
 * 3. UTF-8 读取，去掉 BOM，单文件 10MB 上限
 * 4. 递归列出根目录下所有 .template 文件
 * </p>
 *
 * <pre>{@code
 * TemplateSource source = new FileTemplateSource(Paths.get("templates"));
 * String text = source.read("ci/deploy.yml.template");
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public class FileTemplateSource implements TemplateSource {

    private static final Logger log = LoggerFactory.getLogger(FileTemplateSource.class);

    public static final String TEMPLATE_SUFFIX = ".template";

    /**
     * 模板文件大小上限（10MB）
     */
    private static final int MAX_FILE_SIZE = 10 * 1024 * 1024;

    private final Path baseDir;
    private final ClassLoader classLoader;

    public FileTemplateSource(Path baseDir) {
        this(baseDir, FileTemplateSource.class.getClassLoader());
    }

    /**
     * @param baseDir     模板根目录，相对来源标识以此为基准
     * @param classLoader 文件不存在时用于回退查找的类加载器，可为 null（不回退）
     */
    public FileTemplateSource(Path baseDir, ClassLoader classLoader) {
        if (baseDir == null) {
            throw new IllegalArgumentException("Template base directory cannot be null");
        }
        this.baseDir = baseDir;
        this.classLoader = classLoader;
    }

    public FileTemplateSource(String baseDir) {
        this(Paths.get(baseDir));
    }

    @Override
    public String read(String origin) throws IOException {
        if (origin == null || origin.isBlank()) {
            throw new IllegalArgumentException("Template origin cannot be null or empty");
        }

        TemplateResource resource = resolve(origin);
        if (resource == null) {
            log.debug("Template not found in {} or classpath: {}", baseDir, origin);
            return null;
        }
        log.debug("Reading template {}", resource);
        return resource.readContent(MAX_FILE_SIZE);
    }

    @Override
    public Map<String, String> listTemplates() throws IOException {
        Map<String, String> templates = new TreeMap<>();
        if (!Files.isDirectory(baseDir)) {
            return templates;
        }

        try (Stream<Path> paths = Files.walk(baseDir)) {
            paths.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(TEMPLATE_SUFFIX))
                    .forEach(p -> {
                        String key = baseDir.relativize(p).toString().replace('\\', '/');
                        templates.put(key, p.toAbsolutePath().toString());
                    });
        }
        return templates;
    }

    public Path getBaseDir() {
        return baseDir;
    }

    private TemplateResource resolve(String origin) {
        Path path = Paths.get(origin);
        Path candidate = path.isAbsolute() ? path : baseDir.resolve(path);
        if (Files.isRegularFile(candidate)) {
            return TemplateResource.fromFile(candidate);
        }

        if (!path.isAbsolute() && classLoader != null) {
            String resourcePath = origin.replace('\\', '/');
            if (resourcePath.startsWith("/")) {
                resourcePath = resourcePath.substring(1);
            }
            URL url = classLoader.getResource(resourcePath);
            if (url != null) {
                return TemplateResource.fromClasspath(url, resourcePath);
            }
        }
        return null;
    }
}
