package com.chih.JTemplate.spring;

import com.chih.JTemplate.core.impl.FileTemplateSource;
import com.chih.JTemplate.core.spi.TemplateSource;
import com.chih.JTemplate.core.support.TemplateResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.util.ResourceUtils;
import org.springframework.util.StringUtils;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 基于 Spring Resource 的模板源
 * <p>
 * 来源标识的解析方式：
 * <ul>
 *   <li>带协议前缀（classpath:、file: 等）：直接交给 Spring 解析</li>
 *   <li>绝对路径：按文件系统读取</li>
 *   <li>相对路径：依次拼接到每个配置的根目录后查找，第一个存在的生效</li>
 * </ul>
 * </p>
 *
 * <h3>配置示例：</h3>
 * <ul>
 *   <li>Classpath 目录：classpath:templates/</li>
 *   <li>文件系统目录：file:/opt/app/templates/</li>
 * </ul>
 *
 * @author lizhiyuan
 * @since 2026/10/15
 * @see org.springframework.core.io.Resource
 */
public class SpringResourceTemplateSource implements TemplateSource {

    private static final Logger log = LoggerFactory.getLogger(SpringResourceTemplateSource.class);

    private static final int MAX_FILE_SIZE = 10 * 1024 * 1024;

    private final ResourcePatternResolver resolver;

    private final List<String> locations;

    public SpringResourceTemplateSource(List<String> locations) {
        this(locations, new PathMatchingResourcePatternResolver());
    }

    public SpringResourceTemplateSource(List<String> locations, ResourcePatternResolver resolver) {
        this.locations = new ArrayList<>();
        for (String location : locations) {
            if (StringUtils.hasText(location)) {
                this.locations.add(location.endsWith("/") ? location : location + "/");
            }
        }
        this.resolver = resolver;
    }

    @Override
    public String read(String origin) throws IOException {
        if (!StringUtils.hasText(origin)) {
            throw new IllegalArgumentException("Template origin cannot be null or empty");
        }

        for (Resource resource : candidates(origin)) {
            if (resource.exists() && resource.isReadable()) {
                log.debug("Reading template {}", resource.getDescription());
                try (InputStream is = resource.getInputStream()) {
                    return TemplateResource.normalizeContent(
                            TemplateResource.readLimited(is, resource.getDescription(), MAX_FILE_SIZE));
                }
            }
        }
        log.debug("Template not found in {}: {}", locations, origin);
        return null;
    }

    /**
     * 扫描所有根目录下的 .template 文件，同名模板以先配置的目录为准
     */
    @Override
    public Map<String, String> listTemplates() {
        Map<String, String> templates = new TreeMap<>();
        for (String location : locations) {
            try {
                Resource[] resources = resolver.getResources(location + "**/*" + FileTemplateSource.TEMPLATE_SUFFIX);
                if (resources.length == 0) {
                    continue;
                }
                Resource base = resolver.getResource(location);
                for (Resource resource : resources) {
                    String name = relativeName(base, resource);
                    if (name != null) {
                        templates.putIfAbsent(name, location + name);
                    }
                }
            } catch (IOException e) {
                log.warn("Failed to scan template location: {}", location, e);
            }
        }
        return templates;
    }

    public List<String> getLocations() {
        return List.copyOf(locations);
    }

    /**
     * 资源相对于根目录的路径，统一使用 '/'；无法确定时返回 null
     */
    private static String relativeName(Resource base, Resource resource) throws IOException {
        if (base.isFile() && resource.isFile()) {
            Path basePath = base.getFile().toPath().toAbsolutePath().normalize();
            Path path = resource.getFile().toPath().toAbsolutePath().normalize();
            return path.startsWith(basePath) ? basePath.relativize(path).toString().replace('\\', '/') : null;
        }
        String baseUrl = base.getURL().toString();
        String url = resource.getURL().toString();
        return url.startsWith(baseUrl) ? url.substring(baseUrl.length()) : null;
    }

    private List<Resource> candidates(String origin) {
        if (ResourceUtils.isUrl(origin)) {
            return List.of(resolver.getResource(origin));
        }
        File file = new File(origin);
        if (file.isAbsolute()) {
            return List.of(new FileSystemResource(file));
        }
        String relative = origin.startsWith("/") ? origin.substring(1) : origin;
        List<Resource> resources = new ArrayList<>(locations.size());
        for (String location : locations) {
            resources.add(resolver.getResource(location + relative));
        }
        return resources;
    }
}
