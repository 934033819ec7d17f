package com.chih.JTemplate.core.engine;

import com.chih.JTemplate.core.domain.Template;
import com.chih.JTemplate.core.exception.JTemplateException;
import com.chih.JTemplate.core.exception.TemplateNotFoundException;
import com.chih.JTemplate.core.spi.TemplateSource;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * 模板加载器：通过 {@link TemplateSource} 读取模板原文，并按来源标识缓存
 * <p>
 * 缓存使用 Caffeine，容量和访问过期时间可配置；缓存未命中时才回源读取。
 * 渲染核心不依赖本类，只有按来源渲染时才会用到。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public class TemplateLoader {

    private static final Logger log = LoggerFactory.getLogger(TemplateLoader.class);

    public static final long DEFAULT_MAXIMUM_SIZE = 1000;
    public static final Duration DEFAULT_EXPIRE_AFTER_ACCESS = Duration.ofMinutes(60);

    private final TemplateSource source;
    private final Cache<String, Template> cache;

    public TemplateLoader(TemplateSource source) {
        this(source, DEFAULT_MAXIMUM_SIZE, DEFAULT_EXPIRE_AFTER_ACCESS);
    }

    public TemplateLoader(TemplateSource source, long maximumSize, Duration expireAfterAccess) {
        if (source == null) {
            throw new IllegalArgumentException("TemplateSource cannot be null");
        }
        this.source = source;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterAccess(expireAfterAccess)
                .removalListener((String key, Template value, RemovalCause cause) ->
                        log.debug("Template evicted from cache: {}, reason: {}", key, cause))
                .build();
    }

    /**
     * 加载模板，命中缓存时不回源
     *
     * @param origin 来源标识
     * @return 模板（origin 即传入的来源标识）
     * @throws TemplateNotFoundException 模板不存在或读取失败
     */
    public Template load(String origin) {
        if (origin == null || origin.isBlank()) {
            throw new IllegalArgumentException("Template origin cannot be null or empty");
        }
        return cache.get(origin, this::readFromSource);
    }

    public void invalidate(String origin) {
        cache.invalidate(origin);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    /**
     * @return 模板名称 -> 来源标识
     */
    public Map<String, String> listTemplates() {
        try {
            return source.listTemplates();
        } catch (IOException e) {
            throw new JTemplateException("Failed to list templates", e);
        }
    }

    /**
     * 当前缓存条目数（近似值）
     */
    public long cachedCount() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private Template readFromSource(String origin) {
        String text;
        try {
            text = source.read(origin);
        } catch (IOException e) {
            throw new TemplateNotFoundException(origin, e);
        }
        if (text == null) {
            throw new TemplateNotFoundException(origin);
        }
        log.debug("Template loaded: {}", origin);
        return Template.fromOrigin(origin, text);
    }
}
