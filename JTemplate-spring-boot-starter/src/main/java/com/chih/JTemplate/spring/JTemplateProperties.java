package com.chih.JTemplate.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 模板引擎配置
 * @author lizhiyuan
 * @since 2026/10/15
*/
@ConfigurationProperties(prefix = "j-template")
public class JTemplateProperties {

    /**
     * 模板根目录列表，按顺序查找
     * 支持 classpath: 和 file:
     */
    private List<String> locations = new ArrayList<>();

    /**
     * 既没有显式指定、也无法从来源推断时使用的转义上下文
     */
    private String defaultContext = "markup";

    /**
     * 严格模式：渲染前审计，缺失变量直接失败
     */
    private boolean strict = false;

    /**
     * 模板缓存容量
     */
    private long cacheMaximumSize = 1000;

    /**
     * 模板缓存访问过期时间 (分钟)
     */
    private long cacheExpireAfterAccessMinutes = 60;

    public JTemplateProperties() {
        // 默认约定：classpath 下的 templates 目录，其次是工作目录下的 templates
        locations.add("classpath:templates/");
        locations.add("file:./templates/");
    }

    public List<String> getLocations() {
        return locations;
    }

    public void setLocations(List<String> locations) {
        this.locations = locations;
    }

    public String getDefaultContext() {
        return defaultContext;
    }

    public void setDefaultContext(String defaultContext) {
        this.defaultContext = defaultContext;
    }

    public boolean isStrict() {
        return strict;
    }

    public void setStrict(boolean strict) {
        this.strict = strict;
    }

    public long getCacheMaximumSize() {
        return cacheMaximumSize;
    }

    public void setCacheMaximumSize(long cacheMaximumSize) {
        this.cacheMaximumSize = cacheMaximumSize;
    }

    public long getCacheExpireAfterAccessMinutes() {
        return cacheExpireAfterAccessMinutes;
    }

    public void setCacheExpireAfterAccessMinutes(long cacheExpireAfterAccessMinutes) {
        this.cacheExpireAfterAccessMinutes = cacheExpireAfterAccessMinutes;
    }
}
