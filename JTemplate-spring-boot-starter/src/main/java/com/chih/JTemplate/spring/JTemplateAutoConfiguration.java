package com.chih.JTemplate.spring;

import com.chih.JTemplate.core.domain.EscapingContext;
import com.chih.JTemplate.core.domain.RenderOptions;
import com.chih.JTemplate.core.engine.HelperRegistry;
import com.chih.JTemplate.core.engine.TemplateEngine;
import com.chih.JTemplate.core.engine.TemplateLoader;
import com.chih.JTemplate.core.impl.NoOpRenderMetrics;
import com.chih.JTemplate.core.spi.HelperProvider;
import com.chih.JTemplate.core.spi.RenderMetrics;
import com.chih.JTemplate.core.spi.TemplateSource;
import com.chih.JTemplate.spring.metrics.MicrometerRenderMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * JTemplate Spring Boot 自动配置类。
 * <p>
 * 所有 Bean 都带 {@code @ConditionalOnMissingBean}，应用可以用自己的实现覆盖任意一个组件。
 * 应用中声明的 {@link HelperProvider} Bean 会在构建 {@link HelperRegistry} 时一并注册。
 * </p>
 *
 * <h3>使用示例：</h3>
 * <pre>{@code
 * // application.yml
 * j-template:
 *   locations:
 *     - classpath:templates/
 *     - file:./custom-templates/
 *   default-context: markup
 *   strict: false
 *
 * // 自定义 Helper（可选）
 * @Bean
 * public HelperProvider projectHelpers() {
 *     return () -> Map.of("slug", args -> ...);
 * }
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2026/10/15
 * @see JTemplateProperties
 * @see SpringResourceTemplateSource
 * @see TemplateEngine
 */
@Configuration
@EnableConfigurationProperties(JTemplateProperties.class)
public class JTemplateAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(HelperRegistry.class)
    public HelperRegistry helperRegistry(ObjectProvider<HelperProvider> providers) {
        HelperRegistry.Builder builder = HelperRegistry.builder().withBuiltins();
        providers.orderedStream().forEach(builder::registerAll);
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean(TemplateSource.class)
    public TemplateSource templateSource(JTemplateProperties properties) {
        return new SpringResourceTemplateSource(properties.getLocations());
    }

    @Bean
    @ConditionalOnMissingBean(TemplateLoader.class)
    public TemplateLoader templateLoader(TemplateSource source, JTemplateProperties properties) {
        return new TemplateLoader(source, properties.getCacheMaximumSize(),
                Duration.ofMinutes(properties.getCacheExpireAfterAccessMinutes()));
    }

    /**
     * 监控组件配置。
     * <p>
     * Micrometer 在类路径中且存在 MeterRegistry Bean 时使用 Micrometer 实现，
     * 否则使用下面的 NoOp 实现。
     * </p>
     */
    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(RenderMetrics.class)
        public RenderMetrics renderMetrics(MeterRegistry registry) {
            return new MicrometerRenderMetrics(registry);
        }
    }

    // 保底配置：如果没有 Metrics 环境，注入空实现
    @Bean
    @ConditionalOnMissingBean(RenderMetrics.class)
    public RenderMetrics defaultRenderMetrics() {
        return new NoOpRenderMetrics();
    }

    @Bean
    @ConditionalOnMissingBean(TemplateEngine.class)
    public TemplateEngine templateEngine(HelperRegistry helpers, TemplateLoader loader, RenderMetrics metrics,
                                         JTemplateProperties properties) {
        return TemplateEngine.builder()
                .helpers(helpers)
                .templateLoader(loader)
                .metrics(metrics)
                .defaultContext(EscapingContext.fromName(properties.getDefaultContext()))
                .defaultOptions(RenderOptions.defaults().withStrict(properties.isStrict()))
                .build();
    }
}
