package com.chih.JTemplate.spring.metrics;

import com.chih.JTemplate.core.spi.RenderMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * 基于 Micrometer 的监控实现
 * <p>
 * 监控指标说明：
 * <ul>
 *   <li>jtemplate.render.timer: 模板渲染耗时，tags: template={来源标识}, result={success|failure}</li>
 *   <li>jtemplate.render.count: 模板渲染次数计数器，tags: template={来源标识}, result={success|failure}</li>
 * </ul>
 * 内联模板统一记为 {@code <inline>}，不会因为模板内容不同而产生新的 tag。
 * </p>
 */
public class MicrometerRenderMetrics implements RenderMetrics {

    public static final String TIMER_NAME = "jtemplate.render.timer";
    public static final String COUNTER_NAME = "jtemplate.render.count";

    private final MeterRegistry registry;

    public MicrometerRenderMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordRender(String templateId, long durationNs, boolean success) {
        String result = success ? "success" : "failure";

        Timer.builder(TIMER_NAME)
                .description("Timer for template rendering")
                .tag("template", templateId)
                .tag("result", result)
                .register(registry)
                .record(durationNs, TimeUnit.NANOSECONDS);

        Counter.builder(COUNTER_NAME)
                .description("Counter for template rendering")
                .tag("template", templateId)
                .tag("result", result)
                .register(registry)
                .increment();
    }
}
