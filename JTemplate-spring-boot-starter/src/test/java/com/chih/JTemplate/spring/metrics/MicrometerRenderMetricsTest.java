package com.chih.JTemplate.spring.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MicrometerRenderMetrics 测试")
class MicrometerRenderMetricsTest {

    @Test
    @DisplayName("按模板和结果记录耗时与次数")
    void testRecordRender() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MicrometerRenderMetrics metrics = new MicrometerRenderMetrics(registry);

        metrics.recordRender("deploy.sh.template", TimeUnit.MILLISECONDS.toNanos(5), true);
        metrics.recordRender("deploy.sh.template", TimeUnit.MILLISECONDS.toNanos(7), true);
        metrics.recordRender("deploy.sh.template", 1_000, false);

        Timer timer = registry.find(MicrometerRenderMetrics.TIMER_NAME)
                .tag("template", "deploy.sh.template").tag("result", "success").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(12.0);

        Counter failures = registry.find(MicrometerRenderMetrics.COUNTER_NAME)
                .tag("template", "deploy.sh.template").tag("result", "failure").counter();
        assertThat(failures).isNotNull();
        assertThat(failures.count()).isEqualTo(1.0);
    }
}
