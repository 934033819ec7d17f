package com.chih.JTemplate.core;

import com.chih.JTemplate.core.domain.EscapingContext;
import com.chih.JTemplate.core.domain.RenderOptions;
import com.chih.JTemplate.core.domain.Template;
import com.chih.JTemplate.core.engine.CompiledTemplate;
import com.chih.JTemplate.core.engine.TemplateEngine;
import com.chih.JTemplate.core.impl.FileTemplateSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * 并发测试
 *
 * 同一个引擎和同一个编译结果被多个线程同时使用，每个线程使用不同的绑定，
 * 输出之间不能互相干扰。
 */
@DisplayName("并发测试")
class ConcurrencyTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("共享编译结果的并发渲染")
    void testConcurrentRenderingOfSharedTemplate() throws Exception {
        TemplateEngine engine = TemplateEngine.builder().build();
        CompiledTemplate compiled = engine.compile(Template.of(
                "{{#each items}}{{#if @first}}{{owner}}:{{/if}}{{this}}{{#if !@last}},{{/if}}{{/each}}"));
        RenderOptions options = RenderOptions.context(EscapingContext.MARKUP);

        int threadCount = 16;
        int iterationsPerThread = 200;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch latch = new CountDownLatch(threadCount);
        AtomicInteger errorCount = new AtomicInteger(0);

        for (int i = 0; i < threadCount; i++) {
            final int threadId = i;
            executor.submit(() -> {
                try {
                    for (int j = 0; j < iterationsPerThread; j++) {
                        Map<String, Object> bindings = Map.of(
                                "owner", "t" + threadId,
                                "items", List.of(threadId, j, threadId + j));
                        String expected = "t" + threadId + ":" + threadId + "," + j + "," + (threadId + j);
                        if (!expected.equals(engine.render(compiled, bindings, options))) {
                            errorCount.incrementAndGet();
                        }
                    }
                } catch (RuntimeException e) {
                    errorCount.incrementAndGet();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        assertThat(errorCount.get()).isZero();
    }

    @Test
    @DisplayName("加载器缓存的并发访问")
    void testConcurrentLoading() throws Exception {
        for (int i = 0; i < 5; i++) {
            Files.writeString(tempDir.resolve("t" + i + ".txt.template"), "template " + i + " {{v}}");
        }
        TemplateEngine engine = TemplateEngine.builder().templateSource(new FileTemplateSource(tempDir)).build();

        int threadCount = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch latch = new CountDownLatch(threadCount);
        Set<String> outputs = ConcurrentHashMap.newKeySet();
        AtomicInteger errorCount = new AtomicInteger(0);

        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    for (int j = 0; j < 50; j++) {
                        outputs.add(engine.loadAndRender("t" + (j % 5) + ".txt.template", Map.of("v", "x"), null));
                    }
                } catch (RuntimeException e) {
                    errorCount.incrementAndGet();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        assertThat(errorCount.get()).isZero();
        assertThat(outputs).containsExactlyInAnyOrder(
                "template 0 x", "template 1 x", "template 2 x", "template 3 x", "template 4 x");
    }
}
