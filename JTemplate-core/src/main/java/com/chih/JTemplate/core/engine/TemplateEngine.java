package com.chih.JTemplate.core.engine;

import com.chih.JTemplate.core.domain.AuditReport;
import com.chih.JTemplate.core.domain.EscapingContext;
import com.chih.JTemplate.core.domain.RenderOptions;
import com.chih.JTemplate.core.domain.RenderResult;
import com.chih.JTemplate.core.domain.Template;
import com.chih.JTemplate.core.exception.EscapingContextException;
import com.chih.JTemplate.core.exception.JTemplateException;
import com.chih.JTemplate.core.exception.TemplateRenderException;
import com.chih.JTemplate.core.exception.UnresolvedVariableException;
import com.chih.JTemplate.core.impl.NoOpRenderMetrics;
import com.chih.JTemplate.core.parse.Node;
import com.chih.JTemplate.core.parse.TemplateParser;
import com.chih.JTemplate.core.spi.RenderMetrics;
import com.chih.JTemplate.core.spi.TemplateSource;
import com.chih.JTemplate.core.support.ContextDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 模板引擎入口
 * <p>
 * 负责编译、选择转义上下文、执行渲染和记录指标。引擎本身不可变，
 * 所有单次渲染的状态都在调用内部创建，可以被多个线程同时使用。
 * </p>
 *
 * <h3>转义上下文的选择顺序：</h3>
 * <ol>
 *   <li>{@link RenderOptions#getContext()} 显式指定</li>
 *   <li>根据来源标识推断（{@link ContextDetector}）</li>
 *   <li>引擎的默认上下文（未配置时为 markup）</li>
 * </ol>
 * raw 不能作为整次渲染的上下文，只能通过 {@code {{{ }}}} 在单个替换点使用。
 *
 * <pre>{@code
 * TemplateEngine engine = TemplateEngine.builder().build();
 * String out = engine.render("Hello {{name}}", Map.of("name", "<b>"));   // Hello &lt;b&gt;
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public final class TemplateEngine {

    private static final Logger log = LoggerFactory.getLogger(TemplateEngine.class);

    private final HelperRegistry helpers;
    private final TemplateLoader loader;
    private final RenderMetrics metrics;
    private final RenderOptions defaultOptions;
    private final EscapingContext defaultContext;
    private final DirectiveProcessor processor;

    private TemplateEngine(Builder builder) {
        this.helpers = builder.helpers != null ? builder.helpers : HelperRegistry.withBuiltins();
        this.loader = builder.loader;
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpRenderMetrics();
        this.defaultOptions = builder.defaultOptions != null ? builder.defaultOptions : RenderOptions.defaults();
        this.defaultContext = builder.defaultContext != null ? builder.defaultContext : EscapingContext.MARKUP;
        if (defaultContext == EscapingContext.RAW) {
            throw new EscapingContextException("'raw' cannot be used as the default context");
        }
        this.processor = new DirectiveProcessor(helpers);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 编译模板
     *
     * @throws com.chih.JTemplate.core.exception.TemplateSyntaxException 模板语法错误
     */
    public CompiledTemplate compile(Template template) {
        if (template == null) {
            throw new IllegalArgumentException("Template cannot be null");
        }
        List<Node> nodes = TemplateParser.parse(template.getText());
        log.debug("Template compiled: {}", template.displayName());
        return new CompiledTemplate(template, nodes);
    }

    public String render(String text, Map<String, ?> bindings) {
        return render(text, bindings, defaultOptions);
    }

    public String render(String text, Map<String, ?> bindings, RenderOptions options) {
        return renderWithReport(text, bindings, options).getOutput();
    }

    public String render(CompiledTemplate template, Map<String, ?> bindings, RenderOptions options) {
        if (template == null) {
            throw new IllegalArgumentException("Template cannot be null");
        }
        return execute(template.getTemplate(), template, bindings, options(options)).getOutput();
    }

    /**
     * 渲染并返回未解析变量的警告，不做审计
     */
    public RenderResult renderWithReport(String text, Map<String, ?> bindings, RenderOptions options) {
        RenderOptions effective = options(options);
        return execute(new Template(text, effective.getOrigin()), null, bindings, effective);
    }

    /**
     * 先审计再渲染：缺失变量记录在结果中，不会因此失败（忽略严格模式）
     */
    public RenderResult auditThenRender(String text, Map<String, ?> bindings, RenderOptions options) {
        RenderOptions effective = options(options).withStrict(false);
        AuditReport report = audit(text, bindings);
        if (!report.isValid()) {
            log.warn("Template references variables that are not provided: {}", report.getMissingNames());
        }
        RenderResult result = execute(new Template(text, effective.getOrigin()), null, bindings, effective);
        return new RenderResult(result.getOutput(), report.getMissingNames(), result.getWarnings());
    }

    public AuditReport audit(String text, Map<String, ?> bindings) {
        if (text == null) {
            throw new IllegalArgumentException("Template text cannot be null");
        }
        return VariableAuditor.audit(text, bindings);
    }

    /**
     * 按来源标识加载并渲染，来源标识同时用于推断转义上下文
     *
     * @throws com.chih.JTemplate.core.exception.TemplateNotFoundException 模板不存在
     */
    public String loadAndRender(String origin, Map<String, ?> bindings, RenderOptions options) {
        Template template = requireLoader().load(origin);
        RenderOptions effective = options(options);
        if (effective.getOrigin() == null) {
            effective = effective.withOrigin(origin);
        }
        return execute(template, null, bindings, effective).getOutput();
    }

    /**
     * 批量加载并渲染，遇到第一个错误立即失败
     *
     * @param templates 输出名称 -> 来源标识
     * @return 输出名称 -> 渲染结果，保持输入顺序
     */
    public Map<String, String> loadAndRenderAll(Map<String, String> templates, Map<String, ?> bindings,
                                                RenderOptions options) {
        Map<String, String> results = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : templates.entrySet()) {
            results.put(entry.getKey(), loadAndRender(entry.getValue(), bindings, options));
        }
        log.info("Rendered {} templates", results.size());
        return results;
    }

    /**
     * @return 模板名称 -> 来源标识；未配置加载器时为空
     */
    public Map<String, String> availableTemplates() {
        return loader == null ? Map.of() : loader.listTemplates();
    }

    public HelperRegistry getHelpers() {
        return helpers;
    }

    public RenderOptions getDefaultOptions() {
        return defaultOptions;
    }

    public EscapingContext getDefaultContext() {
        return defaultContext;
    }

    /**
     * 确定本次渲染的转义上下文
     *
     * @throws EscapingContextException 显式指定了 raw
     */
    EscapingContext resolveContext(RenderOptions options, String templateOrigin) {
        EscapingContext explicit = options.getContext();
        if (explicit != null) {
            if (explicit == EscapingContext.RAW) {
                throw new EscapingContextException(
                        "'raw' cannot be used as a render-wide context; use {{{ }}} for individual values");
            }
            return explicit;
        }
        String origin = options.getOrigin() != null ? options.getOrigin() : templateOrigin;
        if (origin == null || origin.isBlank()) {
            return defaultContext;
        }
        return ContextDetector.detect(origin);
    }

    /**
     * 编译（未预编译时）、严格模式审计和渲染都在计时范围内，失败同样会记录指标
     */
    private RenderResult execute(Template template, CompiledTemplate compiled, Map<String, ?> bindings,
                                 RenderOptions options) {
        String templateId = options.getOrigin() != null ? options.getOrigin() : template.displayName();
        long startTime = System.nanoTime();
        boolean success = false;
        try {
            CompiledTemplate target = compiled != null ? compiled : compile(template);
            EscapingContext context = resolveContext(options, target.getOrigin());

            if (options.isStrict()) {
                AuditReport report = VariableAuditor.audit(template.getText(), bindings);
                if (!report.isValid()) {
                    throw new UnresolvedVariableException(report.getMissingNames());
                }
            }

            RenderContext renderContext = new RenderContext(templateId, context);
            String output = processor.process(target.getNodes(), Scope.root(bindings), renderContext);
            success = true;
            List<String> warnings = renderContext.getWarnings();
            if (!warnings.isEmpty()) {
                log.warn("Template {} referenced unresolved variables: {}", templateId, warnings);
            }
            return new RenderResult(output, List.of(), warnings);
        } catch (JTemplateException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to render template: {}", templateId, e);
            throw new TemplateRenderException(templateId, e);
        } finally {
            metrics.recordRender(templateId, System.nanoTime() - startTime, success);
        }
    }

    private RenderOptions options(RenderOptions options) {
        return options != null ? options : defaultOptions;
    }

    private TemplateLoader requireLoader() {
        if (loader == null) {
            throw new IllegalStateException("No TemplateLoader configured; use TemplateEngine.builder().templateSource(...)");
        }
        return loader;
    }

    public static final class Builder {

        private HelperRegistry helpers;
        private TemplateLoader loader;
        private RenderMetrics metrics;
        private RenderOptions defaultOptions;
        private EscapingContext defaultContext;

        private Builder() {
        }

        public Builder helpers(HelperRegistry helpers) {
            this.helpers = helpers;
            return this;
        }

        public Builder templateLoader(TemplateLoader loader) {
            this.loader = loader;
            return this;
        }

        /**
         * 使用默认缓存配置包装模板源
         */
        public Builder templateSource(TemplateSource source) {
            this.loader = new TemplateLoader(source);
            return this;
        }

        public Builder metrics(RenderMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder defaultOptions(RenderOptions defaultOptions) {
            this.defaultOptions = defaultOptions;
            return this;
        }

        /**
         * 既没有显式上下文、也没有来源标识时使用的上下文
         */
        public Builder defaultContext(EscapingContext defaultContext) {
            this.defaultContext = defaultContext;
            return this;
        }

        public TemplateEngine build() {
            return new TemplateEngine(this);
        }
    }
}
