package com.chih.JTemplate.core.domain;

import com.chih.JTemplate.core.exception.EscapingContextException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("EscapingContext / RenderOptions 测试")
class EscapingContextTest {

    @Test
    @DisplayName("规范名称、别名和枚举名都能解析，大小写不敏感")
    void testFromName() {
        assertThat(EscapingContext.fromName("html")).isEqualTo(EscapingContext.MARKUP);
        assertThat(EscapingContext.fromName("JS")).isEqualTo(EscapingContext.SCRIPT);
        assertThat(EscapingContext.fromName("shell-command")).isEqualTo(EscapingContext.SHELL);
        assertThat(EscapingContext.fromName("json")).isEqualTo(EscapingContext.STRUCTURED_LITERAL);
        assertThat(EscapingContext.fromName("structured_literal")).isEqualTo(EscapingContext.STRUCTURED_LITERAL);
        assertThat(EscapingContext.fromName(" url ")).isEqualTo(EscapingContext.URL);
        assertThat(EscapingContext.fromName("none")).isEqualTo(EscapingContext.RAW);
        assertThat(EscapingContext.STRUCTURED_LITERAL.getCanonicalName()).isEqualTo("structured-literal");
    }

    @Test
    @DisplayName("未知或空名称抛出 EscapingContextException")
    void testUnknownName() {
        assertThatThrownBy(() -> EscapingContext.fromName("xml"))
                .isInstanceOf(EscapingContextException.class)
                .hasMessageContaining("xml");
        assertThatThrownBy(() -> EscapingContext.fromName(""))
                .isInstanceOf(EscapingContextException.class);
    }

    @Test
    @DisplayName("RenderOptions 的 with 方法返回新实例")
    void testRenderOptions() {
        RenderOptions options = RenderOptions.context("shell").withOrigin("deploy.sh").withStrict(true);

        assertThat(options.getContext()).isEqualTo(EscapingContext.SHELL);
        assertThat(options.getOrigin()).isEqualTo("deploy.sh");
        assertThat(options.isStrict()).isTrue();
        assertThat(RenderOptions.defaults().isStrict()).isFalse();
        assertThat(RenderOptions.defaults().getContext()).isNull();
    }

    @Test
    @DisplayName("Template 必须有文本，来源可选")
    void testTemplate() {
        assertThat(Template.of("x").displayName()).isEqualTo("<inline>");
        assertThat(Template.fromOrigin("a/b.sh.template", "x").displayName()).isEqualTo("a/b.sh.template");
        assertThatThrownBy(() -> Template.of(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
