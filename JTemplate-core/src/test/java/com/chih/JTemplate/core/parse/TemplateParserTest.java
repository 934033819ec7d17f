package com.chih.JTemplate.core.parse;

import com.chih.JTemplate.core.exception.TemplateSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * TemplateParser 单元测试
 *
 * 重点是块的配对：同类块嵌套、循环体内的条件块，以及各类未闭合 / 错配的报错。
 */
@DisplayName("TemplateParser 测试")
class TemplateParserTest {

    @Test
    @DisplayName("条件块的 then / else 分支")
    void testIfElse() {
        List<Node> nodes = TemplateParser.parse("{{#if a}}yes{{else}}no{{/if}}");

        assertThat(nodes).singleElement().isInstanceOf(Node.If.class);
        Node.If block = (Node.If) nodes.get(0);
        assertThat(block.getThenNodes()).containsExactly(new Node.Text("yes"));
        assertThat(block.getElseNodes()).containsExactly(new Node.Text("no"));
    }

    @Test
    @DisplayName("同类条件块嵌套时内层结束标签不会提前结束外层")
    void testNestedIfs() {
        List<Node> nodes = TemplateParser.parse("{{#if a}}A{{#if b}}B{{/if}}C{{else}}D{{/if}}E");

        assertThat(nodes).hasSize(2);
        Node.If outer = (Node.If) nodes.get(0);
        assertThat(outer.getThenNodes()).hasSize(3);
        assertThat(outer.getThenNodes().get(1)).isInstanceOf(Node.If.class);
        assertThat(outer.getThenNodes().get(2)).isEqualTo(new Node.Text("C"));
        assertThat(outer.getElseNodes()).containsExactly(new Node.Text("D"));
        assertThat(nodes.get(1)).isEqualTo(new Node.Text("E"));
    }

    @Test
    @DisplayName("循环体内的条件块和嵌套循环")
    void testEachWithNestedBlocks() {
        List<Node> nodes = TemplateParser.parse(
                "{{#each groups}}{{#if this.enabled}}[{{#each this.items}}{{this}}{{/each}}]{{/if}}{{/each}}");

        Node.Each outer = (Node.Each) nodes.get(0);
        assertThat(outer.getSource()).isEqualTo(new Expression.Path(List.of("groups")));
        Node.If inner = (Node.If) outer.getBodyNodes().get(0);
        assertThat(inner.getThenNodes()).hasSize(3);
        assertThat(inner.getThenNodes().get(1)).isInstanceOf(Node.Each.class);
    }

    @Test
    @DisplayName("原样替换标记为 raw")
    void testRawSubstitution() {
        List<Node> nodes = TemplateParser.parse("{{a}}{{{b}}}");

        assertThat(nodes).containsExactly(
                new Node.Substitution(new Expression.Path(List.of("a")), false),
                new Node.Substitution(new Expression.Path(List.of("b")), true));
    }

    @Test
    @DisplayName("未闭合的块报告开始标签的位置")
    void testUnterminatedBlock() {
        assertThatThrownBy(() -> TemplateParser.parse("text\n{{#if a}}never closed"))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessageContaining("Unterminated")
                .hasMessageContaining("line 2");
        assertThatThrownBy(() -> TemplateParser.parse("{{#each items}}x"))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessageContaining("Unterminated");
    }

    @Test
    @DisplayName("结束标签与开始标签不匹配")
    void testMismatchedCloser() {
        assertThatThrownBy(() -> TemplateParser.parse("{{#if a}}x{{/each}}"))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessageContaining("Expected {{/if}}");
        assertThatThrownBy(() -> TemplateParser.parse("{{#each a}}x{{/if}}"))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessageContaining("Expected {{/each}}");
    }

    @Test
    @DisplayName("多余的结束标签和孤立的 else")
    void testStrayTags() {
        assertThatThrownBy(() -> TemplateParser.parse("x{{/if}}"))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessageContaining("without a matching opening block");
        assertThatThrownBy(() -> TemplateParser.parse("x{{else}}y"))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessageContaining("outside of {{#if}}");
    }

    @Test
    @DisplayName("重复 else 以及循环中的 else 都是错误")
    void testElseMisuse() {
        assertThatThrownBy(() -> TemplateParser.parse("{{#if a}}1{{else}}2{{else}}3{{/if}}"))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessageContaining("Duplicate {{else}}");
        assertThatThrownBy(() -> TemplateParser.parse("{{#each a}}1{{else}}2{{/each}}"))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessageContaining("only allowed inside {{#if}}");
    }

    @Test
    @DisplayName("表达式错误带上标签位置")
    void testExpressionErrorHasPosition() {
        assertThatThrownBy(() -> TemplateParser.parse("ok\n\n  {{eq a 'b}}"))
                .isInstanceOf(TemplateSyntaxException.class)
                .satisfies(e -> assertThat(((TemplateSyntaxException) e).getLine()).isEqualTo(3));
    }
}
