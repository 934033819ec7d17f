package com.chih.JTemplate.core.parse;

import com.chih.JTemplate.core.exception.TemplateSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TemplateTokenizer 测试")
class TemplateTokenizerTest {

    @Test
    @DisplayName("文本与各类标签按顺序切分")
    void testTokenizeAllTagKinds() {
        List<Token> tokens = TemplateTokenizer.tokenize(
                "a{{x}}{{{y}}}{{#if c}}b{{else}}d{{/if}}{{#each items}}e{{/each}}");

        assertThat(tokens).extracting(Token::getType).containsExactly(
                TokenType.TEXT, TokenType.SUBSTITUTION, TokenType.RAW_SUBSTITUTION,
                TokenType.IF_OPEN, TokenType.TEXT, TokenType.ELSE, TokenType.TEXT, TokenType.IF_CLOSE,
                TokenType.EACH_OPEN, TokenType.TEXT, TokenType.EACH_CLOSE);
        assertThat(tokens.get(1).getContent()).isEqualTo("x");
        assertThat(tokens.get(2).getContent()).isEqualTo("y");
        assertThat(tokens.get(3).getContent()).isEqualTo("c");
        assertThat(tokens.get(8).getContent()).isEqualTo("items");
    }

    @Test
    @DisplayName("标签内部空白被去掉")
    void testTrimsTagContent() {
        List<Token> tokens = TemplateTokenizer.tokenize("{{  user.name  }}{{#if  ready }}{{/ if }}");

        assertThat(tokens.get(0).getContent()).isEqualTo("user.name");
        assertThat(tokens.get(1).getType()).isEqualTo(TokenType.IF_OPEN);
        assertThat(tokens.get(1).getContent()).isEqualTo("ready");
        assertThat(tokens.get(2).getType()).isEqualTo(TokenType.IF_CLOSE);
    }

    @Test
    @DisplayName("没有标签的文本是单个 TEXT，空文本没有 Token")
    void testPlainText() {
        assertThat(TemplateTokenizer.tokenize("plain text")).singleElement()
                .satisfies(t -> assertThat(t.getContent()).isEqualTo("plain text"));
        assertThat(TemplateTokenizer.tokenize("")).isEmpty();
    }

    @Test
    @DisplayName("Token 记录行号和列号")
    void testLineAndColumn() {
        List<Token> tokens = TemplateTokenizer.tokenize("line one\n  {{name}}");

        Token substitution = tokens.get(1);
        assertThat(substitution.getLine()).isEqualTo(2);
        assertThat(substitution.getColumn()).isEqualTo(3);
    }

    @Test
    @DisplayName("{{!expr}} 是原样替换的旧写法")
    void testBangIsRawSubstitution() {
        List<Token> tokens = TemplateTokenizer.tokenize("{{! body }}{{{body}}}");

        assertThat(tokens).extracting(Token::getType)
                .containsExactly(TokenType.RAW_SUBSTITUTION, TokenType.RAW_SUBSTITUTION);
        assertThat(tokens.get(0).getContent()).isEqualTo("body");
        assertThatThrownBy(() -> TemplateTokenizer.tokenize("{{!}}"))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessageContaining("Empty expression");
    }

    @Test
    @DisplayName("未闭合的标签报告位置")
    void testUnterminatedTag() {
        assertThatThrownBy(() -> TemplateTokenizer.tokenize("hello\n{{name"))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessageContaining("Unterminated tag")
                .satisfies(e -> {
                    TemplateSyntaxException ex = (TemplateSyntaxException) e;
                    assertThat(ex.getLine()).isEqualTo(2);
                    assertThat(ex.getColumn()).isEqualTo(1);
                });
    }

    @Test
    @DisplayName("空表达式、未知块标签、三括号块标签都是语法错误")
    void testInvalidTags() {
        assertThatThrownBy(() -> TemplateTokenizer.tokenize("{{ }}"))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessageContaining("Empty expression");
        assertThatThrownBy(() -> TemplateTokenizer.tokenize("{{#with x}}{{/with}}"))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessageContaining("Unknown block tag '#with'");
        assertThatThrownBy(() -> TemplateTokenizer.tokenize("{{/unless}}"))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessageContaining("Unknown closing tag");
        assertThatThrownBy(() -> TemplateTokenizer.tokenize("{{{#if x}}}"))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessageContaining("triple braces");
        assertThatThrownBy(() -> TemplateTokenizer.tokenize("{{#if}}x{{/if}}"))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessageContaining("requires an expression");
    }

    @Test
    @DisplayName("null 文本抛出 IllegalArgumentException")
    void testNullText() {
        assertThatThrownBy(() -> TemplateTokenizer.tokenize(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
