package com.chih.JTemplate.core.parse;

import com.chih.JTemplate.core.exception.TemplateSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ExpressionParser 测试")
class ExpressionParserTest {

    @Test
    @DisplayName("单个词是路径，不会当作零参数 Helper")
    void testSingleWordIsPath() {
        Expression expression = ExpressionParser.parse("uppercase");

        assertThat(expression).isEqualTo(new Expression.Path(List.of("uppercase")));
    }

    @Test
    @DisplayName("点分路径与循环内名称")
    void testDottedPath() {
        Expression.Path path = (Expression.Path) ExpressionParser.parse("this.config.name");

        assertThat(path.getSegments()).containsExactly("this", "config", "name");
        assertThat(path.getHead()).isEqualTo("this");
        assertThat(path.isLoopLocal()).isTrue();
        assertThat(path.getText()).isEqualTo("this.config.name");
        assertThat(((Expression.Path) ExpressionParser.parse("@index")).isLoopLocal()).isTrue();
        assertThat(((Expression.Path) ExpressionParser.parse("items.0")).isLoopLocal()).isFalse();
    }

    @Test
    @DisplayName("字面量：字符串、整数、小数、布尔、null")
    void testLiterals() {
        assertThat(ExpressionParser.parse("'api'")).isEqualTo(new Expression.Literal("api"));
        assertThat(ExpressionParser.parse("\"two words\"")).isEqualTo(new Expression.Literal("two words"));
        assertThat(ExpressionParser.parse("42")).isEqualTo(new Expression.Literal(42));
        assertThat(ExpressionParser.parse("-7")).isEqualTo(new Expression.Literal(-7));
        assertThat(ExpressionParser.parse("10000000000")).isEqualTo(new Expression.Literal(10_000_000_000L));
        assertThat(ExpressionParser.parse("1.5")).isEqualTo(new Expression.Literal(1.5));
        assertThat(ExpressionParser.parse("true")).isEqualTo(new Expression.Literal(true));
        assertThat(ExpressionParser.parse("null")).isEqualTo(new Expression.Literal(null));
    }

    @Test
    @DisplayName("多个词是 Helper 调用，路径参数可以带点")
    void testHelperCall() {
        Expression expression = ExpressionParser.parse("eq service.type 'api'");

        assertThat(expression).isEqualTo(new Expression.HelperCall("eq", List.of(
                new Expression.Path(List.of("service", "type")),
                new Expression.Literal("api"))));
    }

    @Test
    @DisplayName("括号形式支持嵌套调用和零参数调用")
    void testParenthesizedCalls() {
        Expression expression = ExpressionParser.parse("and (eq a 1) (not b)");

        assertThat(expression).isEqualTo(new Expression.HelperCall("and", List.of(
                new Expression.HelperCall("eq", List.of(new Expression.Path(List.of("a")), new Expression.Literal(1))),
                new Expression.HelperCall("not", List.of(new Expression.Path(List.of("b")))))));
        assertThat(ExpressionParser.parse("(now)")).isEqualTo(new Expression.HelperCall("now", List.of()));
    }

    @Test
    @DisplayName("字符串字面量中的空白和括号保持原样")
    void testStringWithSpecialCharacters() {
        Expression expression = ExpressionParser.parse("join items ' (and) '");

        assertThat(expression).isEqualTo(new Expression.HelperCall("join", List.of(
                new Expression.Path(List.of("items")), new Expression.Literal(" (and) "))));
    }

    @Test
    @DisplayName("条件中的 ! 表示取反，可以叠加")
    void testNegatedCondition() {
        assertThat(ExpressionParser.parseCondition("!ready"))
                .isEqualTo(new Condition.Not(new Condition.Test(new Expression.Path(List.of("ready")))));
        assertThat(ExpressionParser.parseCondition("!!ready"))
                .isEqualTo(new Condition.Not(new Condition.Not(
                        new Condition.Test(new Expression.Path(List.of("ready"))))));
        assertThat(ExpressionParser.parseCondition("eq a b")).isInstanceOf(Condition.Test.class);
    }

    @Test
    @DisplayName("非法表达式抛出 TemplateSyntaxException")
    void testInvalidExpressions() {
        assertThatThrownBy(() -> ExpressionParser.parse("'open"))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessageContaining("Unterminated string");
        assertThatThrownBy(() -> ExpressionParser.parse("(eq a b"))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessageContaining("Missing ')'");
        assertThatThrownBy(() -> ExpressionParser.parse("a)"))
                .isInstanceOf(TemplateSyntaxException.class);
        assertThatThrownBy(() -> ExpressionParser.parse("user..name"))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessageContaining("Invalid variable path");
        assertThatThrownBy(() -> ExpressionParser.parse("'x' y"))
                .isInstanceOf(TemplateSyntaxException.class);
        assertThatThrownBy(() -> ExpressionParser.parseCondition("!"))
                .isInstanceOf(TemplateSyntaxException.class);
    }
}
