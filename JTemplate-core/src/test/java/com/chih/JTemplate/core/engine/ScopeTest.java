package com.chih.JTemplate.core.engine;

import com.chih.JTemplate.core.domain.Undefined;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Scope 与 VariableResolver 单元测试
 */
@DisplayName("Scope / VariableResolver 测试")
class ScopeTest {

    @Test
    @DisplayName("根作用域拷贝绑定，调用方后续修改不影响渲染")
    void testRootCopiesBindings() {
        Map<String, Object> bindings = new HashMap<>();
        bindings.put("name", "first");
        bindings.put("nothing", null);

        Scope root = Scope.root(bindings);
        bindings.put("name", "changed");

        assertThat(root.lookup("name")).isEqualTo("first");
        assertThat(root.lookup("nothing")).isNull();
        assertThat(root.lookup("missing")).isSameAs(Undefined.INSTANCE);
        assertThat(root.isRoot()).isTrue();
        assertThatThrownBy(() -> root.getValues().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("子作用域提供循环变量，其余名称向外查找")
    void testChildScope() {
        Scope root = Scope.root(Map.of("project", "demo"));
        Scope child = root.child("item", 2, 3);

        assertThat(child.lookup(Scope.THIS)).isEqualTo("item");
        assertThat(child.lookup(Scope.INDEX)).isEqualTo(2);
        assertThat(child.lookup(Scope.FIRST)).isEqualTo(false);
        assertThat(child.lookup(Scope.LAST)).isEqualTo(true);
        assertThat(child.lookup("project")).isEqualTo("demo");
        assertThat(child.getParent()).isSameAs(root);
        assertThat(root.lookup(Scope.THIS)).isSameAs(Undefined.INSTANCE);
    }

    @Test
    @DisplayName("内层循环变量遮蔽外层")
    void testShadowing() {
        Scope outer = Scope.root(Map.of()).child("outer", 0, 2);
        Scope inner = outer.child("inner", 1, 2);

        assertThat(inner.lookup(Scope.THIS)).isEqualTo("inner");
        assertThat(inner.lookup(Scope.INDEX)).isEqualTo(1);
        assertThat(outer.lookup(Scope.THIS)).isEqualTo("outer");
    }

    @Test
    @DisplayName("点分路径访问 Map 与 List，缺失的中间节点返回未定义")
    void testResolvePaths() {
        Scope scope = Scope.root(Map.of(
                "user", Map.of("name", "Ann", "roles", List.of("admin", "dev")),
                "title", "x"));

        assertThat(VariableResolver.resolve("user.name", scope)).isEqualTo("Ann");
        assertThat(VariableResolver.resolve("user.roles.1", scope)).isEqualTo("dev");
        assertThat(VariableResolver.resolve("user.roles.length", scope)).isEqualTo(2);
        assertThat(VariableResolver.resolve("title.length", scope)).isEqualTo(1);
        assertThat(VariableResolver.resolve("user.roles.5", scope)).isSameAs(Undefined.INSTANCE);
        assertThat(VariableResolver.resolve("user.address.city", scope)).isSameAs(Undefined.INSTANCE);
        assertThat(VariableResolver.resolve("title.foo", scope)).isSameAs(Undefined.INSTANCE);
        assertThat(VariableResolver.resolve("missing.deep.path", scope)).isSameAs(Undefined.INSTANCE);
    }

    @Test
    @DisplayName("字面量原样返回，Helper 调用不是路径")
    void testResolveLiterals() {
        Scope scope = Scope.root(Map.of());

        assertThat(VariableResolver.resolve("'api'", scope)).isEqualTo("api");
        assertThat(VariableResolver.resolve("3", scope)).isEqualTo(3);
        assertThatThrownBy(() -> VariableResolver.resolve("eq a b", scope))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
