package com.chih.JTemplate.core.parse;

import java.util.List;
import java.util.Objects;

/**
 * 替换点、条件和循环目标中的表达式
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
public interface Expression {

    /**
     * 字面量：字符串、数字、布尔、null
     */
    final class Literal implements Expression {

        private final Object value;

        public Literal(Object value) {
            this.value = value;
        }

        public Object getValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Literal && Objects.equals(value, ((Literal) o).value);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return value instanceof String ? "'" + value + "'" : String.valueOf(value);
        }
    }

    /**
     * 点分路径，如 user.name、this、@index
     */
    final class Path implements Expression {

        private final List<String> segments;

        public Path(List<String> segments) {
            this.segments = List.copyOf(segments);
        }

        public List<String> getSegments() {
            return segments;
        }

        public String getHead() {
            return segments.get(0);
        }

        /**
         * 循环内部才有的名称（this、@index 等）
         */
        public boolean isLoopLocal() {
            String head = getHead();
            return "this".equals(head) || head.startsWith("@");
        }

        public String getText() {
            return String.join(".", segments);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Path && segments.equals(((Path) o).segments);
        }

        @Override
        public int hashCode() {
            return segments.hashCode();
        }

        @Override
        public String toString() {
            return getText();
        }
    }

    /**
     * Helper 调用，参数本身也可以是调用
     */
    final class HelperCall implements Expression {

        private final String name;
        private final List<Expression> arguments;

        public HelperCall(String name, List<Expression> arguments) {
            this.name = name;
            this.arguments = List.copyOf(arguments);
        }

        public String getName() {
            return name;
        }

        public List<Expression> getArguments() {
            return arguments;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof HelperCall)) {
                return false;
            }
            HelperCall that = (HelperCall) o;
            return name.equals(that.name) && arguments.equals(that.arguments);
        }

        @Override
        public int hashCode() {
            return 31 * name.hashCode() + arguments.hashCode();
        }

        @Override
        public String toString() {
            return "(" + name + (arguments.isEmpty() ? "" : " " + arguments) + ")";
        }
    }
}
