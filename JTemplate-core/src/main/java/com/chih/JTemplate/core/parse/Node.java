package com.chih.JTemplate.core.parse;

import java.util.List;
import java.util.Objects;

/**
 * 模板语法树节点
 *
 * @author lizhiyuan
 * @since 2026/10/12
 */
public interface Node {

    /**
     * 原样输出的文本
     */
    final class Text implements Node {

        private final String text;

        public Text(String text) {
            this.text = text;
        }

        public String getText() {
            return text;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Text && text.equals(((Text) o).text);
        }

        @Override
        public int hashCode() {
            return text.hashCode();
        }

        @Override
        public String toString() {
            return "Text{'" + text + "'}";
        }
    }

    /**
     * 变量替换或 Helper 调用，raw 为 true 时不做转义
     */
    final class Substitution implements Node {

        private final Expression expression;
        private final boolean raw;

        public Substitution(Expression expression, boolean raw) {
            this.expression = expression;
            this.raw = raw;
        }

        public Expression getExpression() {
            return expression;
        }

        public boolean isRaw() {
            return raw;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Substitution)) {
                return false;
            }
            Substitution that = (Substitution) o;
            return raw == that.raw && expression.equals(that.expression);
        }

        @Override
        public int hashCode() {
            return Objects.hash(expression, raw);
        }

        @Override
        public String toString() {
            return (raw ? "Raw{" : "Substitution{") + expression + '}';
        }
    }

    /**
     * 条件块，elseNodes 可以为空
     */
    final class If implements Node {

        private final Condition condition;
        private final List<Node> thenNodes;
        private final List<Node> elseNodes;

        public If(Condition condition, List<Node> thenNodes, List<Node> elseNodes) {
            this.condition = condition;
            this.thenNodes = List.copyOf(thenNodes);
            this.elseNodes = List.copyOf(elseNodes);
        }

        public Condition getCondition() {
            return condition;
        }

        public List<Node> getThenNodes() {
            return thenNodes;
        }

        public List<Node> getElseNodes() {
            return elseNodes;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof If)) {
                return false;
            }
            If that = (If) o;
            return condition.equals(that.condition) && thenNodes.equals(that.thenNodes)
                    && elseNodes.equals(that.elseNodes);
        }

        @Override
        public int hashCode() {
            return Objects.hash(condition, thenNodes, elseNodes);
        }

        @Override
        public String toString() {
            return "If{" + condition + ", then=" + thenNodes + ", else=" + elseNodes + '}';
        }
    }

    /**
     * 循环块
     */
    final class Each implements Node {

        private final Expression source;
        private final List<Node> bodyNodes;

        public Each(Expression source, List<Node> bodyNodes) {
            this.source = source;
            this.bodyNodes = List.copyOf(bodyNodes);
        }

        public Expression getSource() {
            return source;
        }

        public List<Node> getBodyNodes() {
            return bodyNodes;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Each)) {
                return false;
            }
            Each that = (Each) o;
            return source.equals(that.source) && bodyNodes.equals(that.bodyNodes);
        }

        @Override
        public int hashCode() {
            return Objects.hash(source, bodyNodes);
        }

        @Override
        public String toString() {
            return "Each{" + source + ", body=" + bodyNodes + '}';
        }
    }
}
