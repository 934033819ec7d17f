package com.chih.JTemplate.core.parse;

import java.util.Objects;

/**
 * {{#if}} 的条件
 */
public interface Condition {

    final class Not implements Condition {

        private final Condition inner;

        public Not(Condition inner) {
            this.inner = inner;
        }

        public Condition getInner() {
            return inner;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Not && inner.equals(((Not) o).inner);
        }

        @Override
        public int hashCode() {
            return 31 * inner.hashCode() + 1;
        }

        @Override
        public String toString() {
            return "!" + inner;
        }
    }

    final class Test implements Condition {

        private final Expression expression;

        public Test(Expression expression) {
            this.expression = expression;
        }

        public Expression getExpression() {
            return expression;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Test && expression.equals(((Test) o).expression);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(expression);
        }

        @Override
        public String toString() {
            return String.valueOf(expression);
        }
    }
}
