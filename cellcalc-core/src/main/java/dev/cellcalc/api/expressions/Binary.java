/**
 * (c) Copyright 2025 SpiralDB Inc. All rights reserved.
 * <p>
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * <p>
 * http://www.apache.org/licenses/LICENSE-2.0
 * <p>
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.cellcalc.api.expressions;

import com.google.common.base.Preconditions;
import dev.cellcalc.api.Expression;
import dev.cellcalc.api.Value;
import java.util.Objects;
import java.util.function.DoubleBinaryOperator;

public final class Binary implements Expression {
    private final BinaryOp operator;
    private final Expression left;
    private final Expression right;

    private Binary(BinaryOp operator, Expression left, Expression right) {
        this.operator = Preconditions.checkNotNull(operator, "operator");
        this.left = Preconditions.checkNotNull(left, "left");
        this.right = Preconditions.checkNotNull(right, "right");
    }

    public static Binary of(BinaryOp operator, Expression left, Expression right) {
        return new Binary(operator, left, right);
    }

    public static Binary add(Expression left, Expression right) {
        return new Binary(BinaryOp.ADD, left, right);
    }

    public static Binary subtract(Expression left, Expression right) {
        return new Binary(BinaryOp.SUBTRACT, left, right);
    }

    public static Binary multiply(Expression left, Expression right) {
        return new Binary(BinaryOp.MULTIPLY, left, right);
    }

    public static Binary divide(Expression left, Expression right) {
        return new Binary(BinaryOp.DIVIDE, left, right);
    }

    public static Binary remainder(Expression left, Expression right) {
        return new Binary(BinaryOp.REMAINDER, left, right);
    }

    public static Binary power(Expression left, Expression right) {
        return new Binary(BinaryOp.POWER, left, right);
    }

    @Override
    public String type() {
        return "binary";
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Binary binary = (Binary) o;
        return operator == binary.operator && Objects.equals(left, binary.left) && Objects.equals(right, binary.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitBinary(this);
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    /**
     * Arithmetic operators. Every operator is total over doubles: division by zero, invalid
     * powers and the like produce infinities or NaN instead of failing.
     */
    public enum BinaryOp {
        ADD('+', (lhs, rhs) -> lhs + rhs),
        SUBTRACT('-', (lhs, rhs) -> lhs - rhs),
        MULTIPLY('*', (lhs, rhs) -> lhs * rhs),
        DIVIDE('/', (lhs, rhs) -> lhs / rhs),
        REMAINDER('%', (lhs, rhs) -> lhs % rhs),
        POWER('^', Math::pow),
        ;

        private final char symbol;
        private final DoubleBinaryOperator function;

        BinaryOp(char symbol, DoubleBinaryOperator function) {
            this.symbol = symbol;
            this.function = function;
        }

        public char symbol() {
            return symbol;
        }

        /**
         * Apply this operator as {@code lhs op rhs}.
         */
        public Value apply(Value lhs, Value rhs) {
            return lhs.accept(left -> rhs.accept(right -> Value.float64(function.applyAsDouble(left, right))));
        }

        @Override
        public String toString() {
            return String.valueOf(symbol);
        }
    }
}
