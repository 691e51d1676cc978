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
package dev.cellcalc.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;

import dev.cellcalc.api.Expression;
import dev.cellcalc.api.expressions.Binary;
import dev.cellcalc.api.expressions.Binary.BinaryOp;
import dev.cellcalc.api.expressions.CellReference;
import dev.cellcalc.api.expressions.Literal;
import org.junit.jupiter.api.Test;

public final class ExpressionBuilderTest {
    private static Expression build(String text) {
        return new ExpressionBuilder(PrecedenceTable.standard()).build(FormulaParsers.parse(text));
    }

    private static Literal lit(double value) {
        return Literal.float64(value);
    }

    @Test
    public void testLeaves() {
        assertEquals(lit(42), build("42"));
        assertEquals(lit(-0.5), build("-.5"));
        assertEquals(CellReference.of(3, 2), build("B3"));
        assertEquals(CellReference.of(3, 2), build("((b3))"));
    }

    @Test
    public void testMultiplicativeBindsTighter() {
        assertEquals(
                Binary.add(lit(1), Binary.multiply(lit(2), CellReference.of(1, 1))),
                build("1 + 2 * A1"));
    }

    @Test
    public void testLeftAssociativeFold() {
        assertEquals(Binary.subtract(Binary.subtract(lit(10), lit(3)), lit(2)), build("10 - 3 - 2"));
        assertEquals(
                Binary.remainder(Binary.divide(Binary.multiply(lit(1), lit(2)), lit(3)), lit(4)),
                build("1 * 2 / 3 % 4"));
    }

    @Test
    public void testRightAssociativePower() {
        assertEquals(Binary.power(lit(2), Binary.power(lit(3), lit(2))), build("2 ^ 3 ^ 2"));
        assertEquals(
                Binary.add(Binary.multiply(lit(2), Binary.power(lit(3), lit(4))), lit(1)),
                build("2 * 3 ^ 4 + 1"));
    }

    @Test
    public void testParenthesesOverridePrecedence() {
        assertEquals(Binary.multiply(Binary.add(lit(2), lit(3)), lit(4)), build("(2 + 3) * 4"));
        assertEquals(Binary.power(Binary.power(lit(2), lit(3)), lit(2)), build("(2 ^ 3) ^ 2"));
    }

    @Test
    public void testCustomPrecedenceTable() {
        PrecedenceTable flat = PrecedenceTable.builder()
                .level(
                        Associativity.LEFT,
                        BinaryOp.ADD,
                        BinaryOp.SUBTRACT,
                        BinaryOp.MULTIPLY,
                        BinaryOp.DIVIDE,
                        BinaryOp.REMAINDER,
                        BinaryOp.POWER)
                .build();
        Expression expression = new ExpressionBuilder(flat).build(FormulaParsers.parse("2 + 3 * 4 ^ 2"));
        assertEquals(Binary.power(Binary.multiply(Binary.add(lit(2), lit(3)), lit(4)), lit(2)), expression);
    }
}
