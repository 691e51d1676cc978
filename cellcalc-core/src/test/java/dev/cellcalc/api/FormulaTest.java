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
package dev.cellcalc.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableSet;
import dev.cellcalc.table.Table;
import java.util.List;
import org.junit.jupiter.api.Test;

public final class FormulaTest {
    private static double eval(String text) {
        return Formula.parse(text).eval(new Table()).asDouble();
    }

    @Test
    public void testPrecedence() {
        assertEquals(14.0, eval("2 + 3 * 4"));
        assertEquals(20.0, eval("(2 + 3) * 4"));
        assertEquals(5.0, eval("1 + 2 * 3 - 2 ^ (3 - 2)"));
        assertEquals(7.0, eval("1 + 20 % 7 - 3 * 2 / 3 + 2 ^ 1"));
    }

    @Test
    public void testPowerIsRightAssociative() {
        assertEquals(512.0, eval("2 ^ 3 ^ 2"));
        assertEquals(64.0, eval("(2 ^ 3) ^ 2"));
    }

    @Test
    public void testSubtractionAndDivisionAreLeftAssociative() {
        assertEquals(5.0, eval("10 - 3 - 2"));
        assertEquals(2.5, eval("20 / 4 / 2"));
        assertEquals(1.0, eval("10 % 6 % 3"));
    }

    @Test
    public void testSignedAndFractionalLiterals() {
        assertEquals(4.0, eval("-2 ^ 2"));
        assertEquals(3.0, eval("1 - -2"));
        assertEquals(3.0, eval("1 - - 2"));
        assertEquals(0.75, eval(".5 + 0.25"));
        assertEquals(-1.5, eval("-3. / 2"));
    }

    @Test
    public void testFloatingPointEdgeCases() {
        assertEquals(Double.POSITIVE_INFINITY, eval("5 / 0"));
        assertEquals(Double.NEGATIVE_INFINITY, eval("-5 / 0"));
        assertTrue(Double.isNaN(eval("0 / 0")));
        assertTrue(Double.isNaN(eval("6 % 0")));
        assertTrue(Double.isNaN(eval("-8 ^ 0.5")));
    }

    @Test
    public void testWhitespaceIsInsignificant() {
        assertEquals(eval("(1+2)*3"), eval(" ( 1 +\t2 )\n* 3 "));
    }

    @Test
    public void testUnresolvedCellsReadAsZero() {
        assertEquals(1.0, eval("A1 + 1"));
    }

    @Test
    public void testCellValuesComeFromResolver() {
        Table table = new Table();
        table.set(Coordinate.of(1, 1), Value.float64(4));
        table.set(Coordinate.of(2, 2), Value.float64(3));

        Formula formula = Formula.parse("A1 * b2 - A1");
        assertEquals(Value.float64(8), formula.eval(table));
    }

    @Test
    public void testDependencies() {
        assertEquals(ImmutableSet.of(Coordinate.of(1, 1)), Formula.parse("A1 - A1").dependencies());
        assertEquals(
                ImmutableSet.of(Coordinate.of(1, 1), Coordinate.of(2, 28), Coordinate.of(3, 1)),
                Formula.parse("A1 + (AB2 * a3) / ab2 ^ A1").dependencies());
        assertTrue(Formula.parse("1 + 2").dependencies().isEmpty());
    }

    @Test
    public void testDependenciesAreStable() {
        Formula formula = Formula.parse("C3 + C3 * D4");
        assertSame(formula.dependencies(), formula.dependencies());
        assertEquals(2, formula.dependencies().size());
    }

    @Test
    public void testSyntaxErrors() {
        FormulaSyntaxException error = assertThrows(FormulaSyntaxException.class, () -> Formula.parse("1A"));
        assertEquals(FormulaException.Kind.SYNTAX, error.kind());
        assertEquals(1, error.line());
        assertEquals(1, error.charPositionInLine());

        assertThrows(FormulaSyntaxException.class, () -> Formula.parse("1 + 2 * 1A"));
        assertThrows(FormulaSyntaxException.class, () -> Formula.parse("1A1"));
        assertThrows(FormulaSyntaxException.class, () -> Formula.parse(""));
        assertThrows(FormulaSyntaxException.class, () -> Formula.parse("(1 + 2"));
        assertThrows(FormulaSyntaxException.class, () -> Formula.parse("1 + 2)"));
        assertThrows(FormulaSyntaxException.class, () -> Formula.parse("1 +"));
        assertThrows(FormulaSyntaxException.class, () -> Formula.parse("-A1"));
        assertThrows(FormulaSyntaxException.class, () -> Formula.parse("A"));
        assertThrows(FormulaSyntaxException.class, () -> Formula.parse("SUM(A1)"));
        assertThrows(FormulaSyntaxException.class, () -> Formula.parse("1 ** 2"));
    }

    @Test
    public void testOversizedReferenceIsCellReferenceError() {
        FormulaException error =
                assertThrows(CellReferenceParseException.class, () -> Formula.parse("A99999999999999999999 + 1"));
        assertEquals(FormulaException.Kind.CELL_REFERENCE, error.kind());
    }

    @Test
    public void testResolverErrorsPropagate() {
        CycleException cycle = new CycleException(List.of(Coordinate.of(1, 1), Coordinate.of(1, 2)));
        Formula formula = Formula.parse("1 + A1 * 2");

        CycleException thrown = assertThrows(CycleException.class, () -> formula.eval(coordinate -> {
            throw cycle;
        }));
        assertSame(cycle, thrown);
    }

    @Test
    public void testFromExpression() {
        Formula parsed = Formula.parse("1 + 2 * A1");
        Formula rebuilt = Formula.of(parsed.expression());

        assertEquals(parsed.expression(), rebuilt.expression());
        assertEquals(parsed.dependencies(), rebuilt.dependencies());
        assertEquals("(1 + (2 * A1))", rebuilt.text());
        assertEquals(parsed.expression(), Formula.parse(rebuilt.text()).expression());
    }

    @Test
    public void testNegativeZeroSurvivesTextRoundTrip() {
        Formula parsed = Formula.parse("1 / -0");
        Formula rebuilt = Formula.of(parsed.expression());

        assertEquals("(1 / -0)", rebuilt.text());
        assertEquals(Double.NEGATIVE_INFINITY, parsed.eval(new Table()).asDouble());
        assertEquals(Double.NEGATIVE_INFINITY, Formula.parse(rebuilt.text()).eval(new Table()).asDouble());
    }
}
