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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.cellcalc.api.expressions.Binary.BinaryOp;
import org.junit.jupiter.api.Test;

public final class PrecedenceTableTest {
    @Test
    public void testStandardTable() {
        PrecedenceTable table = PrecedenceTable.standard();
        assertEquals(table.precedence(BinaryOp.ADD), table.precedence(BinaryOp.SUBTRACT));
        assertEquals(table.precedence(BinaryOp.MULTIPLY), table.precedence(BinaryOp.REMAINDER));
        assertTrue(table.precedence(BinaryOp.ADD) < table.precedence(BinaryOp.DIVIDE));
        assertTrue(table.precedence(BinaryOp.DIVIDE) < table.precedence(BinaryOp.POWER));
        assertEquals(table.lowest(), table.precedence(BinaryOp.SUBTRACT));
        assertEquals(Associativity.LEFT, table.associativity(BinaryOp.SUBTRACT));
        assertEquals(Associativity.RIGHT, table.associativity(BinaryOp.POWER));
    }

    @Test
    public void testIncompleteTableRejected() {
        PrecedenceTable.Builder builder = PrecedenceTable.builder()
                .level(Associativity.LEFT, BinaryOp.ADD, BinaryOp.SUBTRACT)
                .level(Associativity.RIGHT, BinaryOp.POWER);
        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    public void testDuplicateOperatorRejected() {
        PrecedenceTable.Builder builder = PrecedenceTable.builder().level(Associativity.LEFT, BinaryOp.ADD);
        assertThrows(IllegalArgumentException.class, () -> builder.level(Associativity.RIGHT, BinaryOp.ADD));
        assertThrows(
                IllegalArgumentException.class,
                () -> builder.level(Associativity.LEFT, BinaryOp.MULTIPLY, BinaryOp.MULTIPLY));
    }

    @Test
    public void testRejectedLevelLeavesBuilderUnchanged() {
        PrecedenceTable.Builder builder = PrecedenceTable.builder().level(Associativity.RIGHT, BinaryOp.POWER);
        assertThrows(
                IllegalArgumentException.class,
                () -> builder.level(Associativity.LEFT, BinaryOp.ADD, BinaryOp.POWER));

        PrecedenceTable table = builder.level(Associativity.LEFT, BinaryOp.ADD, BinaryOp.SUBTRACT)
                .level(Associativity.LEFT, BinaryOp.MULTIPLY, BinaryOp.DIVIDE, BinaryOp.REMAINDER)
                .build();

        assertEquals(1, table.precedence(BinaryOp.POWER));
        assertEquals(2, table.precedence(BinaryOp.ADD));
        assertEquals(2, table.precedence(BinaryOp.SUBTRACT));
        assertEquals(3, table.precedence(BinaryOp.DIVIDE));
        assertEquals(Associativity.LEFT, table.associativity(BinaryOp.ADD));
    }

    @Test
    public void testOptionsDefaultToStandardTable() {
        assertEquals(PrecedenceTable.standard(), ParseOptions.of().precedence());
    }
}
