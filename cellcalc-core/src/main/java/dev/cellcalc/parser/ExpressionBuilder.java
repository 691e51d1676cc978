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

import com.google.common.base.Preconditions;
import dev.cellcalc.api.Expression;
import dev.cellcalc.api.ValueParseException;
import dev.cellcalc.api.expressions.Binary;
import dev.cellcalc.api.expressions.Binary.BinaryOp;
import dev.cellcalc.api.expressions.CellReference;
import dev.cellcalc.api.expressions.Literal;
import java.util.List;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Turns a formula parse tree into an {@link Expression} tree by precedence climbing.
 * <p>
 * The grammar yields each expression as a flat run {@code primary (op primary)*}. Operators
 * fold left to right within a level unless the {@link PrecedenceTable} marks them
 * right-associative, in which case the right operand is climbed at the same level first.
 */
public final class ExpressionBuilder {
    private final PrecedenceTable precedence;

    public ExpressionBuilder(PrecedenceTable precedence) {
        this.precedence = Preconditions.checkNotNull(precedence, "precedence");
    }

    public Expression build(CellFormulaParser.FormulaContext formula) {
        return build(formula.expr());
    }

    private Expression build(CellFormulaParser.ExprContext expr) {
        return climb(new Cursor(expr), precedence.lowest());
    }

    private Expression climb(Cursor cursor, int minPrecedence) {
        Expression lhs = primary(cursor.nextPrimary());
        while (cursor.hasOperator()) {
            BinaryOp operator = cursor.peekOperator();
            int level = precedence.precedence(operator);
            if (level < minPrecedence) {
                break;
            }
            cursor.skipOperator();
            int next = precedence.associativity(operator) == Associativity.LEFT ? level + 1 : level;
            Expression rhs = climb(cursor, next);
            lhs = Binary.of(operator, lhs, rhs);
        }
        return lhs;
    }

    private Expression primary(CellFormulaParser.PrimaryContext primary) {
        if (primary instanceof CellFormulaParser.NumberContext) {
            return number((CellFormulaParser.NumberContext) primary);
        } else if (primary instanceof CellFormulaParser.CellReferenceContext) {
            return cellReference(((CellFormulaParser.CellReferenceContext) primary).CELL_REF());
        } else if (primary instanceof CellFormulaParser.ParenthesizedContext) {
            return build(((CellFormulaParser.ParenthesizedContext) primary).expr());
        } else {
            throw new IllegalStateException("Unexpected primary: " + primary.getClass().getSimpleName());
        }
    }

    private static Expression number(CellFormulaParser.NumberContext number) {
        String text = number.sign == null ? number.NUMBER().getText() : number.sign.getText() + number.NUMBER().getText();
        try {
            return Literal.float64(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            throw new ValueParseException(text, e);
        }
    }

    private static Expression cellReference(TerminalNode token) {
        List<String> parts = CellReferences.split(token.getText());
        return CellReference.of(CellReferences.resolve(parts.get(0), parts.get(1)));
    }

    private static BinaryOp operator(CellFormulaParser.InfixOpContext infixOp) {
        switch (infixOp.getStart().getType()) {
            case CellFormulaParser.ADD:
                return BinaryOp.ADD;
            case CellFormulaParser.SUBTRACT:
                return BinaryOp.SUBTRACT;
            case CellFormulaParser.MULTIPLY:
                return BinaryOp.MULTIPLY;
            case CellFormulaParser.DIVIDE:
                return BinaryOp.DIVIDE;
            case CellFormulaParser.REMAINDER:
                return BinaryOp.REMAINDER;
            case CellFormulaParser.POWER:
                return BinaryOp.POWER;
            default:
                throw new IllegalStateException("Unexpected operator token: " + infixOp.getText());
        }
    }

    /**
     * Position within one flat {@code primary (op primary)*} run.
     */
    private static final class Cursor {
        private final List<CellFormulaParser.PrimaryContext> primaries;
        private final List<CellFormulaParser.InfixOpContext> operators;
        private int nextPrimary = 0;
        private int nextOperator = 0;

        Cursor(CellFormulaParser.ExprContext expr) {
            this.primaries = expr.primary();
            this.operators = expr.infixOp();
        }

        CellFormulaParser.PrimaryContext nextPrimary() {
            return primaries.get(nextPrimary++);
        }

        boolean hasOperator() {
            return nextOperator < operators.size();
        }

        BinaryOp peekOperator() {
            return operator(operators.get(nextOperator));
        }

        void skipOperator() {
            nextOperator++;
        }
    }
}
