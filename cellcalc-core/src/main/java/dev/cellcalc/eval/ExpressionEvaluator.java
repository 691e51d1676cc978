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
package dev.cellcalc.eval;

import com.google.common.base.Preconditions;
import dev.cellcalc.api.CellResolver;
import dev.cellcalc.api.Expression;
import dev.cellcalc.api.Value;
import dev.cellcalc.api.expressions.Binary;
import dev.cellcalc.api.expressions.CellReference;
import dev.cellcalc.api.expressions.Literal;

/**
 * Reduce an {@link Expression} to a {@link Value}.
 * <p>
 * Cell references are looked up through the given {@link CellResolver}; anything it throws
 * propagates unchanged and aborts the evaluation. Arithmetic itself never fails. The left
 * operand of a binary expression is always evaluated before the right.
 */
public final class ExpressionEvaluator implements Expression.Visitor<Value> {
    private final CellResolver resolver;

    private ExpressionEvaluator(CellResolver resolver) {
        this.resolver = resolver;
    }

    public static Value evaluate(Expression expression, CellResolver resolver) {
        Preconditions.checkNotNull(resolver, "resolver");
        return expression.accept(new ExpressionEvaluator(resolver));
    }

    @Override
    public Value visitLiteral(Literal literal) {
        return literal.getValue();
    }

    @Override
    public Value visitCellReference(CellReference cellReference) {
        Value value = resolver.get(cellReference.getCoordinate());
        return Preconditions.checkNotNull(
                value, "Resolver returned null for %s", cellReference.getCoordinate());
    }

    @Override
    public Value visitBinary(Binary binary) {
        Value left = binary.getLeft().accept(this);
        Value right = binary.getRight().accept(this);
        return binary.getOperator().apply(left, right);
    }
}
