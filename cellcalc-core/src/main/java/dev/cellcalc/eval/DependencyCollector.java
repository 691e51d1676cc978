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

import com.google.common.collect.ImmutableSet;
import dev.cellcalc.api.Coordinate;
import dev.cellcalc.api.Expression;
import dev.cellcalc.api.expressions.Binary;
import dev.cellcalc.api.expressions.CellReference;
import dev.cellcalc.api.expressions.Literal;

/**
 * Collect the distinct coordinates referenced by an expression, in first-reference order.
 */
public final class DependencyCollector implements Expression.Visitor<Void> {
    private final ImmutableSet.Builder<Coordinate> dependencies = ImmutableSet.builder();

    private DependencyCollector() {}

    public static ImmutableSet<Coordinate> collect(Expression expression) {
        DependencyCollector collector = new DependencyCollector();
        expression.accept(collector);
        return collector.dependencies.build();
    }

    @Override
    public Void visitLiteral(Literal literal) {
        return null;
    }

    @Override
    public Void visitCellReference(CellReference cellReference) {
        dependencies.add(cellReference.getCoordinate());
        return null;
    }

    @Override
    public Void visitBinary(Binary binary) {
        binary.getLeft().accept(this);
        binary.getRight().accept(this);
        return null;
    }
}
