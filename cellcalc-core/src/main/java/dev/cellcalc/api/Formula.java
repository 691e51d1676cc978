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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import dev.cellcalc.eval.DependencyCollector;
import dev.cellcalc.eval.ExpressionEvaluator;
import dev.cellcalc.parser.ExpressionBuilder;
import dev.cellcalc.parser.FormulaParsers;
import dev.cellcalc.parser.ParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A parsed spreadsheet formula such as {@code (A1 + B2) * 2 ^ 3}.
 * <p>
 * Instances are immutable and may be evaluated concurrently, provided the {@link CellResolver}s
 * passed in tolerate concurrent reads.
 */
public final class Formula {
    private static final Logger log = LoggerFactory.getLogger(Formula.class);

    private final String text;
    private final Expression expression;
    private final ImmutableSet<Coordinate> dependencies;

    private Formula(String text, Expression expression) {
        this.text = text;
        this.expression = expression;
        this.dependencies = DependencyCollector.collect(expression);
    }

    /**
     * Parse formula text with the default {@link ParseOptions}.
     *
     * @throws FormulaSyntaxException if the text does not match the grammar
     * @throws CellReferenceParseException if a cell reference cannot be decoded
     * @throws ValueParseException if a numeric literal cannot be decoded
     */
    public static Formula parse(String text) {
        return parse(text, ParseOptions.of());
    }

    public static Formula parse(String text, ParseOptions options) {
        Preconditions.checkNotNull(text, "text");
        Preconditions.checkNotNull(options, "options");
        Expression expression = new ExpressionBuilder(options.precedence()).build(FormulaParsers.parse(text));
        Formula formula = new Formula(text, expression);
        log.debug("Parsed formula '{}' referencing {} cell(s)", text, formula.dependencies.size());
        return formula;
    }

    /**
     * Wrap an expression tree that was built elsewhere, e.g. decoded from its protobuf form.
     */
    public static Formula of(Expression expression) {
        Preconditions.checkNotNull(expression, "expression");
        return new Formula(expression.toString(), expression);
    }

    /**
     * Evaluate against the current cell values supplied by {@code resolver}.
     */
    public Value eval(CellResolver resolver) {
        return ExpressionEvaluator.evaluate(expression, resolver);
    }

    /**
     * Distinct cells this formula references, computed once at construction.
     */
    public ImmutableSet<Coordinate> dependencies() {
        return dependencies;
    }

    public Expression expression() {
        return expression;
    }

    public String text() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }
}
