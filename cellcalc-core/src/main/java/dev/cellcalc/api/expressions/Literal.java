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

public final class Literal implements Expression {
    private final Value value;

    private Literal(Value value) {
        this.value = Preconditions.checkNotNull(value, "value");
    }

    public static Literal of(Value value) {
        return new Literal(value);
    }

    public static Literal float64(double value) {
        return new Literal(Value.float64(value));
    }

    public Value getValue() {
        return value;
    }

    @Override
    public String type() {
        return "literal";
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Literal)) return false;
        return value.equals(((Literal) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
