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

import static dev.cellcalc.api.expressions.Binary.BinaryOp.*;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import dev.cellcalc.api.expressions.Binary.BinaryOp;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Binding strength and associativity of every {@link BinaryOp}.
 * <p>
 * Levels are declared from loosest to tightest binding. Level numbers start at {@link #lowest()}.
 */
public final class PrecedenceTable {
    private static final PrecedenceTable STANDARD = builder()
            .level(Associativity.LEFT, ADD, SUBTRACT)
            .level(Associativity.LEFT, MULTIPLY, DIVIDE, REMAINDER)
            .level(Associativity.RIGHT, POWER)
            .build();

    private final ImmutableMap<BinaryOp, Integer> precedences;
    private final ImmutableMap<BinaryOp, Associativity> associativities;

    private PrecedenceTable(Map<BinaryOp, Integer> precedences, Map<BinaryOp, Associativity> associativities) {
        this.precedences = ImmutableMap.copyOf(precedences);
        this.associativities = ImmutableMap.copyOf(associativities);
    }

    /**
     * Additive below multiplicative below power; power is right-associative, the rest left.
     */
    public static PrecedenceTable standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int lowest() {
        return 1;
    }

    public int precedence(BinaryOp operator) {
        return precedences.get(operator);
    }

    public Associativity associativity(BinaryOp operator) {
        return associativities.get(operator);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof PrecedenceTable)) return false;
        PrecedenceTable other = (PrecedenceTable) o;
        return precedences.equals(other.precedences) && associativities.equals(other.associativities);
    }

    @Override
    public int hashCode() {
        return 31 * precedences.hashCode() + associativities.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("precedences", precedences)
                .add("associativities", associativities)
                .toString();
    }

    public static final class Builder {
        private final Map<BinaryOp, Integer> precedences = new EnumMap<>(BinaryOp.class);
        private final Map<BinaryOp, Associativity> associativities = new EnumMap<>(BinaryOp.class);
        private int levels = 0;

        private Builder() {}

        /**
         * Add a level binding tighter than every level added before it.
         */
        public Builder level(Associativity associativity, BinaryOp first, BinaryOp... rest) {
            Preconditions.checkNotNull(associativity, "associativity");
            Set<BinaryOp> operators = EnumSet.of(first, rest);
            Preconditions.checkArgument(
                    operators.size() == rest.length + 1, "Operator repeated within a level: %s", operators);
            for (BinaryOp operator : operators) {
                Preconditions.checkArgument(
                        !precedences.containsKey(operator), "Operator %s declared on more than one level", operator);
            }
            levels++;
            for (BinaryOp operator : operators) {
                precedences.put(operator, levels);
                associativities.put(operator, associativity);
            }
            return this;
        }

        public PrecedenceTable build() {
            Set<BinaryOp> missing = EnumSet.allOf(BinaryOp.class);
            missing.removeAll(precedences.keySet());
            Preconditions.checkState(missing.isEmpty(), "No precedence declared for %s", missing);
            return new PrecedenceTable(precedences, associativities);
        }
    }
}
