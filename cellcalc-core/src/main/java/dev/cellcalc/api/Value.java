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

import java.math.BigDecimal;

/**
 * A cell or expression value.
 * <p>
 * The set of variants is closed. Consumers branch on it through {@link Visitor}, so adding a
 * variant is a compile-time change for every consumer.
 */
public abstract class Value {
    private static final Value ZERO = new Float64(0.0d);

    private Value() {}

    /**
     * The default value of an empty cell.
     */
    public static Value zero() {
        return ZERO;
    }

    public static Value float64(double value) {
        return new Float64(value);
    }

    public abstract <U> U accept(Visitor<U> visitor);

    /**
     * Numeric view of this value.
     */
    public final double asDouble() {
        return accept(AsDouble.INSTANCE);
    }

    public interface Visitor<U> {
        U visitFloat64(double value);
    }

    public static final class Float64 extends Value {
        private static final long NEGATIVE_ZERO_BITS = Double.doubleToRawLongBits(-0.0d);

        private final double value;

        private Float64(double value) {
            this.value = value;
        }

        public double getValue() {
            return value;
        }

        @Override
        public <U> U accept(Visitor<U> visitor) {
            return visitor.visitFloat64(value);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Float64)) return false;
            return Double.compare(value, ((Float64) o).value) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value);
        }

        @Override
        public String toString() {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return Double.toString(value);
            }
            if (Double.doubleToRawLongBits(value) == NEGATIVE_ZERO_BITS) {
                return "-0";
            }
            return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        }
    }

    private static final class AsDouble implements Visitor<Double> {
        static final AsDouble INSTANCE = new AsDouble();

        @Override
        public Double visitFloat64(double value) {
            return value;
        }
    }
}
