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
import dev.cellcalc.api.Coordinate;
import dev.cellcalc.api.Expression;

public final class CellReference implements Expression {
    private final Coordinate coordinate;

    private CellReference(Coordinate coordinate) {
        this.coordinate = Preconditions.checkNotNull(coordinate, "coordinate");
    }

    public static CellReference of(Coordinate coordinate) {
        return new CellReference(coordinate);
    }

    public static CellReference of(long row, long col) {
        return new CellReference(Coordinate.of(row, col));
    }

    public Coordinate getCoordinate() {
        return coordinate;
    }

    @Override
    public String type() {
        return "cell_ref";
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitCellReference(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof CellReference)) return false;
        return coordinate.equals(((CellReference) o).coordinate);
    }

    @Override
    public int hashCode() {
        return coordinate.hashCode();
    }

    @Override
    public String toString() {
        return coordinate.toString();
    }
}
