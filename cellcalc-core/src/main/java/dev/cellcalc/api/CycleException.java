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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Cells that reference each other in a cycle.
 * <p>
 * Nothing in this library assembles dependencies across cells, so it never throws this itself.
 * It exists for resolvers and recalculation layers built on {@link Formula#dependencies()}.
 */
public final class CycleException extends FormulaException {
    private final ImmutableList<Coordinate> cells;

    public CycleException(List<Coordinate> cells) {
        super("Cyclic dependency between cells: " + Joiner.on(" -> ").join(cells));
        this.cells = ImmutableList.copyOf(cells);
    }

    @Override
    public Kind kind() {
        return Kind.CYCLE;
    }

    /**
     * Cells along the cycle, in reference order.
     */
    public ImmutableList<Coordinate> cells() {
        return cells;
    }
}
