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
package dev.cellcalc.table;

import com.google.common.base.Preconditions;
import dev.cellcalc.api.CellResolver;
import dev.cellcalc.api.Coordinate;
import dev.cellcalc.api.Value;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Grid of stored cell values. Cells that were never set read as {@link Value#zero()}.
 * <p>
 * Safe for concurrent use, so one table can serve several evaluations at once.
 */
public final class Table implements CellResolver {
    private static final Logger log = LoggerFactory.getLogger(Table.class);

    private final ConcurrentMap<Coordinate, Value> cells = new ConcurrentHashMap<>();

    @Override
    public Value get(Coordinate coordinate) {
        Preconditions.checkNotNull(coordinate, "coordinate");
        return cells.getOrDefault(coordinate, Value.zero());
    }

    /**
     * Store a value, returning the one it replaced.
     */
    public Optional<Value> set(Coordinate coordinate, Value value) {
        Preconditions.checkNotNull(coordinate, "coordinate");
        Preconditions.checkNotNull(value, "value");
        log.debug("Setting {} to {}", coordinate, value);
        return Optional.ofNullable(cells.put(coordinate, value));
    }

    public Optional<Value> remove(Coordinate coordinate) {
        return Optional.ofNullable(cells.remove(coordinate));
    }

    public boolean contains(Coordinate coordinate) {
        return cells.containsKey(coordinate);
    }

    /**
     * Number of cells holding a stored value.
     */
    public int size() {
        return cells.size();
    }
}
