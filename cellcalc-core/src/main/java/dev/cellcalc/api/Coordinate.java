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
import dev.cellcalc.parser.CellReferences;

/**
 * Location of a single cell: a row and a column, both non-negative.
 * <p>
 * Coordinates produced from formula text carry the row exactly as written and the column
 * decoded from its letters, so {@code A1} is row 1, column 1.
 */
public final class Coordinate {
    private final long row;
    private final long col;

    private Coordinate(long row, long col) {
        this.row = row;
        this.col = col;
    }

    public static Coordinate of(long row, long col) {
        Preconditions.checkArgument(row >= 0, "row must be non-negative: %s", row);
        Preconditions.checkArgument(col >= 0, "col must be non-negative: %s", col);
        return new Coordinate(row, col);
    }

    /**
     * Parse a single reference in A1 notation, e.g. {@code "B7"} or {@code "aa10"}.
     *
     * @throws CellReferenceParseException if the text is not a cell reference
     */
    public static Coordinate parse(String reference) {
        return CellReferences.parse(reference);
    }

    public long row() {
        return row;
    }

    public long col() {
        return col;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Coordinate)) return false;
        Coordinate other = (Coordinate) o;
        return row == other.row && col == other.col;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(row) + Long.hashCode(col);
    }

    @Override
    public String toString() {
        if (col == 0) {
            return "R" + row + "C" + col;
        }
        return CellReferences.encodeColumn(col) + row;
    }
}
