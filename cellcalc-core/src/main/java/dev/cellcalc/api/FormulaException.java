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

/**
 * Base class of every failure reported while building or evaluating a formula.
 */
public abstract class FormulaException extends RuntimeException {
    FormulaException(String message) {
        super(message);
    }

    FormulaException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract Kind kind();

    public enum Kind {
        /** The text does not match the formula grammar. */
        SYNTAX,
        /** A cell reference has malformed column letters or row digits. */
        CELL_REFERENCE,
        /** A numeric literal could not be converted to a value. */
        VALUE,
        /** Cells depend on each other in a cycle. */
        CYCLE,
    }
}
