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

public final class CellReferenceParseException extends FormulaException {
    private final String reference;

    public CellReferenceParseException(String reference, String message) {
        super("Invalid cell reference '" + reference + "': " + message);
        this.reference = reference;
    }

    public CellReferenceParseException(String reference, String message, Throwable cause) {
        super("Invalid cell reference '" + reference + "': " + message, cause);
        this.reference = reference;
    }

    @Override
    public Kind kind() {
        return Kind.CELL_REFERENCE;
    }

    public String reference() {
        return reference;
    }
}
