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

import java.util.Optional;

/**
 * The formula text was rejected by the grammar.
 */
public final class FormulaSyntaxException extends FormulaException {
    private final int line;
    private final int charPositionInLine;
    private final String offendingText;
    private final String diagnostic;

    public FormulaSyntaxException(int line, int charPositionInLine, String offendingText, String diagnostic) {
        super("Syntax error at " + line + ":" + charPositionInLine + ": " + diagnostic);
        this.line = line;
        this.charPositionInLine = charPositionInLine;
        this.offendingText = offendingText;
        this.diagnostic = diagnostic;
    }

    @Override
    public Kind kind() {
        return Kind.SYNTAX;
    }

    /**
     * One-based line of the offending input.
     */
    public int line() {
        return line;
    }

    /**
     * Zero-based character offset within {@link #line()}.
     */
    public int charPositionInLine() {
        return charPositionInLine;
    }

    /**
     * The token the parser stopped at, absent when the lexer could not form a token.
     */
    public Optional<String> offendingText() {
        return Optional.ofNullable(offendingText);
    }

    /**
     * The grammar engine's description of the problem, including the tokens it expected.
     */
    public String diagnostic() {
        return diagnostic;
    }
}
