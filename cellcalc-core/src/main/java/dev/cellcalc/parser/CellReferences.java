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

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import dev.cellcalc.api.CellReferenceParseException;
import dev.cellcalc.api.Coordinate;
import java.util.List;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/**
 * Conversion between A1-style reference text and {@link Coordinate}s.
 * <p>
 * Columns are bijective base 26: {@code A} is 1, {@code Z} is 26, {@code AA} is 27. Letters are
 * case-insensitive. Rows are taken as written.
 */
public final class CellReferences {
    private static final int RADIX = 26;

    private CellReferences() {}

    /**
     * Resolve the column letters and row digits of one reference into a coordinate.
     */
    public static Coordinate resolve(String columnLetters, String rowDigits) {
        return Coordinate.of(decodeRow(rowDigits), decodeColumn(columnLetters));
    }

    /**
     * Parse a complete reference such as {@code "AB12"}.
     * <p>
     * The text is tokenized by the formula lexer, so surrounding whitespace is ignored exactly as
     * inside a formula, and anything other than a single cell reference token is rejected.
     */
    public static Coordinate parse(String reference) {
        Preconditions.checkNotNull(reference, "reference");
        CellFormulaLexer lexer = new CellFormulaLexer(CharStreams.fromString(reference));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new BaseErrorListener() {
            @Override
            public void syntaxError(
                    Recognizer<?, ?> recognizer,
                    Object offendingSymbol,
                    int line,
                    int charPositionInLine,
                    String msg,
                    RecognitionException e) {
                throw new CellReferenceParseException(reference, msg);
            }
        });

        Token token = lexer.nextToken();
        if (token.getType() != CellFormulaLexer.CELL_REF || lexer.nextToken().getType() != Token.EOF) {
            throw new CellReferenceParseException(reference, "expected a single cell reference");
        }
        List<String> parts = split(token.getText());
        return resolve(parts.get(0), parts.get(1));
    }

    /**
     * Split a cell reference token into its column letters and row digits, in that order.
     * Everything before the first digit counts as column text.
     */
    public static List<String> split(String token) {
        Preconditions.checkNotNull(token, "token");
        int split = 0;
        while (split < token.length() && !isDigit(token.charAt(split))) {
            split++;
        }
        return ImmutableList.of(token.substring(0, split), token.substring(split));
    }

    public static long decodeColumn(String letters) {
        if (letters.isEmpty()) {
            throw new CellReferenceParseException(letters, "missing column letters");
        }
        long col = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = letters.charAt(i);
            if (!Ascii.isUpperCase(c) && !Ascii.isLowerCase(c)) {
                throw new CellReferenceParseException(letters, "invalid column char " + c);
            }
            try {
                col = Math.addExact(Math.multiplyExact(col, RADIX), Ascii.toUpperCase(c) - 'A' + 1);
            } catch (ArithmeticException e) {
                throw new CellReferenceParseException(letters, "column out of range", e);
            }
        }
        return col;
    }

    /**
     * Inverse of {@link #decodeColumn(String)}, always upper case.
     */
    public static String encodeColumn(long col) {
        Preconditions.checkArgument(col >= 1, "column must be positive: %s", col);
        StringBuilder letters = new StringBuilder();
        long remaining = col;
        while (remaining > 0) {
            remaining--;
            letters.append((char) ('A' + (remaining % RADIX)));
            remaining /= RADIX;
        }
        return letters.reverse().toString();
    }

    static long decodeRow(String digits) {
        if (digits.isEmpty()) {
            throw new CellReferenceParseException(digits, "missing row digits");
        }
        for (int i = 0; i < digits.length(); i++) {
            if (!isDigit(digits.charAt(i))) {
                throw new CellReferenceParseException(digits, "invalid row char " + digits.charAt(i));
            }
        }
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new CellReferenceParseException(digits, "row out of range", e);
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
