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

import dev.cellcalc.api.FormulaSyntaxException;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the formula grammar over source text.
 */
public final class FormulaParsers {
    private static final Logger log = LoggerFactory.getLogger(FormulaParsers.class);

    private FormulaParsers() {}

    /**
     * Produce the parse tree for a whole formula.
     *
     * @throws FormulaSyntaxException on the first lexical or syntactic problem; the input is
     *     never partially accepted
     */
    public static CellFormulaParser.FormulaContext parse(String text) {
        CellFormulaLexer lexer = new CellFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CellFormulaParser parser = new CellFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        return parser.formula();
    }

    private static final class ThrowingErrorListener extends BaseErrorListener {
        static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

        @Override
        public void syntaxError(
                Recognizer<?, ?> recognizer,
                Object offendingSymbol,
                int line,
                int charPositionInLine,
                String msg,
                RecognitionException e) {
            String offendingText = offendingSymbol instanceof Token ? ((Token) offendingSymbol).getText() : null;
            log.debug("Rejected formula input at {}:{}: {}", line, charPositionInLine, msg);
            throw new FormulaSyntaxException(line, charPositionInLine, offendingText, msg);
        }
    }
}
