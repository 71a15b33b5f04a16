package com.sattline.lint.loader;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/** Aborts lexing or parsing on the first syntax error, keeping its position. */
final class ThrowingErrorListener extends BaseErrorListener {
    static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

    private ThrowingErrorListener() {}

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        throw new SyntaxErrorCancellation(line, charPositionInLine + 1, msg, e);
    }

    static final class SyntaxErrorCancellation extends ParseCancellationException {
        private final int line;
        private final int column;

        SyntaxErrorCancellation(int line, int column, String message, Throwable cause) {
            super(message, cause);
            this.line = line;
            this.column = column;
        }

        int getLine() {
            return line;
        }

        int getColumn() {
            return column;
        }
    }
}
