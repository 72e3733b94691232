package org.boc.parsing;

import org.boc.BocException;

/**
 * Raised by the {@link Lexer} when the input cannot be split into tokens.
 */
public class LexException extends BocException {

    private final int line;
    private final int column;

    public LexException(String message, int line, int column) {
        super(String.format("%s at %d:%d", message, line, column));
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
