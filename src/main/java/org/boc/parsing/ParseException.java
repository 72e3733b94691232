package org.boc.parsing;

import org.boc.BocException;

/**
 * Raised on the first token the {@link RecursiveDescentParser} cannot accept. Parsing stops there,
 * no partial tree is returned.
 */
public class ParseException extends BocException {

    private final ParserErrors error;
    private final String expected;
    private final Token actual;

    public ParseException(ParserErrors error, String expected, Token actual) {
        this(error, expected, actual, null);
    }

    public ParseException(ParserErrors error, String expected, Token actual, Throwable cause) {
        super(String.format("%s: expected %s, got %s at %d:%d",
                error, expected, actual.getType(), actual.getLine(), actual.getColumn()), cause);
        this.error = error;
        this.expected = expected;
        this.actual = actual;
    }

    public ParserErrors getError() {
        return error;
    }

    public String getExpected() {
        return expected;
    }

    public Token getActual() {
        return actual;
    }

    public int getLine() {
        return actual.getLine();
    }

    public int getColumn() {
        return actual.getColumn();
    }
}
