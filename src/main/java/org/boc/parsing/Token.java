package org.boc.parsing;

/**
 * A classified piece of source text together with the position of its first character.
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final int line;
    private final int column;

    public Token(TokenType type, String text, int line, int column) {
        this.type = type;
        this.text = text;
        this.line = line;
        this.column = column;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    @Override
    public String toString() {
        return String.format("%s('%s') at %d:%d", type, text, line, column);
    }
}
