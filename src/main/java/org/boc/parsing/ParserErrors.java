package org.boc.parsing;

/**
 * Error codes attached to a {@link ParseException}.
 */
public enum ParserErrors {
    UnexpectedToken(1),
    UnexpectedStatement(2),
    UnexpectedExpression(3),
    InvalidObjectKey(4),
    MissingSeparator(5),
    MalformedNumber(6);

    public final int value;
    ParserErrors(int value){
        this.value = value;
    }
}
