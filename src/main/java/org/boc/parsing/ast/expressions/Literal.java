package org.boc.parsing.ast.expressions;

import org.boc.parsing.ast.ExpressionType;
import org.boc.parsing.ast.ExpressionVisitor;

/**
 * A string, number or boolean exactly as written in the source.
 */
public class Literal extends AbstractExpression {

    private final LiteralType literalType;
    private final String value;

    public Literal(LiteralType literalType, String value) {
        this.literalType = literalType;
        this.value = value;
    }

    public static Literal string(String value) {
        return new Literal(LiteralType.STRING, value);
    }

    public static Literal number(String value) {
        return new Literal(LiteralType.NUMBER, value);
    }

    public static Literal bool(boolean value) {
        return new Literal(LiteralType.BOOLEAN, String.valueOf(value));
    }

    public LiteralType getLiteralType() {
        return literalType;
    }

    public String getValue() {
        return value;
    }

    public boolean isNumber() {
        return literalType == LiteralType.NUMBER;
    }

    public boolean isString() {
        return literalType == LiteralType.STRING;
    }

    public double asDouble() {
        return Double.parseDouble(value);
    }

    public boolean asBoolean() {
        return Boolean.parseBoolean(value);
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.LITERAL;
    }

    @Override
    public String evaluate() {
        if (literalType == LiteralType.STRING) {
            return String.format("\"%s\"", value.replace("\\", "\\\\").replace("\"", "\\\""));
        }
        return value;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Literal)) {
            return false;
        }
        Literal other = (Literal) o;
        return literalType == other.literalType && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return 31 * literalType.hashCode() + value.hashCode();
    }
}
