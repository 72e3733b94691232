package org.boc.parsing.ast.expressions;

import org.boc.parsing.ast.ExpressionType;
import org.boc.parsing.ast.ExpressionVisitor;

public class Identifier extends AbstractExpression {

    private final String name;

    public Identifier(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.IDENTIFIER;
    }

    @Override
    public String evaluate() {
        return name;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Identifier && name.equals(((Identifier) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
