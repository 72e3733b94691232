package org.boc.parsing.ast.statements;

import org.boc.parsing.ast.Expression;
import org.boc.parsing.ast.Statement;
import org.boc.parsing.ast.StatementType;
import org.boc.parsing.ast.StatementVisitor;

/**
 * {@code key = expr}
 */
public class Assignment implements Statement {

    private final String key;
    private final Expression value;

    public Assignment(String key, Expression value) {
        this.key = key;
        this.value = value;
    }

    public String getKey() {
        return key;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public StatementType getType() {
        return StatementType.ASSIGNMENT;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }

    @Override
    public String toString() {
        return String.format("%s = %s", key, value.evaluate());
    }
}
