package org.boc.parsing.ast.expressions;

import org.boc.parsing.ast.Expression;

/**
 * Base of the expression variants. The constructor is package private, which keeps the set of
 * variants closed to this package.
 */
public abstract class AbstractExpression implements Expression {

    AbstractExpression(){
    }

    @Override
    public String toString(){
        return this.evaluate();
    }
}
