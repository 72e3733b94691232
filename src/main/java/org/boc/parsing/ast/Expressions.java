package org.boc.parsing.ast;

import org.boc.parsing.ast.expressions.ArrayExpression;
import org.boc.parsing.ast.expressions.Identifier;
import org.boc.parsing.ast.expressions.Literal;
import org.boc.parsing.ast.expressions.UncertaintyExpression;

import java.util.Collections;
import java.util.List;

/**
 * Loose readers used by statement handlers that accept several spellings of the same value.
 */
public final class Expressions {

    private Expressions() {
    }

    /**
     * The plain text of a literal or identifier, the rendered source of anything else, null for null.
     */
    public static String asText(Expression expression) {
        if (expression == null) {
            return null;
        }
        if (expression instanceof Literal) {
            return ((Literal) expression).getValue();
        }
        if (expression instanceof Identifier) {
            return ((Identifier) expression).getName();
        }
        return expression.evaluate();
    }

    /**
     * The text of a string literal or identifier, null for every other expression.
     */
    public static String asFreeText(Expression expression) {
        if (expression instanceof Literal && ((Literal) expression).isString()) {
            return ((Literal) expression).getValue();
        }
        if (expression instanceof Identifier) {
            return ((Identifier) expression).getName();
        }
        return null;
    }

    /**
     * A number literal, a numeric string literal or the base value of an uncertainty; otherwise null.
     */
    public static Double asNumber(Expression expression) {
        if (expression instanceof Literal) {
            Literal literal = (Literal) expression;
            if (literal.isNumber() || literal.isString()) {
                try {
                    return Double.valueOf(literal.getValue().trim());
                } catch (NumberFormatException e) {
                    return null;
                }
            }
            return null;
        }
        if (expression instanceof UncertaintyExpression) {
            return ((UncertaintyExpression) expression).getValue();
        }
        return null;
    }

    /**
     * The items of an array expression, empty for anything else.
     */
    public static List<Expression> asItems(Expression expression) {
        if (expression instanceof ArrayExpression) {
            return ((ArrayExpression) expression).getItems();
        }
        return Collections.emptyList();
    }
}
