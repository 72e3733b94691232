package org.boc.parsing.ast;

/**
 * <expression>::=<array>|<object>|<entity>|<literal>[<uncertainty>]|<identifier>|<uncertainty>
 * <array>::='[' [<expression>{','<expression>}] ']'
 * <object>::='{' {<key>':'<expression>[',']} '}'
 * <entity>::='entity' '(' <expression> ',' <object> ')'
 * <literal>::=<string>|<number>|<boolean>
 */
public interface Expression {

    ExpressionType getType();

    /**
     * Renders the expression back to compact source text.
     */
    String evaluate();

    <R> R accept(ExpressionVisitor<R> visitor);
}
