package org.boc.parsing.ast;

/**
 * A top level construct of a BOC program.
 */
public interface Statement {

    StatementType getType();

    <R> R accept(StatementVisitor<R> visitor);
}
