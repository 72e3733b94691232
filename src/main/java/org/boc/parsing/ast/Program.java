package org.boc.parsing.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The ordered top level statements of one parsed source text.
 */
public final class Program {

    private final List<Statement> statements;

    public Program(List<Statement> statements) {
        this.statements = Collections.unmodifiableList(new ArrayList<Statement>(statements));
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public int size() {
        return statements.size();
    }

    public Statement get(int index) {
        return statements.get(index);
    }

    /**
     * Statements of one variant, in source order.
     */
    public <T extends Statement> List<T> getStatements(Class<T> statementClass) {
        List<T> matches = new ArrayList<T>();
        for (Statement statement : statements) {
            if (statementClass.isInstance(statement)) {
                matches.add(statementClass.cast(statement));
            }
        }
        return matches;
    }
}
