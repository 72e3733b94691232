package org.boc.parsing.ast.statements;

import org.boc.parsing.ast.Expression;
import org.boc.parsing.ast.StatementType;
import org.boc.parsing.ast.StatementVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code provenance { source: "..." timestamp: "..." chain_of_custody: [...] }}
 */
public class Provenance extends BlockStatement {

    public static final String SOURCE = "source";
    public static final String TIMESTAMP = "timestamp";
    public static final String CHAIN_OF_CUSTODY = "chain_of_custody";

    private final Expression source;
    private final Expression timestamp;
    private final List<Expression> chainOfCustody;

    public Provenance(List<BodyEntry> body, Expression source, Expression timestamp, List<Expression> chainOfCustody) {
        super(Collections.<String, Expression>emptyMap(), body);
        this.source = source;
        this.timestamp = timestamp;
        this.chainOfCustody = Collections.unmodifiableList(new ArrayList<Expression>(chainOfCustody));
    }

    public Expression getSource() {
        return source;
    }

    public Expression getTimestamp() {
        return timestamp;
    }

    public List<Expression> getChainOfCustody() {
        return chainOfCustody;
    }

    @Override
    public StatementType getType() {
        return StatementType.PROVENANCE;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitProvenance(this);
    }
}
