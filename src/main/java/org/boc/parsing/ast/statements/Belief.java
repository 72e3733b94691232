package org.boc.parsing.ast.statements;

import org.boc.parsing.ast.Expression;
import org.boc.parsing.ast.StatementType;
import org.boc.parsing.ast.StatementVisitor;

import java.util.List;
import java.util.Map;

/**
 * {@code belief confidence=0.85 @attrs { fact: "..." ... }}. The {@code confidence=} prefix is kept
 * as the {@value #CONFIDENCE} attribute.
 */
public class Belief extends BlockStatement {

    public static final String CONFIDENCE = "confidence";

    public Belief(Map<String, Expression> attributes, List<BodyEntry> body) {
        super(attributes, body);
    }

    public Expression getConfidence() {
        return attributes.get(CONFIDENCE);
    }

    @Override
    public StatementType getType() {
        return StatementType.BELIEF;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitBelief(this);
    }
}
