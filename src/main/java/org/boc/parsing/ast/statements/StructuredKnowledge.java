package org.boc.parsing.ast.statements;

import org.boc.parsing.ast.Expression;
import org.boc.parsing.ast.StatementType;
import org.boc.parsing.ast.StatementVisitor;

import java.util.List;
import java.util.Map;

/**
 * {@code structured_knowledge { entities: [entity(...), ...] }}
 */
public class StructuredKnowledge extends BlockStatement {

    public StructuredKnowledge(Map<String, Expression> attributes, List<BodyEntry> body) {
        super(attributes, body);
    }

    @Override
    public StatementType getType() {
        return StatementType.STRUCTURED_KNOWLEDGE;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitStructuredKnowledge(this);
    }
}
