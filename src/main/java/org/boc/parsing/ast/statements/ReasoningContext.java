package org.boc.parsing.ast.statements;

import org.boc.parsing.ast.Expression;
import org.boc.parsing.ast.StatementType;
import org.boc.parsing.ast.StatementVisitor;

import java.util.List;
import java.util.Map;

public class ReasoningContext extends BlockStatement {

    public ReasoningContext(Map<String, Expression> attributes, List<BodyEntry> body) {
        super(attributes, body);
    }

    @Override
    public StatementType getType() {
        return StatementType.REASONING_CONTEXT;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitReasoningContext(this);
    }
}
