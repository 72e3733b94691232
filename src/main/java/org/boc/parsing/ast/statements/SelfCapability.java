package org.boc.parsing.ast.statements;

import org.boc.parsing.ast.Expression;
import org.boc.parsing.ast.StatementType;
import org.boc.parsing.ast.StatementVisitor;

import java.util.List;
import java.util.Map;

public class SelfCapability extends BlockStatement {

    public SelfCapability(Map<String, Expression> attributes, List<BodyEntry> body) {
        super(attributes, body);
    }

    @Override
    public StatementType getType() {
        return StatementType.SELF_CAPABILITY;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitSelfCapability(this);
    }
}
