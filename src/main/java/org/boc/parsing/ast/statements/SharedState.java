package org.boc.parsing.ast.statements;

import org.boc.parsing.ast.Expression;
import org.boc.parsing.ast.StatementType;
import org.boc.parsing.ast.StatementVisitor;

import java.util.List;
import java.util.Map;

/**
 * {@code shared_state @attrs { ... }}
 */
public class SharedState extends BlockStatement {

    public SharedState(Map<String, Expression> attributes, List<BodyEntry> body) {
        super(attributes, body);
    }

    @Override
    public StatementType getType() {
        return StatementType.SHARED_STATE;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitSharedState(this);
    }
}
