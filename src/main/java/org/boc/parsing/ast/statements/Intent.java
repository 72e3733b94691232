package org.boc.parsing.ast.statements;

import org.boc.parsing.ast.Expression;
import org.boc.parsing.ast.StatementType;
import org.boc.parsing.ast.StatementVisitor;

import java.util.List;
import java.util.Map;

/**
 * {@code intent to_perform: "action" @attrs { ... }}
 */
public class Intent extends BlockStatement {

    public static final String TO_PERFORM = "to_perform";

    // null when the intent names no action
    private final Expression action;

    public Intent(Expression action, Map<String, Expression> attributes, List<BodyEntry> body) {
        super(attributes, body);
        this.action = action;
    }

    public Expression getAction() {
        return action;
    }

    @Override
    public StatementType getType() {
        return StatementType.INTENT;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIntent(this);
    }
}
