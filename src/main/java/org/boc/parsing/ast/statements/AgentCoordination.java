package org.boc.parsing.ast.statements;

import org.boc.parsing.ast.Expression;
import org.boc.parsing.ast.StatementType;
import org.boc.parsing.ast.StatementVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code agent_coordination coordinator: "lead" { participants: [...] type: "..." constraints: [...] }}
 */
public class AgentCoordination extends BlockStatement {

    public static final String COORDINATOR = "coordinator";
    public static final String PARTICIPANTS = "participants";
    public static final String TYPE = "type";
    public static final String CONSTRAINTS = "constraints";

    private final Expression coordinator;
    private final List<Expression> participants;
    private final Expression coordinationType;
    private final List<Expression> constraints;

    public AgentCoordination(Expression coordinator, List<BodyEntry> body, List<Expression> participants,
                             Expression coordinationType, List<Expression> constraints) {
        super(Collections.<String, Expression>emptyMap(), body);
        this.coordinator = coordinator;
        this.participants = Collections.unmodifiableList(new ArrayList<Expression>(participants));
        this.coordinationType = coordinationType;
        this.constraints = Collections.unmodifiableList(new ArrayList<Expression>(constraints));
    }

    public Expression getCoordinator() {
        return coordinator;
    }

    public List<Expression> getParticipants() {
        return participants;
    }

    public Expression getCoordinationType() {
        return coordinationType;
    }

    public List<Expression> getConstraints() {
        return constraints;
    }

    @Override
    public StatementType getType() {
        return StatementType.AGENT_COORDINATION;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitAgentCoordination(this);
    }
}
