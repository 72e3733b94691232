package org.boc.parsing.ast;

import org.boc.parsing.ast.statements.AgentCoordination;
import org.boc.parsing.ast.statements.Assignment;
import org.boc.parsing.ast.statements.Belief;
import org.boc.parsing.ast.statements.CalculateWithUncertainty;
import org.boc.parsing.ast.statements.ConfidenceDecay;
import org.boc.parsing.ast.statements.Intent;
import org.boc.parsing.ast.statements.Provenance;
import org.boc.parsing.ast.statements.ReasoningContext;
import org.boc.parsing.ast.statements.SelfCapability;
import org.boc.parsing.ast.statements.SharedState;
import org.boc.parsing.ast.statements.StructuredKnowledge;
import org.boc.parsing.ast.statements.UpdateBelief;

public interface StatementVisitor<R> {

    R visitBelief(Belief belief);

    R visitReasoningContext(ReasoningContext context);

    R visitIntent(Intent intent);

    R visitSharedState(SharedState sharedState);

    R visitSelfCapability(SelfCapability capability);

    R visitCalculateWithUncertainty(CalculateWithUncertainty calculation);

    R visitStructuredKnowledge(StructuredKnowledge knowledge);

    R visitUpdateBelief(UpdateBelief update);

    R visitConfidenceDecay(ConfidenceDecay decay);

    R visitAgentCoordination(AgentCoordination coordination);

    R visitProvenance(Provenance provenance);

    R visitAssignment(Assignment assignment);
}
