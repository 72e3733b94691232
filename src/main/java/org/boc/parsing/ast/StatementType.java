package org.boc.parsing.ast;

/**
 * Stable tags of the statement variants, as seen by consumers of the AST.
 */
public enum StatementType {
    BELIEF("Belief"),
    REASONING_CONTEXT("ReasoningContext"),
    INTENT("Intent"),
    SHARED_STATE("SharedState"),
    SELF_CAPABILITY("SelfCapability"),
    CALCULATE_WITH_UNCERTAINTY("CalculateWithUncertainty"),
    STRUCTURED_KNOWLEDGE("StructuredKnowledge"),
    UPDATE_BELIEF("UpdateBelief"),
    CONFIDENCE_DECAY("ConfidenceDecay"),
    AGENT_COORDINATION("AgentCoordination"),
    PROVENANCE("Provenance"),
    ASSIGNMENT("Assignment");

    private final String tag;

    StatementType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
