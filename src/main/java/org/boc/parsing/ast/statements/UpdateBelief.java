package org.boc.parsing.ast.statements;

import org.boc.ValueException;
import org.boc.belief.Evidence;
import org.boc.belief.EvidenceType;
import org.boc.parsing.ast.Expression;
import org.boc.parsing.ast.Expressions;
import org.boc.parsing.ast.Statement;
import org.boc.parsing.ast.StatementType;
import org.boc.parsing.ast.StatementVisitor;

import java.time.Instant;

/**
 * {@code update_belief name(0.92) evidence: "secondary_sensor"}
 */
public class UpdateBelief implements Statement {

    public static final String EVIDENCE = "evidence";
    public static final String UNKNOWN_SOURCE = "unknown";

    private final String beliefName;
    private final Expression newConfidence;
    private final Expression evidenceSource;
    private final Instant timestamp;

    public UpdateBelief(String beliefName, Expression newConfidence, Expression evidenceSource, Instant timestamp) {
        this.beliefName = beliefName;
        this.newConfidence = newConfidence;
        this.evidenceSource = evidenceSource;
        this.timestamp = timestamp;
    }

    public String getBeliefName() {
        return beliefName;
    }

    public Expression getNewConfidence() {
        return newConfidence;
    }

    /**
     * The numeric confidence, null when the expression is not a number.
     */
    public Double getNewConfidenceValue() {
        return Expressions.asNumber(newConfidence);
    }

    public Expression getEvidenceSource() {
        return evidenceSource;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public EvidenceType getEvidenceType() {
        return EvidenceType.NEUTRAL;
    }

    /**
     * The neutral, unit weight evidence this update carries, stamped with the parse time.
     *
     * @throws ValueException if the confidence is not a number in [0, 1]
     */
    public Evidence toEvidence() {
        Double confidence = getNewConfidenceValue();
        if (confidence == null) {
            throw new ValueException("Belief update confidence is not a number: " + newConfidence.evaluate());
        }
        String source = evidenceSource == null ? UNKNOWN_SOURCE : Expressions.asText(evidenceSource);
        return new Evidence("Belief update to " + newConfidence.evaluate(), confidence, source,
                timestamp, getEvidenceType(), Evidence.DEFAULT_WEIGHT);
    }

    @Override
    public StatementType getType() {
        return StatementType.UPDATE_BELIEF;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitUpdateBelief(this);
    }

    @Override
    public String toString() {
        return String.format("update_belief %s(%s)%s", beliefName, newConfidence.evaluate(),
                evidenceSource == null ? "" : " evidence: " + evidenceSource.evaluate());
    }
}
