package org.boc.parsing.ast.statements;

import org.boc.belief.DecayCurve;
import org.boc.parsing.ast.Expression;
import org.boc.parsing.ast.Statement;
import org.boc.parsing.ast.StatementType;
import org.boc.parsing.ast.StatementVisitor;

import java.time.Duration;

/**
 * {@code confidence_decay name("exponential(0.05/day)") period: "7_days"}, with the curve, rate and
 * period already mined from the free text.
 */
public class ConfidenceDecay implements Statement {

    public static final String PERIOD = "period";

    private final String beliefName;
    private final Expression decaySpec;
    private final Expression periodSpec;
    private final DecayCurve curve;
    private final double rate;
    private final Duration period;

    public ConfidenceDecay(String beliefName, Expression decaySpec, Expression periodSpec,
                           DecayCurve curve, double rate, Duration period) {
        this.beliefName = beliefName;
        this.decaySpec = decaySpec;
        this.periodSpec = periodSpec;
        this.curve = curve;
        this.rate = rate;
        this.period = period;
    }

    public String getBeliefName() {
        return beliefName;
    }

    public Expression getDecaySpec() {
        return decaySpec;
    }

    // null when no period was given
    public Expression getPeriodSpec() {
        return periodSpec;
    }

    public DecayCurve getCurve() {
        return curve;
    }

    public double getRate() {
        return rate;
    }

    public Duration getPeriod() {
        return period;
    }

    @Override
    public StatementType getType() {
        return StatementType.CONFIDENCE_DECAY;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitConfidenceDecay(this);
    }

    @Override
    public String toString() {
        return String.format("confidence_decay %s(%s %s per %s)", beliefName, curve, rate, period);
    }
}
