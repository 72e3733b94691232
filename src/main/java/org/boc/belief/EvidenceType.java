package org.boc.belief;

/**
 * Polarity of a piece of evidence, with the factor it contributes to the evidence weight.
 */
public enum EvidenceType {
    POSITIVE(1.2),
    NEGATIVE(1.1),
    NEUTRAL(0.8),
    CONTRADICTORY(0.5);

    private final double weightFactor;

    EvidenceType(double weightFactor) {
        this.weightFactor = weightFactor;
    }

    public double getWeightFactor() {
        return weightFactor;
    }
}
