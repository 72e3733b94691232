package org.boc.belief;

/**
 * A caller supplied decay curve, used by beliefs whose curve is {@link DecayCurve#CUSTOM}.
 */
public interface DecayStrategy {

    /**
     * @param confidence the confidence at the last update
     * @param rate       decay rate per period
     * @param periods    elapsed decay periods, never negative
     * @return the decayed confidence, clamped by the caller
     */
    double decay(double confidence, double rate, double periods);
}
