package org.boc.belief;

import org.boc.ValueException;

import java.util.Locale;

/**
 * The closed family of confidence decay curves. C is the confidence at the last update, r the rate
 * per period and t the elapsed periods.
 */
public enum DecayCurve implements DecayStrategy {

    /** max(0, C - r*t) */
    LINEAR {
        @Override
        public double decay(double confidence, double rate, double periods) {
            return Math.max(0.0, confidence - rate * periods);
        }
    },
    /** C * e^(-r*t) */
    EXPONENTIAL {
        @Override
        public double decay(double confidence, double rate, double periods) {
            return confidence * Math.exp(-rate * periods);
        }
    },
    /** C / (1 + r*ln(1 + t)) */
    LOGARITHMIC {
        @Override
        public double decay(double confidence, double rate, double periods) {
            return confidence / (1.0 + rate * Math.log(1.0 + periods));
        }
    },
    /** C * r^floor(t) */
    STEP {
        @Override
        public double decay(double confidence, double rate, double periods) {
            return confidence * Math.pow(rate, Math.floor(periods));
        }
    },
    /**
     * Placeholder for a {@link DecayStrategy} installed on the belief. Without one it behaves as
     * {@link #EXPONENTIAL}.
     */
    CUSTOM {
        @Override
        public double decay(double confidence, double rate, double periods) {
            return EXPONENTIAL.decay(confidence, rate, periods);
        }
    };

    public static DecayCurve fromName(String name) {
        if (name == null) {
            throw new ValueException("Decay curve name is missing");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValueException("Unknown decay curve: " + name, e);
        }
    }
}
