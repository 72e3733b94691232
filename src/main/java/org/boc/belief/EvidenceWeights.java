package org.boc.belief;

import java.time.Duration;
import java.time.Instant;

/**
 * How much a piece of evidence counts: its own weight, discounted by age and polarity.
 */
public final class EvidenceWeights {

    private static final double HOUR_MILLIS = Duration.ofHours(1).toMillis();

    private EvidenceWeights() {
    }

    /**
     * 1.0 under an hour old, 0.8 under a day, 0.6 under a week, 0.4 after that.
     * Evidence stamped in the future counts as fresh.
     */
    public static double recencyFactor(Duration age) {
        double ageHours = age.toMillis() / HOUR_MILLIS;
        if (ageHours < 1) {
            return 1.0;
        }
        else if (ageHours < 24) {
            return 0.8;
        }
        else if (ageHours < 168) {
            return 0.6;
        }
        return 0.4;
    }

    public static double weight(Evidence evidence, Instant now) {
        double recency = recencyFactor(Duration.between(evidence.getTimestamp(), now));
        return evidence.getWeight() * recency * evidence.getType().getWeightFactor();
    }

    /**
     * Share given to the new confidence: weight/(weight+1) for strong evidence, an even split otherwise.
     */
    public static double blendWeight(double evidenceWeight) {
        if (evidenceWeight > 1.0) {
            return evidenceWeight / (evidenceWeight + 1.0);
        }
        return 0.5;
    }

    public static double combine(double currentConfidence, double newConfidence, double evidenceWeight) {
        double w = blendWeight(evidenceWeight);
        return (1 - w) * currentConfidence + w * newConfidence;
    }
}
