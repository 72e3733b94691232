package org.boc.belief;

import org.boc.ValueException;
import org.boc.config.BocConfiguration;
import org.boc.helper.DefaultHashTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.BinaryOperator;

/**
 * Named beliefs whose confidence decays with time and moves with evidence.
 *
 * <p>Unknown names are an ordinary outcome and are reported through the return value, never thrown.
 * Caller supplied confidences outside [0, 1] are rejected with a {@link ValueException}; computed
 * confidences are clamped to the belief's bounds.
 *
 * <p>Not thread safe: {@link #update} reads the decayed confidence and writes the blended one in two
 * steps, so concurrent callers must serialize all mutations of a belief.
 */
public class BeliefStore {

    private static final Logger LOG = LoggerFactory.getLogger(BeliefStore.class);

    private static final BinaryOperator<Double> SUM = new BinaryOperator<Double>() {
        @Override
        public Double apply(Double a, Double b) {
            return a + b;
        }
    };

    private final Map<String, BeliefState> beliefs = new LinkedHashMap<String, BeliefState>();
    private final BocConfiguration config;
    private final Clock clock;

    public BeliefStore() {
        this(BocConfiguration.load(), Clock.systemUTC());
    }

    public BeliefStore(BocConfiguration config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public BocConfiguration getConfiguration() {
        return config;
    }

    public Clock getClock() {
        return clock;
    }

    public BeliefState create(String name, double initialConfidence) {
        return create(name, initialConfidence, config.getDecayCurve(), config.getDecayRate(),
                config.getDecayPeriod(), null);
    }

    /**
     * Stores a fresh belief, replacing any earlier belief of the same name.
     *
     * @return a copy of the stored record
     * @throws ValueException if the confidence is outside [0, 1] or the period is not positive
     */
    public BeliefState create(String name, double initialConfidence, DecayCurve curve, double rate,
                              Duration period, Map<String, Object> metadata) {
        requireConfidence("Initial confidence", initialConfidence);
        requirePeriod(period);

        BeliefState belief = new BeliefState(name, initialConfidence, now(), curve, rate, period, metadata);
        if (beliefs.put(name, belief) != null) {
            LOG.debug("Replaced belief {}", name);
        }
        LOG.debug("Created {}", belief);
        return belief.copy();
    }

    /**
     * Moves a belief towards newConfidence. With evidence, the decayed confidence and newConfidence are
     * blended by the evidence weight and the evidence is recorded; without it, newConfidence replaces
     * the current value.
     *
     * @return false if there is no belief of that name
     * @throws ValueException if newConfidence is outside [0, 1]
     */
    public boolean update(String name, double newConfidence, Evidence evidence) {
        BeliefState belief = beliefs.get(name);
        if (belief == null) {
            return false;
        }
        requireConfidence("New confidence", newConfidence);

        Instant now = now();
        double decayed = applyDecay(belief, now);
        double combined;
        if (evidence != null) {
            belief.addEvidence(evidence);
            double weight = EvidenceWeights.weight(evidence, now);
            combined = EvidenceWeights.combine(decayed, newConfidence, weight);
            LOG.debug("Belief {}: decayed {} blended with {} at evidence weight {}", name, decayed, newConfidence, weight);
        }
        else {
            combined = newConfidence;
        }

        belief.setCurrentConfidence(combined);
        belief.setLastUpdated(now);
        return true;
    }

    public boolean update(String name, double newConfidence) {
        return update(name, newConfidence, null);
    }

    /**
     * The confidence of the belief after decay up to now. Pure: the belief is not modified.
     */
    public double applyDecay(BeliefState belief) {
        return applyDecay(belief, now());
    }

    private double applyDecay(BeliefState belief, Instant now) {
        if (!belief.isActive()) {
            return belief.getCurrentConfidence();
        }
        double periods = belief.ageInPeriods(now);
        DecayStrategy strategy = belief.getDecayCurve();
        if (strategy == DecayCurve.CUSTOM && belief.getCustomDecay() != null) {
            strategy = belief.getCustomDecay();
        }
        double decayed = strategy.decay(belief.getCurrentConfidence(), belief.getDecayRate(), periods);
        return belief.clamp(decayed);
    }

    /**
     * @return the decayed confidence, empty if there is no belief of that name
     */
    public OptionalDouble getCurrentConfidence(String name) {
        BeliefState belief = beliefs.get(name);
        if (belief == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(applyDecay(belief));
    }

    /**
     * Records contradicting evidence and takes a flat penalty of
     * {@code evidence.confidence * penalty} off the current confidence.
     *
     * @return the penalty applied, 0 if there is no belief of that name
     */
    public double addContradictoryEvidence(String name, Evidence evidence) {
        BeliefState belief = beliefs.get(name);
        if (belief == null) {
            return 0.0;
        }
        belief.addEvidence(evidence);

        double penalty = evidence.getConfidence() * config.getConflictPenalty();
        belief.setCurrentConfidence(belief.getCurrentConfidence() - penalty);
        belief.setLastUpdated(now());
        LOG.debug("Belief {}: contradicting evidence from {} cost {}", name, evidence.getSource(), penalty);
        return penalty;
    }

    /**
     * Weighs contradicting evidence against positive and negative evidence. Contradiction that
     * outweighs both together halves the confidence (by default), any other contradiction reduces it
     * moderately.
     *
     * @return the resulting confidence, 0 if there is no belief of that name
     */
    public double resolveConflicts(String name) {
        BeliefState belief = beliefs.get(name);
        if (belief == null) {
            return 0.0;
        }

        Instant now = now();
        DefaultHashTable<EvidenceType, Double> weights = new DefaultHashTable<EvidenceType, Double>(0.0);
        boolean contradicted = false;
        for (Evidence evidence : belief.getEvidenceHistory()) {
            weights.accumulate(evidence.getType(), EvidenceWeights.weight(evidence, now), SUM);
            contradicted |= evidence.getType() == EvidenceType.CONTRADICTORY;
        }
        if (!contradicted) {
            return belief.getCurrentConfidence();
        }

        double contradictory = weights.get(EvidenceType.CONTRADICTORY);
        double supporting = weights.get(EvidenceType.POSITIVE) + weights.get(EvidenceType.NEGATIVE);
        if (contradictory > supporting) {
            belief.setCurrentConfidence(belief.getCurrentConfidence() * config.getConflictHighFactor());
        }
        else if (contradictory > 0) {
            belief.setCurrentConfidence(belief.getCurrentConfidence() * config.getConflictModerateFactor());
        }
        belief.setLastUpdated(now);
        LOG.debug("Belief {}: contradictory weight {} against {}, confidence now {}",
                name, contradictory, supporting, belief.getCurrentConfidence());
        return belief.getCurrentConfidence();
    }

    /**
     * Changes how an existing belief decays from now on.
     *
     * @return false if there is no belief of that name
     */
    public boolean configureDecay(String name, DecayCurve curve, double rate, Duration period) {
        BeliefState belief = beliefs.get(name);
        if (belief == null) {
            return false;
        }
        requirePeriod(period);
        belief.setDecay(curve, rate, period);
        LOG.debug("Belief {}: decay set to {} {} per {}", name, curve, rate, period);
        return true;
    }

    /**
     * Installs the strategy used while the belief's curve is {@link DecayCurve#CUSTOM}.
     */
    public boolean setCustomDecay(String name, DecayStrategy strategy) {
        BeliefState belief = beliefs.get(name);
        if (belief == null) {
            return false;
        }
        belief.setCustomDecay(strategy);
        return true;
    }

    /**
     * @throws ValueException unless 0 <= min <= max <= 1
     */
    public boolean setConfidenceBounds(String name, double min, double max) {
        BeliefState belief = beliefs.get(name);
        if (belief == null) {
            return false;
        }
        requireConfidence("Minimum confidence", min);
        requireConfidence("Maximum confidence", max);
        if (min > max) {
            throw new ValueException(String.format("Minimum confidence %s exceeds maximum %s", min, max));
        }
        belief.setBounds(min, max);
        return true;
    }

    /**
     * An inactive belief keeps its confidence, decay is suspended.
     */
    public boolean setActive(String name, boolean active) {
        BeliefState belief = beliefs.get(name);
        if (belief == null) {
            return false;
        }
        belief.setActive(active);
        return true;
    }

    public boolean contains(String name) {
        return beliefs.containsKey(name);
    }

    public int size() {
        return beliefs.size();
    }

    /**
     * A copy of the stored record, with no decay applied.
     */
    public Optional<BeliefState> getBelief(String name) {
        BeliefState belief = beliefs.get(name);
        return belief == null ? Optional.<BeliefState>empty() : Optional.of(belief.copy());
    }

    /**
     * Copies of every belief in creation order, optionally showing the decayed confidence. The
     * stored records are left untouched.
     */
    public Map<String, BeliefState> getAllBeliefs(boolean applyDecay) {
        Instant now = now();
        Map<String, BeliefState> result = new LinkedHashMap<String, BeliefState>();
        for (Map.Entry<String, BeliefState> entry : beliefs.entrySet()) {
            BeliefState belief = entry.getValue();
            result.put(entry.getKey(), applyDecay
                    ? belief.withCurrentConfidence(applyDecay(belief, now))
                    : belief.copy());
        }
        return Collections.unmodifiableMap(result);
    }

    private Instant now() {
        return clock.instant();
    }

    private static void requireConfidence(String what, double confidence) {
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new ValueException(what + " must be between 0.0 and 1.0, got " + confidence);
        }
    }

    private static void requirePeriod(Duration period) {
        if (period == null || period.isZero() || period.isNegative()) {
            throw new ValueException("Decay period must be positive, got " + period);
        }
    }
}
