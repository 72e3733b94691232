package org.boc.belief;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The record a {@link BeliefStore} keeps for one named belief. Only the store mutates it; callers
 * always receive copies.
 */
public final class BeliefState {

    private final String name;
    private final double initialConfidence;
    private double currentConfidence;
    private final Instant createdAt;
    private Instant lastUpdated;
    private DecayCurve decayCurve;
    private double decayRate;
    private Duration decayPeriod;
    private DecayStrategy customDecay;
    private final List<Evidence> evidenceHistory;
    private final Map<String, Object> metadata;
    private double minConfidence = 0.0;
    private double maxConfidence = 1.0;
    private boolean active = true;

    BeliefState(String name, double confidence, Instant now, DecayCurve decayCurve, double decayRate,
                Duration decayPeriod, Map<String, Object> metadata) {
        this.name = name;
        this.initialConfidence = confidence;
        this.currentConfidence = confidence;
        this.createdAt = now;
        this.lastUpdated = now;
        this.decayCurve = decayCurve;
        this.decayRate = decayRate;
        this.decayPeriod = decayPeriod;
        this.evidenceHistory = new ArrayList<Evidence>();
        this.metadata = metadata == null
                ? new LinkedHashMap<String, Object>()
                : new LinkedHashMap<String, Object>(metadata);
    }

    private BeliefState(BeliefState other) {
        this.name = other.name;
        this.initialConfidence = other.initialConfidence;
        this.currentConfidence = other.currentConfidence;
        this.createdAt = other.createdAt;
        this.lastUpdated = other.lastUpdated;
        this.decayCurve = other.decayCurve;
        this.decayRate = other.decayRate;
        this.decayPeriod = other.decayPeriod;
        this.customDecay = other.customDecay;
        this.evidenceHistory = new ArrayList<Evidence>(other.evidenceHistory);
        this.metadata = new LinkedHashMap<String, Object>(other.metadata);
        this.minConfidence = other.minConfidence;
        this.maxConfidence = other.maxConfidence;
        this.active = other.active;
    }

    /**
     * A detached copy; changes to either side are not seen by the other.
     */
    BeliefState copy() {
        return new BeliefState(this);
    }

    BeliefState withCurrentConfidence(double confidence) {
        BeliefState projected = copy();
        projected.currentConfidence = confidence;
        return projected;
    }

    /**
     * Elapsed decay periods since the last update. Time before the last update counts as zero.
     */
    public double ageInPeriods(Instant now) {
        long elapsedMillis = Duration.between(lastUpdated, now).toMillis();
        if (elapsedMillis <= 0) {
            return 0.0;
        }
        return (double) elapsedMillis / decayPeriod.toMillis();
    }

    double clamp(double confidence) {
        return Math.max(minConfidence, Math.min(maxConfidence, confidence));
    }

    public String getName() {
        return name;
    }

    public double getInitialConfidence() {
        return initialConfidence;
    }

    public double getCurrentConfidence() {
        return currentConfidence;
    }

    void setCurrentConfidence(double confidence) {
        this.currentConfidence = clamp(confidence);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    void setLastUpdated(Instant lastUpdated) {
        this.lastUpdated = lastUpdated;
    }

    public DecayCurve getDecayCurve() {
        return decayCurve;
    }

    public double getDecayRate() {
        return decayRate;
    }

    public Duration getDecayPeriod() {
        return decayPeriod;
    }

    void setDecay(DecayCurve curve, double rate, Duration period) {
        this.decayCurve = curve;
        this.decayRate = rate;
        this.decayPeriod = period;
    }

    public DecayStrategy getCustomDecay() {
        return customDecay;
    }

    void setCustomDecay(DecayStrategy customDecay) {
        this.customDecay = customDecay;
    }

    public List<Evidence> getEvidenceHistory() {
        return Collections.unmodifiableList(evidenceHistory);
    }

    void addEvidence(Evidence evidence) {
        evidenceHistory.add(evidence);
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public double getMaxConfidence() {
        return maxConfidence;
    }

    void setBounds(double minConfidence, double maxConfidence) {
        this.minConfidence = minConfidence;
        this.maxConfidence = maxConfidence;
        this.currentConfidence = clamp(currentConfidence);
    }

    public boolean isActive() {
        return active;
    }

    void setActive(boolean active) {
        this.active = active;
    }

    @Override
    public String toString() {
        return String.format("BeliefState{%s: %.4f (initial %.4f), %s %s per %s, %d evidence%s}",
                name, currentConfidence, initialConfidence, decayCurve, decayRate, decayPeriod,
                evidenceHistory.size(), active ? "" : ", inactive");
    }
}
