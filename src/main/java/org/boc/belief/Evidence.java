package org.boc.belief;

import org.boc.ValueException;

import java.time.Instant;

/**
 * An observation for or against a belief. Immutable.
 */
public final class Evidence {

    public static final double DEFAULT_WEIGHT = 1.0;

    private final String content;
    private final double confidence;
    private final String source;
    private final Instant timestamp;
    private final EvidenceType type;
    private final double weight;

    public Evidence(String content, double confidence, String source, Instant timestamp, EvidenceType type) {
        this(content, confidence, source, timestamp, type, DEFAULT_WEIGHT);
    }

    /**
     * @throws ValueException if confidence is outside [0, 1] or weight is negative
     */
    public Evidence(String content, double confidence, String source, Instant timestamp,
                    EvidenceType type, double weight) {
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new ValueException("Evidence confidence must be between 0.0 and 1.0, got " + confidence);
        }
        if (!(weight >= 0.0)) {
            throw new ValueException("Evidence weight cannot be negative, got " + weight);
        }
        if (timestamp == null || type == null) {
            throw new ValueException("Evidence needs a timestamp and a type");
        }
        this.content = content;
        this.confidence = confidence;
        this.source = source;
        this.timestamp = timestamp;
        this.type = type;
        this.weight = weight;
    }

    public String getContent() {
        return content;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getSource() {
        return source;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public EvidenceType getType() {
        return type;
    }

    public double getWeight() {
        return weight;
    }

    @Override
    public String toString() {
        return String.format("%s evidence from %s (%.3f): %s", type, source, confidence, content);
    }
}
