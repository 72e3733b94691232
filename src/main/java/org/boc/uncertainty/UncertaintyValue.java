package org.boc.uncertainty;

import org.boc.ValueException;
import org.boc.parsing.Lexer;

/**
 * An immutable measured value with its uncertainty.
 */
public final class UncertaintyValue {

    public static final double DEFAULT_CONFIDENCE_LEVEL = 0.95;

    private final double value;
    private final double uncertainty;
    private final UncertaintyType type;
    private final double confidenceLevel;

    public UncertaintyValue(double value, double uncertainty) {
        this(value, uncertainty, UncertaintyType.ABSOLUTE);
    }

    public UncertaintyValue(double value, double uncertainty, UncertaintyType type) {
        this(value, uncertainty, type, DEFAULT_CONFIDENCE_LEVEL);
    }

    /**
     * @throws ValueException if the uncertainty is negative
     */
    public UncertaintyValue(double value, double uncertainty, UncertaintyType type, double confidenceLevel) {
        if (!(uncertainty >= 0)) {
            throw new ValueException("Uncertainty cannot be negative, got " + uncertainty);
        }
        if (type == null) {
            throw new ValueException("Uncertainty type is required");
        }
        this.value = value;
        this.uncertainty = uncertainty;
        this.type = type;
        this.confidenceLevel = confidenceLevel;
    }

    public double getValue() {
        return value;
    }

    public double getUncertainty() {
        return uncertainty;
    }

    public UncertaintyType getType() {
        return type;
    }

    public double getConfidenceLevel() {
        return confidenceLevel;
    }

    /**
     * The uncertainty in the units of the value. A standard deviation is widened to 2σ, roughly the
     * 95% interval.
     */
    public double absolute() {
        switch (type) {
            case RELATIVE:
                return Math.abs(value) * uncertainty;
            case STANDARD_DEVIATION:
                return 2 * uncertainty;
            case ABSOLUTE:
            case CONFIDENCE_INTERVAL:
            default:
                return uncertainty;
        }
    }

    /**
     * The uncertainty as a fraction of the value; infinite for an uncertain zero.
     */
    public double relative() {
        double absolute = absolute();
        if (value == 0) {
            return absolute > 0 ? Double.POSITIVE_INFINITY : 0.0;
        }
        return absolute / Math.abs(value);
    }

    public double stdDev() {
        switch (type) {
            case STANDARD_DEVIATION:
                return uncertainty;
            case CONFIDENCE_INTERVAL:
                return uncertainty / 2.0;
            default:
                return absolute() / 2.0;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UncertaintyValue)) {
            return false;
        }
        UncertaintyValue other = (UncertaintyValue) o;
        return Double.compare(value, other.value) == 0
                && Double.compare(uncertainty, other.uncertainty) == 0
                && type == other.type
                && Double.compare(confidenceLevel, other.confidenceLevel) == 0;
    }

    @Override
    public int hashCode() {
        int result = Double.valueOf(value).hashCode();
        result = 31 * result + Double.valueOf(uncertainty).hashCode();
        result = 31 * result + type.hashCode();
        return 31 * result + Double.valueOf(confidenceLevel).hashCode();
    }

    @Override
    public String toString() {
        return value + " " + Lexer.UNCERTAINTY_SIGN + uncertainty + " (" + type.tag() + ")";
    }
}
