package org.boc.parsing.ast.expressions;

import org.boc.parsing.Lexer;
import org.boc.parsing.ast.ExpressionType;
import org.boc.parsing.ast.ExpressionVisitor;
import org.boc.uncertainty.UncertaintyType;
import org.boc.uncertainty.UncertaintyValue;

/**
 * {@code 22.5 ± 0.1}, or a bare {@code ±0.1} whose base value is left to the surrounding context.
 */
public class UncertaintyExpression extends AbstractExpression {

    // null when the source only carried the ± part
    private final Double value;
    private final double uncertainty;

    public UncertaintyExpression(Double value, double uncertainty) {
        this.value = value;
        this.uncertainty = uncertainty;
    }

    public boolean hasValue() {
        return value != null;
    }

    public Double getValue() {
        return value;
    }

    public double getUncertainty() {
        return uncertainty;
    }

    /**
     * @throws IllegalStateException when there is no base value
     */
    public UncertaintyValue toUncertaintyValue() {
        if (value == null) {
            throw new IllegalStateException("Uncertainty " + evaluate() + " has no base value");
        }
        return new UncertaintyValue(value, uncertainty, UncertaintyType.ABSOLUTE);
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.UNCERTAINTY;
    }

    @Override
    public String evaluate() {
        String bound = Lexer.UNCERTAINTY_SIGN + formatNumber(uncertainty);
        return value == null ? bound : formatNumber(value) + " " + bound;
    }

    private static String formatNumber(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d)) {
            return String.valueOf((long) d);
        }
        return String.valueOf(d);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUncertainty(this);
    }
}
