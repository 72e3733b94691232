package org.boc.uncertainty;

import org.boc.ValueException;

/**
 * First order propagation of independent uncertainties through arithmetic.
 *
 * Sums and differences combine standard deviations in quadrature and report a standard deviation.
 * Everything else combines relative uncertainties and reports an absolute uncertainty.
 */
public final class UncertaintyPropagator {

    private UncertaintyPropagator() {
    }

    public static UncertaintyValue add(UncertaintyValue a, UncertaintyValue b) {
        return new UncertaintyValue(a.getValue() + b.getValue(), quadrature(a.stdDev(), b.stdDev()),
                UncertaintyType.STANDARD_DEVIATION);
    }

    public static UncertaintyValue subtract(UncertaintyValue a, UncertaintyValue b) {
        return new UncertaintyValue(a.getValue() - b.getValue(), quadrature(a.stdDev(), b.stdDev()),
                UncertaintyType.STANDARD_DEVIATION);
    }

    public static UncertaintyValue multiply(UncertaintyValue a, UncertaintyValue b) {
        double result = a.getValue() * b.getValue();
        return absolute(result, quadrature(a.relative(), b.relative()));
    }

    /**
     * @throws ValueException if the divisor's value is zero
     */
    public static UncertaintyValue divide(UncertaintyValue a, UncertaintyValue b) {
        if (b.getValue() == 0) {
            throw new ValueException("Division by zero in uncertain value calculation");
        }
        double result = a.getValue() / b.getValue();
        return absolute(result, quadrature(a.relative(), b.relative()));
    }

    /**
     * base^exponent for an exact exponent.
     */
    public static UncertaintyValue power(UncertaintyValue base, double exponent) {
        double result = Math.pow(base.getValue(), exponent);
        return absolute(result, Math.abs(exponent) * base.relative());
    }

    /**
     * base^exponent where the exponent is uncertain too.
     *
     * @throws ValueException if the base is not positive
     */
    public static UncertaintyValue power(UncertaintyValue base, UncertaintyValue exponent) {
        double b = base.getValue();
        if (b <= 0) {
            throw new ValueException("Cannot take logarithm of non-positive number " + b);
        }
        double n = exponent.getValue();
        double result = Math.pow(b, n);
        // (dz/z)^2 = (n dx/x)^2 + (ln(x) dn)^2
        double relative = quadrature(n * base.relative(), Math.log(Math.abs(b)) * exponent.absolute() / b);
        return absolute(result, relative);
    }

    public static UncertaintyValue sqrt(UncertaintyValue x) {
        return power(x, 0.5);
    }

    public static UncertaintyValue exp(UncertaintyValue x) {
        double result = Math.exp(x.getValue());
        return new UncertaintyValue(result, result * x.absolute(), UncertaintyType.ABSOLUTE);
    }

    /**
     * @throws ValueException if x is not positive
     */
    public static UncertaintyValue log(UncertaintyValue x) {
        if (x.getValue() <= 0) {
            throw new ValueException("Cannot take logarithm of non-positive number " + x.getValue());
        }
        return new UncertaintyValue(Math.log(x.getValue()), x.relative(), UncertaintyType.ABSOLUTE);
    }

    private static UncertaintyValue absolute(double result, double relative) {
        return new UncertaintyValue(result, Math.abs(result) * relative, UncertaintyType.ABSOLUTE);
    }

    private static double quadrature(double a, double b) {
        return Math.sqrt(a * a + b * b);
    }
}
