package org.boc;

/**
 * Raised when a caller supplies a value outside its domain: a confidence outside [0, 1], a negative
 * uncertainty, a zero divisor, the logarithm of a non-positive number and so on.
 * Computed values are clamped instead, they never raise this.
 */
public class ValueException extends BocException {

    public ValueException(String message) {
        super(message);
    }

    public ValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
