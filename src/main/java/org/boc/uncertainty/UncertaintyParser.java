package org.boc.uncertainty;

import org.apache.commons.lang.StringUtils;
import org.boc.ValueException;
import org.boc.parsing.Lexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Reads {@code V ± U} literals and evaluates one-operator formulas over named uncertain inputs.
 *
 * The formula evaluator has no precedence and no parentheses: the formula is split at the first
 * operator character and both sides must be input names, except that the right side of {@code ^}
 * may be a number.
 */
public final class UncertaintyParser {

    private static final Logger LOG = LoggerFactory.getLogger(UncertaintyParser.class);

    private static final String ASCII_SIGN = "+/-";
    private static final String OPERATORS = "+-*/^";

    private UncertaintyParser() {
    }

    /**
     * Parses {@code "22.5 ± 0.1"}, {@code "22.5 +/- 0.1"} or a bare number (exact) into an absolute
     * uncertainty value.
     *
     * @throws ValueException if the text is not in one of those forms
     */
    public static UncertaintyValue parse(String text) {
        if (StringUtils.isBlank(text)) {
            throw new ValueException("Cannot parse uncertainty expression: '" + text + "'");
        }
        String[] parts = StringUtils.splitByWholeSeparatorPreserveAllTokens(text, String.valueOf(Lexer.UNCERTAINTY_SIGN));
        if (parts.length == 1) {
            parts = StringUtils.splitByWholeSeparatorPreserveAllTokens(text, ASCII_SIGN);
        }
        if (parts.length == 1) {
            return new UncertaintyValue(toDouble(parts[0], text), 0.0, UncertaintyType.ABSOLUTE);
        }
        if (parts.length != 2) {
            throw new ValueException("Cannot parse uncertainty expression: '" + text + "'");
        }
        return new UncertaintyValue(toDouble(parts[0], text), toDouble(parts[1], text), UncertaintyType.ABSOLUTE);
    }

    /**
     * Evaluates {@code a op b} (or {@code target = a op b}) against the named inputs.
     *
     * @throws ValueException if an operand is not an input, or the operation itself fails
     */
    public static UncertaintyValue evaluateFormula(String formula, Map<String, UncertaintyValue> inputs) {
        if (StringUtils.isBlank(formula)) {
            throw new ValueException("Cannot evaluate an empty formula");
        }
        String expression = formula;
        int assign = expression.indexOf('=');
        if (assign >= 0) {
            expression = expression.substring(assign + 1);
        }
        expression = expression.trim();

        int at = StringUtils.indexOfAny(expression, OPERATORS);
        if (at < 0) {
            return lookup(expression, inputs, formula);
        }

        char operator = expression.charAt(at);
        String leftName = expression.substring(0, at).trim();
        String rightName = expression.substring(at + 1).trim();
        LOG.debug("Evaluating {} {} {}", leftName, operator, rightName);

        UncertaintyValue left = lookup(leftName, inputs, formula);
        switch (operator) {
            case '+':
                return UncertaintyPropagator.add(left, lookup(rightName, inputs, formula));
            case '-':
                return UncertaintyPropagator.subtract(left, lookup(rightName, inputs, formula));
            case '*':
                return UncertaintyPropagator.multiply(left, lookup(rightName, inputs, formula));
            case '/':
                return UncertaintyPropagator.divide(left, lookup(rightName, inputs, formula));
            default:
                return power(left, rightName, inputs, formula);
        }
    }

    private static UncertaintyValue power(UncertaintyValue base, String exponent,
                                          Map<String, UncertaintyValue> inputs, String formula) {
        if (inputs.containsKey(exponent)) {
            return UncertaintyPropagator.power(base, inputs.get(exponent));
        }
        try {
            return UncertaintyPropagator.power(base, Double.parseDouble(exponent));
        }
        catch (NumberFormatException e) {
            throw new ValueException("Unknown exponent '" + exponent + "' in formula: " + formula, e);
        }
    }

    private static UncertaintyValue lookup(String name, Map<String, UncertaintyValue> inputs, String formula) {
        UncertaintyValue value = inputs.get(name);
        if (value == null) {
            throw new ValueException("Unknown input '" + name + "' in formula: " + formula);
        }
        return value;
    }

    private static double toDouble(String part, String text) {
        try {
            return Double.parseDouble(part.trim());
        }
        catch (NumberFormatException e) {
            throw new ValueException("Cannot parse uncertainty expression: '" + text + "'", e);
        }
    }
}
