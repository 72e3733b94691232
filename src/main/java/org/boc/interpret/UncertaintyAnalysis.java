package org.boc.interpret;

import org.boc.uncertainty.UncertaintyValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The inputs and, when every input has a base value, the propagated result of one
 * {@code calculate_with_uncertainty} block.
 */
public final class UncertaintyAnalysis {

    private final String formula;
    private final Map<String, UncertaintyValue> inputs;
    private final Map<String, Double> unresolvedBounds;
    private final UncertaintyValue result;

    UncertaintyAnalysis(String formula, Map<String, UncertaintyValue> inputs, Map<String, Double> unresolvedBounds,
                        UncertaintyValue result) {
        this.formula = formula;
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<String, UncertaintyValue>(inputs));
        this.unresolvedBounds = Collections.unmodifiableMap(new LinkedHashMap<String, Double>(unresolvedBounds));
        this.result = result;
    }

    public String getFormula() {
        return formula;
    }

    /**
     * Inputs with both a base value and an uncertainty.
     */
    public Map<String, UncertaintyValue> getInputs() {
        return inputs;
    }

    /**
     * Absolute uncertainty of inputs written as a bare {@code ±u} with no known base value.
     */
    public Map<String, Double> getUnresolvedBounds() {
        return unresolvedBounds;
    }

    public Set<String> getInputNames() {
        Set<String> names = new LinkedHashSet<String>(inputs.keySet());
        names.addAll(unresolvedBounds.keySet());
        return names;
    }

    /**
     * A formula and at least one input are present.
     */
    public boolean isPropagationPossible() {
        return formula != null && !getInputNames().isEmpty();
    }

    public boolean hasResult() {
        return result != null;
    }

    /**
     * The propagated value, null unless the formula could be evaluated.
     */
    public UncertaintyValue getResult() {
        return result;
    }

    @Override
    public String toString() {
        return String.format("UncertaintyAnalysis{%s, inputs=%s, unresolved=%s, result=%s}",
                formula, inputs, unresolvedBounds, result);
    }
}
