package org.boc.interpret;

import org.boc.uncertainty.UncertaintyValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything an {@link Interpreter} run produced, outcomes in statement order.
 */
public final class InterpretationResult {

    private final List<StatementOutcome> outcomes;
    private final List<UncertaintyAnalysis> analyses;
    private final Map<String, UncertaintyValue> values;

    InterpretationResult(List<StatementOutcome> outcomes, List<UncertaintyAnalysis> analyses,
                         Map<String, UncertaintyValue> values) {
        this.outcomes = Collections.unmodifiableList(new ArrayList<StatementOutcome>(outcomes));
        this.analyses = Collections.unmodifiableList(new ArrayList<UncertaintyAnalysis>(analyses));
        this.values = Collections.unmodifiableMap(new LinkedHashMap<String, UncertaintyValue>(values));
    }

    public List<StatementOutcome> getOutcomes() {
        return outcomes;
    }

    public StatementOutcome getOutcome(int index) {
        return outcomes.get(index);
    }

    public List<UncertaintyAnalysis> getAnalyses() {
        return analyses;
    }

    /**
     * Numeric and uncertain values bound by assignments.
     */
    public Map<String, UncertaintyValue> getValues() {
        return values;
    }

    public int count(StatementOutcome.Status status) {
        int count = 0;
        for (StatementOutcome outcome : outcomes) {
            if (outcome.getStatus() == status) {
                count++;
            }
        }
        return count;
    }
}
