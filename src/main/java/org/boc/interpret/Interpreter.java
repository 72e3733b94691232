package org.boc.interpret;

import org.apache.commons.lang.StringUtils;
import org.boc.ValueException;
import org.boc.belief.BeliefStore;
import org.boc.belief.DecayCurve;
import org.boc.belief.Evidence;
import org.boc.helper.Tuple;
import org.boc.parsing.DecaySpecification;
import org.boc.parsing.Lexer;
import org.boc.parsing.RecursiveDescentParser;
import org.boc.parsing.ast.Expression;
import org.boc.parsing.ast.Expressions;
import org.boc.parsing.ast.Program;
import org.boc.parsing.ast.Statement;
import org.boc.parsing.ast.StatementType;
import org.boc.parsing.ast.StatementVisitor;
import org.boc.parsing.ast.expressions.Identifier;
import org.boc.parsing.ast.expressions.Literal;
import org.boc.parsing.ast.expressions.UncertaintyExpression;
import org.boc.parsing.ast.statements.AgentCoordination;
import org.boc.parsing.ast.statements.Assignment;
import org.boc.parsing.ast.statements.Belief;
import org.boc.parsing.ast.statements.CalculateWithUncertainty;
import org.boc.parsing.ast.statements.ConfidenceDecay;
import org.boc.parsing.ast.statements.Intent;
import org.boc.parsing.ast.statements.Provenance;
import org.boc.parsing.ast.statements.ReasoningContext;
import org.boc.parsing.ast.statements.SelfCapability;
import org.boc.parsing.ast.statements.SharedState;
import org.boc.parsing.ast.statements.StructuredKnowledge;
import org.boc.parsing.ast.statements.UpdateBelief;
import org.boc.uncertainty.UncertaintyParser;
import org.boc.uncertainty.UncertaintyType;
import org.boc.uncertainty.UncertaintyValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes parsed statements into a {@link BeliefStore} and the uncertainty engine.
 *
 * A statement with invalid values is rejected and the run carries on with the next one. Lexer and
 * parser errors are not caught here: {@link #interpret(String)} either parses the whole source or
 * throws.
 */
public class Interpreter {

    private static final Logger LOG = LoggerFactory.getLogger(Interpreter.class);

    public static final String FACT = "fact";
    public static final String SOURCE = "source";
    public static final String TIMESTAMP = "timestamp";
    public static final String CERTAINTY_DECAY = "certainty_decay";

    private final BeliefStore store;

    public Interpreter(BeliefStore store) {
        this.store = store;
    }

    public BeliefStore getStore() {
        return store;
    }

    public InterpretationResult interpret(String source) {
        return interpret(new RecursiveDescentParser(new Lexer(source), store.getClock()).parseProgram());
    }

    public InterpretationResult interpret(Program program) {
        Run run = new Run();
        List<StatementOutcome> outcomes = new ArrayList<StatementOutcome>();
        for (Statement statement : program.getStatements()) {
            StatementOutcome outcome;
            try {
                outcome = statement.accept(run);
            }
            catch (ValueException e) {
                LOG.warn("Rejected {} statement: {}", statement.getType().tag(), e.getMessage());
                outcome = StatementOutcome.rejected(statement.getType(), e.getMessage());
            }
            LOG.debug("{}", outcome);
            outcomes.add(outcome);
        }

        InterpretationResult result = new InterpretationResult(outcomes, run.analyses, run.values);
        LOG.info("Interpreted {} statements: {} applied, {} skipped, {} rejected", outcomes.size(),
                result.count(StatementOutcome.Status.APPLIED), result.count(StatementOutcome.Status.SKIPPED),
                result.count(StatementOutcome.Status.REJECTED));
        return result;
    }

    /**
     * State of one {@link #interpret(Program)} call.
     */
    private class Run implements StatementVisitor<StatementOutcome> {

        private final Map<String, UncertaintyValue> values = new LinkedHashMap<String, UncertaintyValue>();
        private final List<UncertaintyAnalysis> analyses = new ArrayList<UncertaintyAnalysis>();

        @Override
        public StatementOutcome visitBelief(Belief belief) {
            Double confidence = Expressions.asNumber(belief.getConfidence());
            String fact = Expressions.asFreeText(belief.findValue(FACT));
            if (confidence == null || fact == null) {
                return StatementOutcome.skipped(StatementType.BELIEF, "no numeric confidence and fact to track");
            }

            DecayCurve curve = store.getConfiguration().getDecayCurve();
            double rate = store.getConfiguration().getDecayRate();
            Duration period = store.getConfiguration().getDecayPeriod();
            String decay = Expressions.asFreeText(belief.findValue(CERTAINTY_DECAY));
            if (decay != null) {
                Tuple<DecayCurve, Double> parsed = DecaySpecification.parseCurve(decay);
                curve = parsed.getA();
                rate = parsed.getB();
                period = DecaySpecification.parseUnit(decay);
            }

            Map<String, Object> metadata = new LinkedHashMap<String, Object>();
            metadata.put(FACT, fact);
            putText(metadata, SOURCE, belief.findValue(SOURCE));
            putText(metadata, TIMESTAMP, belief.findValue(TIMESTAMP));
            putText(metadata, CERTAINTY_DECAY, belief.findValue(CERTAINTY_DECAY));

            store.create(fact, confidence, curve, rate, period, metadata);
            return StatementOutcome.applied(StatementType.BELIEF,
                    String.format("created %s at %s, %s %s per %s", fact, confidence, curve, rate, period));
        }

        @Override
        public StatementOutcome visitUpdateBelief(UpdateBelief update) {
            Evidence evidence = update.toEvidence();
            if (!store.update(update.getBeliefName(), evidence.getConfidence(), evidence)) {
                return StatementOutcome.skipped(StatementType.UPDATE_BELIEF, "unknown belief " + update.getBeliefName());
            }
            return StatementOutcome.applied(StatementType.UPDATE_BELIEF, String.format("%s now %s",
                    update.getBeliefName(), store.getCurrentConfidence(update.getBeliefName()).getAsDouble()));
        }

        @Override
        public StatementOutcome visitConfidenceDecay(ConfidenceDecay decay) {
            if (!store.configureDecay(decay.getBeliefName(), decay.getCurve(), decay.getRate(), decay.getPeriod())) {
                return StatementOutcome.skipped(StatementType.CONFIDENCE_DECAY, "unknown belief " + decay.getBeliefName());
            }
            return StatementOutcome.applied(StatementType.CONFIDENCE_DECAY, String.format("%s decays %s %s per %s",
                    decay.getBeliefName(), decay.getCurve(), decay.getRate(), decay.getPeriod()));
        }

        @Override
        public StatementOutcome visitAssignment(Assignment assignment) {
            Expression value = assignment.getValue();
            UncertaintyValue bound = null;
            if (value instanceof UncertaintyExpression && ((UncertaintyExpression) value).hasValue()) {
                bound = ((UncertaintyExpression) value).toUncertaintyValue();
            }
            else if (value instanceof Literal && ((Literal) value).isNumber()) {
                bound = new UncertaintyValue(((Literal) value).asDouble(), 0.0, UncertaintyType.ABSOLUTE);
            }
            if (bound == null) {
                return StatementOutcome.skipped(StatementType.ASSIGNMENT, assignment.getKey() + " is not numeric");
            }
            values.put(assignment.getKey(), bound);
            return StatementOutcome.applied(StatementType.ASSIGNMENT, assignment.getKey() + " = " + bound);
        }

        @Override
        public StatementOutcome visitCalculateWithUncertainty(CalculateWithUncertainty calculation) {
            String formula = calculation.getFormula();
            Map<String, UncertaintyValue> inputs = new LinkedHashMap<String, UncertaintyValue>();
            Map<String, Double> unresolved = new LinkedHashMap<String, Double>();
            for (Map.Entry<String, Expression> input : calculation.getInputUncertainties().entrySet()) {
                resolveInput(input.getKey(), input.getValue(), inputs, unresolved);
            }

            if (formula == null || !unresolved.isEmpty() || inputs.isEmpty()) {
                analyses.add(new UncertaintyAnalysis(formula, inputs, unresolved, null));
                String reason = formula == null ? "no formula"
                        : inputs.isEmpty() && unresolved.isEmpty() ? "no input uncertainties"
                        : "no base value for " + unresolved.keySet();
                return StatementOutcome.skipped(StatementType.CALCULATE_WITH_UNCERTAINTY, reason);
            }

            Map<String, UncertaintyValue> known = new LinkedHashMap<String, UncertaintyValue>(values);
            known.putAll(inputs);
            UncertaintyValue result;
            try {
                result = UncertaintyParser.evaluateFormula(formula, known);
            }
            catch (ValueException e) {
                analyses.add(new UncertaintyAnalysis(formula, inputs, unresolved, null));
                throw e;
            }
            analyses.add(new UncertaintyAnalysis(formula, inputs, unresolved, result));

            String target = StringUtils.substringBefore(formula, "=").trim();
            if (formula.contains("=") && !target.isEmpty()) {
                values.put(target, result);
            }
            return StatementOutcome.applied(StatementType.CALCULATE_WITH_UNCERTAINTY, formula + " gives " + result);
        }

        private void resolveInput(String name, Expression expression, Map<String, UncertaintyValue> inputs,
                                  Map<String, Double> unresolved) {
            if (expression instanceof UncertaintyExpression) {
                UncertaintyExpression uncertainty = (UncertaintyExpression) expression;
                if (uncertainty.hasValue()) {
                    inputs.put(name, uncertainty.toUncertaintyValue());
                }
                else {
                    bindBound(name, uncertainty.getUncertainty(), inputs, unresolved);
                }
            }
            else if (expression instanceof Literal && ((Literal) expression).isNumber()) {
                inputs.put(name, new UncertaintyValue(((Literal) expression).asDouble(), 0.0, UncertaintyType.ABSOLUTE));
            }
            else if (expression instanceof Literal && ((Literal) expression).isString()) {
                String text = ((Literal) expression).getValue().trim();
                if (StringUtils.startsWith(text, String.valueOf(Lexer.UNCERTAINTY_SIGN))) {
                    bindBound(name, UncertaintyParser.parse(text.substring(1)).getValue(), inputs, unresolved);
                }
                else {
                    inputs.put(name, UncertaintyParser.parse(text));
                }
            }
            else if (expression instanceof Identifier && values.containsKey(((Identifier) expression).getName())) {
                inputs.put(name, values.get(((Identifier) expression).getName()));
            }
            else {
                throw new ValueException("Input " + name + " is not an uncertain value: " + expression);
            }
        }

        // a bare ±u takes its base value from an earlier assignment of the same name
        private void bindBound(String name, double bound, Map<String, UncertaintyValue> inputs,
                               Map<String, Double> unresolved) {
            UncertaintyValue base = values.get(name);
            if (base == null) {
                unresolved.put(name, bound);
            }
            else {
                inputs.put(name, new UncertaintyValue(base.getValue(), bound, UncertaintyType.ABSOLUTE));
            }
        }

        private void putText(Map<String, Object> metadata, String key, Expression value) {
            if (value != null) {
                metadata.put(key, Expressions.asText(value));
            }
        }

        @Override
        public StatementOutcome visitReasoningContext(ReasoningContext context) {
            return descriptive(context);
        }

        @Override
        public StatementOutcome visitIntent(Intent intent) {
            return descriptive(intent);
        }

        @Override
        public StatementOutcome visitSharedState(SharedState sharedState) {
            return descriptive(sharedState);
        }

        @Override
        public StatementOutcome visitSelfCapability(SelfCapability capability) {
            return descriptive(capability);
        }

        @Override
        public StatementOutcome visitStructuredKnowledge(StructuredKnowledge knowledge) {
            return descriptive(knowledge);
        }

        @Override
        public StatementOutcome visitAgentCoordination(AgentCoordination coordination) {
            return descriptive(coordination);
        }

        @Override
        public StatementOutcome visitProvenance(Provenance provenance) {
            return descriptive(provenance);
        }

        private StatementOutcome descriptive(Statement statement) {
            return StatementOutcome.skipped(statement.getType(), "descriptive, no store effect");
        }
    }
}
