package org.boc.parsing.ast.statements;

import org.boc.parsing.ast.Expression;
import org.boc.parsing.ast.Expressions;
import org.boc.parsing.ast.StatementType;
import org.boc.parsing.ast.StatementVisitor;
import org.boc.parsing.ast.expressions.ObjectExpression;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * {@code calculate_with_uncertainty { formula: "a * b" input_uncertainties: { a: 2 ±0.1, b: ±0.2 } }}
 */
public class CalculateWithUncertainty extends BlockStatement {

    public static final String FORMULA = "formula";
    public static final String INPUT_UNCERTAINTIES = "input_uncertainties";

    public CalculateWithUncertainty(Map<String, Expression> attributes, List<BodyEntry> body) {
        super(attributes, body);
    }

    /**
     * The formula text, null when the body has no usable {@code formula} entry.
     */
    public String getFormula() {
        return Expressions.asFreeText(findValue(FORMULA));
    }

    /**
     * Input name to its uncertainty expression, in source order.
     */
    public Map<String, Expression> getInputUncertainties() {
        Expression inputs = findValue(INPUT_UNCERTAINTIES);
        if (inputs instanceof ObjectExpression) {
            return ((ObjectExpression) inputs).getProperties();
        }
        return Collections.emptyMap();
    }

    @Override
    public StatementType getType() {
        return StatementType.CALCULATE_WITH_UNCERTAINTY;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitCalculateWithUncertainty(this);
    }
}
