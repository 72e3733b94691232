package org.boc.parsing.ast.expressions;

import org.apache.commons.lang.StringUtils;
import org.boc.parsing.ast.Expression;
import org.boc.parsing.ast.ExpressionType;
import org.boc.parsing.ast.ExpressionVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@code { key: value ... }} literal. Keys keep their source order, a repeated key keeps its last value.
 */
public class ObjectExpression extends AbstractExpression {

    private final Map<String, Expression> properties;

    public ObjectExpression(Map<String, Expression> properties) {
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<String, Expression>(properties));
    }

    public Map<String, Expression> getProperties() {
        return properties;
    }

    public Expression get(String key) {
        return properties.get(key);
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.OBJECT;
    }

    @Override
    public String evaluate() {
        List<String> rendered = new ArrayList<String>(properties.size());
        for (Map.Entry<String, Expression> entry : properties.entrySet()) {
            rendered.add(String.format("%s: %s", entry.getKey(), entry.getValue().evaluate()));
        }
        return "{" + StringUtils.join(rendered, ", ") + "}";
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitObject(this);
    }
}
