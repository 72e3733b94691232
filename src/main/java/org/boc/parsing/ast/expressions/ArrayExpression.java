package org.boc.parsing.ast.expressions;

import org.apache.commons.lang.StringUtils;
import org.boc.parsing.ast.Expression;
import org.boc.parsing.ast.ExpressionType;
import org.boc.parsing.ast.ExpressionVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ArrayExpression extends AbstractExpression {

    private final List<Expression> items;

    public ArrayExpression(List<Expression> items) {
        this.items = Collections.unmodifiableList(new ArrayList<Expression>(items));
    }

    public List<Expression> getItems() {
        return items;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.ARRAY;
    }

    @Override
    public String evaluate() {
        List<String> rendered = new ArrayList<String>(items.size());
        for (Expression item : items) {
            rendered.add(item.evaluate());
        }
        return "[" + StringUtils.join(rendered, ", ") + "]";
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitArray(this);
    }
}
