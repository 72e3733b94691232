package org.boc.parsing.ast.expressions;

import org.boc.parsing.ast.Expression;
import org.boc.parsing.ast.ExpressionType;
import org.boc.parsing.ast.ExpressionVisitor;

/**
 * {@code entity(name, { ... })}
 */
public class EntityExpression extends AbstractExpression {

    private final Expression name;
    private final ObjectExpression properties;

    public EntityExpression(Expression name, ObjectExpression properties) {
        this.name = name;
        this.properties = properties;
    }

    public Expression getName() {
        return name;
    }

    public ObjectExpression getProperties() {
        return properties;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.ENTITY;
    }

    @Override
    public String evaluate() {
        return String.format("entity(%s, %s)", name.evaluate(), properties.evaluate());
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitEntity(this);
    }
}
