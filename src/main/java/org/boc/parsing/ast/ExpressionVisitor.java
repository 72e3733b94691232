package org.boc.parsing.ast;

import org.boc.parsing.ast.expressions.ArrayExpression;
import org.boc.parsing.ast.expressions.EntityExpression;
import org.boc.parsing.ast.expressions.Identifier;
import org.boc.parsing.ast.expressions.Literal;
import org.boc.parsing.ast.expressions.ObjectExpression;
import org.boc.parsing.ast.expressions.UncertaintyExpression;

/**
 * One method per expression variant, so a new variant breaks every visitor at compile time.
 */
public interface ExpressionVisitor<R> {

    R visitLiteral(Literal literal);

    R visitIdentifier(Identifier identifier);

    R visitArray(ArrayExpression array);

    R visitObject(ObjectExpression object);

    R visitEntity(EntityExpression entity);

    R visitUncertainty(UncertaintyExpression uncertainty);
}
