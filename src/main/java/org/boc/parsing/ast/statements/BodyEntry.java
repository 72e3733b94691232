package org.boc.parsing.ast.statements;

import org.boc.parsing.ast.Expression;

/**
 * One entry of a block body: either {@code key: value} or a bare expression without a key.
 */
public final class BodyEntry {

    private final String key;
    private final Expression value;

    private BodyEntry(String key, Expression value) {
        this.key = key;
        this.value = value;
    }

    public static BodyEntry keyValue(String key, Expression value) {
        return new BodyEntry(key, value);
    }

    public static BodyEntry bare(Expression value) {
        return new BodyEntry(null, value);
    }

    public boolean isKeyValue() {
        return key != null;
    }

    public String getKey() {
        return key;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public String toString() {
        return key == null ? value.evaluate() : String.format("%s: %s", key, value.evaluate());
    }
}
