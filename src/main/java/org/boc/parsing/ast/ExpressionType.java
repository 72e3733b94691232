package org.boc.parsing.ast;

public enum ExpressionType {
    LITERAL("Literal"),
    IDENTIFIER("Identifier"),
    ARRAY("Array"),
    OBJECT("Object"),
    ENTITY("Entity"),
    UNCERTAINTY("Uncertainty");

    private final String tag;

    ExpressionType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
