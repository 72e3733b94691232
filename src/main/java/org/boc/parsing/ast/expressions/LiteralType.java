package org.boc.parsing.ast.expressions;

public enum LiteralType {
    STRING,
    NUMBER,
    BOOLEAN
}
