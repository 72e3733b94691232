package org.boc.parsing;

/**
 * Token classes produced by the {@link Lexer}.
 */
public enum TokenType {
    // literals
    IDENTIFIER,
    NUMBER,
    STRING,
    BOOLEAN,
    UNCERTAINTY,

    // keywords
    BELIEF,
    REASONING_CONTEXT,
    INTENT,
    SHARED_STATE,
    SELF_CAPABILITY,
    CALCULATE_WITH_UNCERTAINTY,
    STRUCTURED_KNOWLEDGE,
    ENTITY,
    UPDATE_BELIEF,
    CONFIDENCE_DECAY,
    AGENT_COORDINATION,
    PROVENANCE,

    // operators
    ASSIGN,
    LAMBDA,
    ACCESS,
    RANGE,

    // delimiters
    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    LPAREN,
    RPAREN,
    COMMA,
    COLON,
    SEMICOLON,
    AT,

    EOF
}
