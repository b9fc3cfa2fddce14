package org.qcircuit.frontend.qasm;

/**
 * Kinds of tokens produced by the OpenQASM {@link Lexer}.
 */
public enum TokenType {
    // Keywords
    OPENQASM, QREG, CREG, GATE, OPAQUE, INCLUDE, BARRIER, MEASURE, RESET, IF, SNAPSHOT, PROBABILITIES,
    UGATE, CXGATE,
    // Expression keywords
    PI, SIN, COS, TAN, EXP, LN, SQRT,
    // Literals
    IDENTIFIER, NNINTEGER, REAL, STRING,
    // Punctuation and operators
    LPAREN, RPAREN, LBRACKET, RBRACKET, LBRACE, RBRACE, COMMA, SEMICOLON, ARROW, EQUALS,
    PLUS, MINUS, TIMES, DIVIDE, POWER,
    // Control
    END_OF_FILE
}
