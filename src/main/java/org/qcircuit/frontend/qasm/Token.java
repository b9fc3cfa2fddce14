package org.qcircuit.frontend.qasm;

/**
 * A single token of an OpenQASM source.
 *
 * @param type     The kind of the token.
 * @param text     The exact source text.
 * @param value    The literal value: an {@link Integer} for NNINTEGER, a {@link Double} for REAL,
 *                 the unquoted content for STRING, otherwise null.
 * @param line     The 1-based line number.
 * @param column   The 1-based column number.
 * @param fileName The logical name of the source the token came from.
 */
public record Token(TokenType type, String text, Object value, int line, int column, String fileName) {

    @Override
    public String toString() {
        return type + " '" + text + "' at " + fileName + ":" + line + ":" + column;
    }
}
