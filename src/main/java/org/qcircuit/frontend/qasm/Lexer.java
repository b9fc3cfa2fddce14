package org.qcircuit.frontend.qasm;

import org.qcircuit.circuit.CircuitParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns OpenQASM 2.0 source text into a list of {@link Token}s ending with
 * {@link TokenType#END_OF_FILE}. Line comments ({@code //}) and whitespace are dropped.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("OPENQASM", TokenType.OPENQASM),
            Map.entry("qreg", TokenType.QREG),
            Map.entry("creg", TokenType.CREG),
            Map.entry("gate", TokenType.GATE),
            Map.entry("opaque", TokenType.OPAQUE),
            Map.entry("include", TokenType.INCLUDE),
            Map.entry("barrier", TokenType.BARRIER),
            Map.entry("measure", TokenType.MEASURE),
            Map.entry("reset", TokenType.RESET),
            Map.entry("if", TokenType.IF),
            Map.entry("snapshot", TokenType.SNAPSHOT),
            Map.entry("show_probabilities", TokenType.PROBABILITIES),
            Map.entry("probabilities", TokenType.PROBABILITIES),
            Map.entry("U", TokenType.UGATE),
            Map.entry("CX", TokenType.CXGATE),
            Map.entry("pi", TokenType.PI),
            Map.entry("sin", TokenType.SIN),
            Map.entry("cos", TokenType.COS),
            Map.entry("tan", TokenType.TAN),
            Map.entry("exp", TokenType.EXP),
            Map.entry("ln", TokenType.LN),
            Map.entry("sqrt", TokenType.SQRT));

    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startColumn = 1;

    /**
     * @param source The source text.
     * @param fileName The logical file name recorded in every token.
     */
    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    /**
     * Scans the whole source.
     * @return The tokens, terminated by an END_OF_FILE token.
     * @throws CircuitParseException on a character that starts no token or an unterminated string.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column, fileName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(' -> addToken(TokenType.LPAREN);
            case ')' -> addToken(TokenType.RPAREN);
            case '[' -> addToken(TokenType.LBRACKET);
            case ']' -> addToken(TokenType.RBRACKET);
            case '{' -> addToken(TokenType.LBRACE);
            case '}' -> addToken(TokenType.RBRACE);
            case ',' -> addToken(TokenType.COMMA);
            case ';' -> addToken(TokenType.SEMICOLON);
            case '+' -> addToken(TokenType.PLUS);
            case '*' -> addToken(TokenType.TIMES);
            case '^' -> addToken(TokenType.POWER);
            case '-' -> addToken(match('>') ? TokenType.ARROW : TokenType.MINUS);
            case '=' -> {
                if (!match('=')) {
                    throw error("Expected '==' but found single '='");
                }
                addToken(TokenType.EQUALS);
            }
            case '/' -> {
                if (match('/')) {
                    while (peek() != '\n' && !isAtEnd()) {
                        advance();
                    }
                } else {
                    addToken(TokenType.DIVIDE);
                }
            }
            case ' ', '\r', '\t', '\n' -> {
                // whitespace
            }
            case '"' -> string();
            default -> {
                if (isDigit(c) || (c == '.' && isDigit(peek()))) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw error("Unexpected character: " + c);
                }
            }
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) {
            advance();
        }
        String text = source.substring(start, current);
        addToken(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private void number() {
        boolean real = source.charAt(start) == '.';
        while (isDigit(peek())) {
            advance();
        }
        if (peek() == '.') {
            real = true;
            advance();
            while (isDigit(peek())) {
                advance();
            }
        }
        if (peek() == 'e' || peek() == 'E') {
            char sign = peekNext();
            if (isDigit(sign) || ((sign == '+' || sign == '-') && isDigit(peekAt(2)))) {
                real = true;
                advance();
                if (sign == '+' || sign == '-') {
                    advance();
                }
                while (isDigit(peek())) {
                    advance();
                }
            }
        }
        String text = source.substring(start, current);
        if (real) {
            addToken(TokenType.REAL, Double.parseDouble(text));
        } else {
            try {
                addToken(TokenType.NNINTEGER, Integer.parseInt(text));
            } catch (NumberFormatException e) {
                throw error("Integer literal out of range: " + text);
            }
        }
    }

    private void string() {
        while (peek() != '"' && !isAtEnd()) {
            if (peek() == '\n') {
                throw error("Unterminated string");
            }
            advance();
        }
        if (isAtEnd()) {
            throw error("Unterminated string");
        }
        advance();
        addToken(TokenType.STRING, source.substring(start + 1, current - 1));
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) {
            return false;
        }
        advance();
        return true;
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        int index = current + offset;
        return index >= source.length() ? '\0' : source.charAt(index);
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object value) {
        tokens.add(new Token(type, source.substring(start, current), value, line, startColumn, fileName));
    }

    private CircuitParseException error(String message) {
        return new CircuitParseException(message, fileName, line);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
