package org.qcircuit.frontend.qasm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.qcircuit.circuit.CircuitParseException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class LexerTest {

    private static List<Token> scan(String source) {
        return new Lexer(source, "test.qasm").scanTokens();
    }

    @Test
    @DisplayName("Keywords, identifiers and punctuation are recognized")
    void recognizesStatementTokens() {
        List<Token> tokens = scan("OPENQASM 2.0;\nqreg q[2];\nCX q[0], q[1];\nmeasure q -> c;");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.OPENQASM, TokenType.REAL, TokenType.SEMICOLON,
                TokenType.QREG, TokenType.IDENTIFIER, TokenType.LBRACKET, TokenType.NNINTEGER, TokenType.RBRACKET,
                TokenType.SEMICOLON,
                TokenType.CXGATE, TokenType.IDENTIFIER, TokenType.LBRACKET, TokenType.NNINTEGER, TokenType.RBRACKET,
                TokenType.COMMA, TokenType.IDENTIFIER, TokenType.LBRACKET, TokenType.NNINTEGER, TokenType.RBRACKET,
                TokenType.SEMICOLON,
                TokenType.MEASURE, TokenType.IDENTIFIER, TokenType.ARROW, TokenType.IDENTIFIER, TokenType.SEMICOLON,
                TokenType.END_OF_FILE);
        assertThat(tokens.get(3).line()).isEqualTo(2);
        assertThat(tokens.get(1).value()).isEqualTo(2.0);
        assertThat(tokens.get(6).value()).isEqualTo(2);
    }

    @Test
    @DisplayName("Numbers with exponents are real literals")
    void scansExponents() {
        List<Token> tokens = scan("1e-3 .5 42");

        assertThat(tokens.get(0).type()).isEqualTo(TokenType.REAL);
        assertThat(tokens.get(0).value()).isEqualTo(1e-3);
        assertThat(tokens.get(1).value()).isEqualTo(0.5);
        assertThat(tokens.get(2).type()).isEqualTo(TokenType.NNINTEGER);
    }

    @Test
    @DisplayName("Comments are skipped and strings lose their quotes")
    void commentsAndStrings() {
        List<Token> tokens = scan("// leading comment\ninclude \"qelib1.inc\"; // trailing");

        assertThat(tokens).extracting(Token::type)
                .containsExactly(TokenType.INCLUDE, TokenType.STRING, TokenType.SEMICOLON, TokenType.END_OF_FILE);
        assertThat(tokens.get(1).value()).isEqualTo("qelib1.inc");
    }

    @Test
    @DisplayName("Expression keywords and both probability spellings are keywords")
    void expressionKeywords() {
        assertThat(scan("pi sin cos tan exp ln sqrt show_probabilities probabilities ^"))
                .extracting(Token::type)
                .containsExactly(TokenType.PI, TokenType.SIN, TokenType.COS, TokenType.TAN, TokenType.EXP,
                        TokenType.LN, TokenType.SQRT, TokenType.PROBABILITIES, TokenType.PROBABILITIES,
                        TokenType.POWER, TokenType.END_OF_FILE);
    }

    @Test
    @DisplayName("A single '=' is rejected")
    void rejectsSingleEquals() {
        assertThatThrownBy(() -> scan("if (c = 1)")).isInstanceOf(CircuitParseException.class);
    }

    @Test
    @DisplayName("Unterminated strings are rejected")
    void rejectsUnterminatedString() {
        assertThatThrownBy(() -> scan("include \"a.inc\n;")).isInstanceOf(CircuitParseException.class);
    }
}
