package org.snrasm.compiler.frontend.lexer;

import org.snrasm.compiler.diagnostics.Diagnostic;
import org.snrasm.compiler.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that the lexer converts source text into tokens without losing
 * any character, and that malformed input becomes error tokens instead of failures.
 */
public class LexerTest {

    private static List<Token> scan(String source, DiagnosticsEngine diagnostics) {
        return new Lexer(source, diagnostics).scanTokens();
    }

    private static List<Token> significant(List<Token> tokens) {
        return tokens.stream().filter(t -> !t.type().isTrivia()).toList();
    }

    private static String concat(List<Token> tokens) {
        return tokens.stream().map(Token::text).collect(Collectors.joining());
    }

    /**
     * Verifies that a simple instruction line produces the expected significant tokens.
     */
    @Test
    @Tag("unit")
    void testInstructionTokenization() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine("test.snr");

        // Act
        List<Token> tokens = significant(scan("L1: mov $v0, 0x2A\n", diagnostics));

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.IDENTIFIER, TokenType.COLON, TokenType.IDENTIFIER, TokenType.REGISTER,
                TokenType.COMMA, TokenType.INT_NUMBER, TokenType.NEWLINE, TokenType.END_OF_FILE);
        assertThat(tokens.get(3).text()).isEqualTo("$v0");
        assertThat(tokens.get(5).text()).isEqualTo("0x2A");
    }

    /**
     * Verifies that whitespace and comments are kept as trivia so that the token texts
     * reproduce the input exactly.
     */
    @Test
    @Tag("unit")
    void testTriviaIsPreserved() {
        // Arrange
        String source = "  // heading\n/* outer /* inner */ still */ j L\t// tail\r\n";
        DiagnosticsEngine diagnostics = new DiagnosticsEngine("test.snr");

        // Act
        List<Token> tokens = scan(source, diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(concat(tokens)).isEqualTo(source);
        assertThat(tokens).extracting(Token::type)
                .contains(TokenType.LINE_COMMENT, TokenType.BLOCK_COMMENT, TokenType.WHITESPACE);
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.BLOCK_COMMENT)
                .singleElement()
                .extracting(Token::text)
                .isEqualTo("/* outer /* inner */ still */");
    }

    @Test
    @Tag("unit")
    void testKeywordsAndLineContinuation() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine("test.snr");

        List<Token> tokens = scan("function F \\\n($a)\nendfun", diagnostics);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens.get(0).isKeyword("function")).isTrue();
        assertThat(tokens).extracting(Token::type).contains(TokenType.LINE_CONTINUATION);
        assertThat(significant(tokens)).extracting(Token::type).containsExactly(
                TokenType.KEYWORD, TokenType.IDENTIFIER, TokenType.LEFT_PAREN, TokenType.REGISTER,
                TokenType.RIGHT_PAREN, TokenType.NEWLINE, TokenType.KEYWORD, TokenType.END_OF_FILE);
    }

    /**
     * Verifies that a dot only joins a real literal when a digit follows it,
     * so that {@code 2.*3} is an elementwise product.
     */
    @Test
    @Tag("unit")
    void testDotStarAfterInteger() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine("test.snr");

        // Act
        List<Token> tokens = significant(scan("2.*3 1.5", diagnostics));

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.INT_NUMBER, "2"),
                tuple(TokenType.DOT_STAR, ".*"),
                tuple(TokenType.INT_NUMBER, "3"),
                tuple(TokenType.REAL_NUMBER, "1.5"),
                tuple(TokenType.END_OF_FILE, ""));
    }

    @Test
    @Tag("unit")
    void testUnterminatedBlockCommentConsumesRestOfFile() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine("test.snr");

        List<Token> tokens = scan("j L /* open\nEXIT\n", diagnostics);

        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::message)
                .containsExactly("Missing trailing `*/` symbols to terminate the block comment");
        assertThat(tokens.get(tokens.size() - 2).text()).isEqualTo("/* open\nEXIT\n");
    }

    /**
     * Verifies that malformed tokens are reported and scanning continues after them.
     */
    @Test
    @Tag("unit")
    void testErrorTokensDoNotStopScanning() {
        // Arrange
        String source = "MSGSET 1, \"open\nmov $, 1 ? 2\n";
        DiagnosticsEngine diagnostics = new DiagnosticsEngine("test.snr");

        // Act
        List<Token> tokens = scan(source, diagnostics);

        // Assert
        assertThat(concat(tokens)).isEqualTo(source);
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::message).containsExactly(
                "Unterminated string literal",
                "Expected a register name after `$`",
                "Invalid character `?`");
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.ERROR).hasSize(3);
        assertThat(tokens.get(tokens.size() - 1).type()).isEqualTo(TokenType.END_OF_FILE);
    }
}
