package org.snrasm.compiler.frontend.lexer;

import org.snrasm.compiler.diagnostics.DiagnosticsEngine;
import org.snrasm.compiler.diagnostics.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * The lexer never fails: malformed input becomes {@link TokenType#ERROR} tokens and a
 * diagnostic, and scanning continues. Whitespace and comments are kept as trivia tokens
 * so the token list covers the input without gaps.
 */
public class Lexer {

    /** The reserved words of the language. */
    public static final Set<String> KEYWORDS = Set.of("function", "endfun", "subroutine", "endsub", "def");

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\r' -> {
                while (peek() == ' ' || peek() == '\t' || peek() == '\r') advance();
                addToken(TokenType.WHITESPACE);
            }
            case '\n' -> addToken(TokenType.NEWLINE);
            case '\\' -> lineContinuation();
            case '"' -> string();
            case '$' -> register();
            case ',' -> addToken(TokenType.COMMA);
            case '(' -> addToken(TokenType.LEFT_PAREN);
            case ')' -> addToken(TokenType.RIGHT_PAREN);
            case '{' -> addToken(TokenType.LEFT_BRACE);
            case '}' -> addToken(TokenType.RIGHT_BRACE);
            case '[' -> addToken(TokenType.LEFT_BRACKET);
            case ']' -> addToken(TokenType.RIGHT_BRACKET);
            case '~' -> addToken(TokenType.TILDE);
            case ':' -> addToken(TokenType.COLON);
            case '-' -> addToken(TokenType.MINUS);
            case '+' -> addToken(TokenType.PLUS);
            case '*' -> addToken(TokenType.STAR);
            case '^' -> addToken(TokenType.CARET);
            case '<' -> addToken(match('=') ? TokenType.LESS_EQUAL : match('<') ? TokenType.SHIFT_LEFT : TokenType.LESS);
            case '>' -> addToken(match('=') ? TokenType.GREATER_EQUAL : match('>') ? TokenType.SHIFT_RIGHT : TokenType.GREATER);
            case '=' -> addToken(match('=') ? TokenType.EQUAL_EQUAL : match('>') ? TokenType.FAT_ARROW : TokenType.EQUAL);
            case '!' -> addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
            case '&' -> addToken(match('&') ? TokenType.AMP_AMP : TokenType.AMP);
            case '|' -> addToken(match('|') ? TokenType.PIPE_PIPE : TokenType.PIPE);
            case '.' -> {
                if (match('*')) {
                    addToken(TokenType.DOT_STAR);
                } else if (match('/')) {
                    addToken(TokenType.DOT_SLASH);
                } else {
                    invalidCharacter(c);
                }
            }
            case '/' -> {
                if (match('/')) {
                    while (peek() != '\n' && !isAtEnd()) advance();
                    addToken(TokenType.LINE_COMMENT);
                } else if (match('*')) {
                    blockComment();
                } else {
                    addToken(TokenType.SLASH);
                }
            }
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    invalidCharacter(c);
                }
            }
        }
    }

    private void lineContinuation() {
        if (match('\n')) {
            addToken(TokenType.LINE_CONTINUATION);
        } else if (peek() == '\r' && peekNext() == '\n') {
            current += 2;
            addToken(TokenType.LINE_CONTINUATION);
        } else {
            invalidCharacter('\\');
        }
    }

    private void blockComment() {
        int depth = 1;
        while (depth > 0 && !isAtEnd()) {
            char c = advance();
            if (c == '/' && peek() == '*') {
                advance();
                depth++;
            } else if (c == '*' && peek() == '/') {
                advance();
                depth--;
            }
        }
        if (depth > 0) {
            diagnostics.reportError("Missing trailing `*/` symbols to terminate the block comment",
                    new Span(start, current));
        }
        addToken(TokenType.BLOCK_COMMENT);
    }

    private void string() {
        while (peek() != '"' && peek() != '\n' && !isAtEnd()) {
            if (peek() == '\\' && peekNext() != '\n' && peekNext() != '\0') {
                advance();
                char escape = advance();
                if (escape != '\\' && escape != '"' && escape != 'n') {
                    diagnostics.reportError("Unknown character escape: `\\" + escape + "`",
                            new Span(current - 2, current));
                }
            } else {
                advance();
            }
        }
        if (peek() != '"') {
            diagnostics.reportError("Unterminated string literal", new Span(start, current));
            addToken(TokenType.ERROR);
            return;
        }
        advance();
        addToken(TokenType.STRING);
    }

    private void register() {
        if (!isIdentifierPart(peek())) {
            diagnostics.reportError("Expected a register name after `$`", new Span(start, current));
            addToken(TokenType.ERROR);
            return;
        }
        while (isIdentifierPart(peek())) advance();
        addToken(TokenType.REGISTER);
    }

    private void identifier() {
        while (isIdentifierPart(peek())) advance();
        String text = source.substring(start, current);
        addToken(KEYWORDS.contains(text) ? TokenType.KEYWORD : TokenType.IDENTIFIER);
    }

    private void number() {
        TokenType type = TokenType.INT_NUMBER;
        if (previous() == '0' && isRadixPrefix(peek())) {
            advance();
            while (isIdentifierPart(peek())) advance();
        } else {
            while (isDigit(peek()) || peek() == '_') advance();
            if (peek() == '.' && isDigit(peekNext())) {
                advance();
                while (isDigit(peek()) || peek() == '_') advance();
                type = TokenType.REAL_NUMBER;
            }
            // a number running into letters is one malformed literal, not two tokens
            while (isIdentifierPart(peek())) advance();
        }

        String text = source.substring(start, current);
        try {
            if (type == TokenType.INT_NUMBER) {
                Literals.parseInteger(text);
            } else {
                Literals.parseReal(text);
            }
            addToken(type);
        } catch (NumberFormatException | ArithmeticException e) {
            String reason = e.getMessage() != null && e.getMessage().startsWith("Real literal")
                    ? e.getMessage() + ": `" + text + "`"
                    : "Invalid number literal: `" + text + "`";
            diagnostics.reportError(reason, new Span(start, current));
            addToken(TokenType.ERROR);
        }
    }

    private void invalidCharacter(char c) {
        diagnostics.reportError("Invalid character `" + c + "`", new Span(start, current));
        addToken(TokenType.ERROR);
    }

    private static boolean isRadixPrefix(char c) {
        return c == 'x' || c == 'X' || c == 'o' || c == 'O' || c == 'b' || c == 'B';
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private char previous() {
        return source.charAt(current - 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private void addToken(TokenType type) {
        tokens.add(new Token(type, source.substring(start, current), start));
    }
}
