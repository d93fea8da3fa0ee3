package org.snrasm.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Punctuation.
    COMMA(","),
    LEFT_PAREN("("),
    RIGHT_PAREN(")"),
    LEFT_BRACE("{"),
    RIGHT_BRACE("}"),
    LEFT_BRACKET("["),
    RIGHT_BRACKET("]"),
    LESS("<"),
    GREATER(">"),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),
    SHIFT_LEFT("<<"),
    SHIFT_RIGHT(">>"),
    TILDE("~"),
    COLON(":"),
    EQUAL("="),
    EQUAL_EQUAL("=="),
    FAT_ARROW("=>"),
    BANG("!"),
    BANG_EQUAL("!="),
    MINUS("-"),
    AMP("&"),
    AMP_AMP("&&"),
    PIPE("|"),
    PIPE_PIPE("||"),
    PLUS("+"),
    STAR("*"),
    CARET("^"),
    DOT_STAR(".*"),
    DOT_SLASH("./"),
    SLASH("/"),

    // Literals.
    /** An identifier, such as a mnemonic, label or constant name. */
    IDENTIFIER(null),
    /** One of {@code function endfun subroutine endsub def}. */
    KEYWORD(null),
    /** A register or register alias, such as {@code $v0} or {@code $count}. */
    REGISTER(null),
    /** An integer literal in decimal, hex, octal or binary notation. */
    INT_NUMBER(null),
    /** A fixed point literal such as {@code 1.5}. */
    REAL_NUMBER(null),
    /** A quoted string literal. */
    STRING(null),

    /** A newline character. Newlines terminate statements. */
    NEWLINE(null),

    // Trivia.
    WHITESPACE(null),
    LINE_COMMENT(null),
    BLOCK_COMMENT(null),
    /** A backslash directly followed by a line break. */
    LINE_CONTINUATION(null),

    /** Represents an unexpected or malformed piece of input. */
    ERROR(null),
    /** Represents the end of the source file. */
    END_OF_FILE(null);

    private final String symbol;

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the fixed spelling of a punctuation token, or {@code null} for variable tokens.
     * @return The spelling.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Trivia tokens carry no meaning for the parser but are kept in the syntax tree.
     * @return {@code true} for whitespace, comments and line continuations.
     */
    public boolean isTrivia() {
        return this == WHITESPACE || this == LINE_COMMENT || this == BLOCK_COMMENT || this == LINE_CONTINUATION;
    }

    /**
     * Human-readable description for diagnostics.
     * @return The spelling in backticks for punctuation, otherwise a lower-case name.
     */
    public String describe() {
        if (symbol != null) {
            return "`" + symbol + "`";
        }
        return switch (this) {
            case END_OF_FILE -> "end of file";
            case NEWLINE -> "end of line";
            case INT_NUMBER, REAL_NUMBER -> "number";
            default -> name().toLowerCase().replace('_', ' ');
        };
    }
}
